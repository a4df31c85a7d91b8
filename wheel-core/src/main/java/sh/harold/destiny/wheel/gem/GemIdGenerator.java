package sh.harold.destiny.wheel.gem;

import java.time.Clock;
import java.util.Objects;

/**
 * Issues gem ids as decimal strings that sort by creation time. Ids from one
 * generator are strictly increasing even when the clock stalls or steps back.
 */
public class GemIdGenerator {

    private static final int SEQUENCE_SPACE = 1000;

    private final Clock clock;
    private long last;

    public GemIdGenerator() {
        this(Clock.systemUTC());
    }

    public GemIdGenerator(Clock clock) {
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    public synchronized String nextId() {
        long candidate = clock.millis() * SEQUENCE_SPACE;
        last = Math.max(candidate, last + 1);
        return Long.toString(last);
    }
}
