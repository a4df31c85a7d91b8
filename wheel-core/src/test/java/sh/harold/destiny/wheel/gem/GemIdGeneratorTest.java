package sh.harold.destiny.wheel.gem;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import sh.harold.destiny.wheel.MutableClock;

import static org.assertj.core.api.Assertions.*;

@DisplayName("GemIdGenerator Tests")
class GemIdGeneratorTest {

    @Test
    @DisplayName("Should keep ids increasing when the clock stalls or steps back")
    void shouldKeepIdsIncreasing() {
        MutableClock clock = new MutableClock(5_000);
        GemIdGenerator ids = new GemIdGenerator(clock);

        long first = Long.parseLong(ids.nextId());
        long second = Long.parseLong(ids.nextId());
        clock.advance(-1_000);
        long third = Long.parseLong(ids.nextId());

        assertThat(first).isEqualTo(5_000_000L);
        assertThat(second).isEqualTo(first + 1);
        assertThat(third).isEqualTo(second + 1);
    }
}
