package sh.harold.destiny.wheel.retry;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.function.Predicate;

/**
 * Bounded multi-pass retry over a list of entries.
 *
 * <p>Each pass attempts every entry still in the retry list once. An entry that
 * succeeds becomes {@link RetryState#DURABLE} and decrements the error counter;
 * one that fails is {@link RetryState#REQUEUED} for the next pass. The loop stops
 * when the list is empty or after {@code ceiling} passes. There is no delay
 * between passes.
 *
 * <p>An attempt that throws counts as a failure.
 */
public final class RetryPassLoop<T> {

    private static final Logger LOGGER = LoggerFactory.getLogger(RetryPassLoop.class);

    private static final Map<RetryState, Set<RetryState>> VALID_TRANSITIONS;

    static {
        Map<RetryState, Set<RetryState>> transitions = new EnumMap<>(RetryState.class);
        transitions.put(RetryState.PENDING, EnumSet.of(RetryState.ATTEMPTED));
        transitions.put(RetryState.ATTEMPTED, EnumSet.of(RetryState.DURABLE, RetryState.REQUEUED));
        transitions.put(RetryState.REQUEUED, EnumSet.of(RetryState.ATTEMPTED));
        transitions.put(RetryState.DURABLE, EnumSet.noneOf(RetryState.class));
        VALID_TRANSITIONS = Collections.unmodifiableMap(transitions);
    }

    private final int ceiling;
    private final String name;

    /**
     * @param name    label used in log lines
     * @param ceiling maximum number of passes, at least 1
     */
    public RetryPassLoop(String name, int ceiling) {
        if (ceiling < 1) {
            throw new IllegalArgumentException("Retry ceiling must be at least 1");
        }
        this.name = Objects.requireNonNull(name, "name");
        this.ceiling = ceiling;
    }

    public int getCeiling() {
        return ceiling;
    }

    public static boolean isValidTransition(RetryState from, RetryState to) {
        return VALID_TRANSITIONS.getOrDefault(from, Set.of()).contains(to);
    }

    /**
     * Run the passes.
     *
     * @param entries entries to write, attempted in list order within each pass
     * @param attempt writes one entry, returning true once it is durable
     * @return counters and the durable/failed split
     */
    public RetryOutcome<T> run(List<T> entries, Predicate<? super T> attempt) {
        Objects.requireNonNull(entries, "entries");
        Objects.requireNonNull(attempt, "attempt");

        List<Entry<T>> retryList = new ArrayList<>(entries.size());
        for (T value : entries) {
            retryList.add(new Entry<>(value));
        }

        int errors = retryList.size();
        int passes = 0;
        List<Integer> history = new ArrayList<>();
        List<T> durable = new ArrayList<>();

        while (!retryList.isEmpty() && passes < ceiling) {
            passes++;
            List<Entry<T>> next = new ArrayList<>();
            for (Entry<T> entry : retryList) {
                entry.moveTo(RetryState.ATTEMPTED);
                if (tryOnce(entry.value, attempt)) {
                    entry.moveTo(RetryState.DURABLE);
                    durable.add(entry.value);
                    errors--;
                } else {
                    entry.moveTo(RetryState.REQUEUED);
                    next.add(entry);
                }
            }
            retryList = next;
            history.add(errors);
            LOGGER.debug("{}: pass {} left {} entries pending", name, passes, errors);
        }

        List<T> failed = new ArrayList<>(retryList.size());
        for (Entry<T> entry : retryList) {
            failed.add(entry.value);
        }
        if (!failed.isEmpty()) {
            LOGGER.warn("{}: gave up on {} entries after {} passes", name, failed.size(), passes);
        }
        return new RetryOutcome<>(errors, passes, history, durable, failed);
    }

    private boolean tryOnce(T value, Predicate<? super T> attempt) {
        try {
            return attempt.test(value);
        } catch (RuntimeException e) {
            LOGGER.debug("{}: attempt on {} failed", name, value, e);
            return false;
        }
    }

    private static final class Entry<T> {
        private final T value;
        private RetryState state = RetryState.PENDING;

        private Entry(T value) {
            this.value = value;
        }

        private void moveTo(RetryState next) {
            if (!isValidTransition(state, next)) {
                throw new IllegalStateException("Invalid retry transition: " + state + " -> " + next);
            }
            state = next;
        }
    }
}
