package sh.harold.destiny.wheel.retry;

import java.util.List;

/**
 * Result of a {@link RetryPassLoop} run.
 *
 * @param errors       entries still not durable; zero means everything was written
 * @param passes       passes actually run
 * @param errorHistory the error counter after each pass, first pass first
 * @param durable      entries written, in the order they succeeded
 * @param failed       entries given up on once the ceiling was reached
 */
public record RetryOutcome<T>(int errors, int passes, List<Integer> errorHistory, List<T> durable, List<T> failed) {

    public RetryOutcome {
        errorHistory = List.copyOf(errorHistory);
        durable = List.copyOf(durable);
        failed = List.copyOf(failed);
    }

    public boolean isComplete() {
        return errors == 0;
    }
}
