package sh.harold.destiny.wheel.retry;

/**
 * Lifecycle of one entry in a {@link RetryPassLoop}.
 */
public enum RetryState {
    /** Queued, not yet tried. */
    PENDING,
    /** Tried in the current pass, outcome not yet recorded. */
    ATTEMPTED,
    /** Written successfully; terminal. */
    DURABLE,
    /** Failed; waits for the next pass. */
    REQUEUED
}
