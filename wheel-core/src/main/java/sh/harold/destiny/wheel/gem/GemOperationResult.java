package sh.harold.destiny.wheel.gem;

/**
 * Outcome of a gem vault operation. Only {@link #SUCCESS} changes state.
 */
public enum GemOperationResult {
    SUCCESS,
    NOT_FOUND,
    LOCKED,
    INSUFFICIENT_FUNDS,
    AFFINITY_MISMATCH,
    STORAGE_FAILURE,
    VAULT_FULL;

    public boolean isSuccess() {
        return this == SUCCESS;
    }
}
