package nl.pim16aap2.protonkeeper.runtime;

/**
 * Reasons an operation on a runtime version can fail.
 */
public enum FailureReason
{
    /**
     * A transient network problem (connection reset, timeout, 5xx). Retried internally.
     */
    NETWORK_ERROR,

    /**
     * The payload did not match the declared digest or size, or the archive was malformed.
     */
    INTEGRITY_ERROR,

    /**
     * The version does not exist in the registry, or the asset returned 404.
     */
    NOT_FOUND,

    /**
     * Not enough space, missing permissions or any other local IO failure.
     */
    DISK_ERROR,

    /**
     * The caller cancelled the operation.
     */
    CANCELLED,

    /**
     * The version still has active users and cannot be evicted.
     */
    BUSY,

    /**
     * Every fallback tier was exhausted.
     */
    RUNTIME_UNAVAILABLE,

    /**
     * A staging location already exists for the version.
     */
    ALREADY_INSTALLING,

    /**
     * The version is not installed.
     */
    NOT_INSTALLED;

    public boolean isRetryable()
    {
        return this == NETWORK_ERROR;
    }
}
