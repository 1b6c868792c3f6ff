package nl.pim16aap2.protonkeeper.runtime;

/**
 * The install state of a single runtime version.
 * <p>
 * {@code MISSING -> STAGING -> VERIFYING -> INSTALLED | FAILED}. A failed version may re-enter {@link #STAGING} on
 * retry and an installed version returns to {@link #MISSING} when it is evicted.
 */
public enum InstallState
{
    MISSING,
    STAGING,
    VERIFYING,
    INSTALLED,
    FAILED;

    /**
     * @return {@code true} if a download or commit is currently running for a version in this state.
     */
    public boolean isInFlight()
    {
        return this == STAGING || this == VERIFYING;
    }
}
