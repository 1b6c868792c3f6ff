package nl.pim16aap2.protonkeeper.runtime;

import org.jspecify.annotations.Nullable;

/**
 * Point-in-time progress of a runtime download.
 *
 * @param versionId
 *     The version id.
 * @param bytesDone
 *     The number of bytes received so far.
 * @param bytesTotal
 *     The total number of bytes, or {@code -1} if unknown.
 * @param state
 *     The install state of the version.
 * @param failure
 *     The reason the last attempt failed, if {@code state} is {@link InstallState#FAILED}.
 */
public record ProgressSnapshot(
    String versionId,
    long bytesDone,
    long bytesTotal,
    InstallState state,
    @Nullable FailureReason failure
)
{
    public static ProgressSnapshot of(String versionId, InstallState state)
    {
        return new ProgressSnapshot(versionId, 0L, -1L, state, null);
    }

    /**
     * @return The completed fraction in the range [0, 1], or {@code -1} when the total size is unknown.
     */
    public double fraction()
    {
        if (bytesTotal <= 0)
            return -1D;
        return Math.min(1D, (double) bytesDone / bytesTotal);
    }
}
