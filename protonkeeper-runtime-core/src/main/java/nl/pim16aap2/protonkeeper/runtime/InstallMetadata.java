package nl.pim16aap2.protonkeeper.runtime;

import org.jspecify.annotations.Nullable;

import java.time.Instant;

/**
 * The metadata record stored next to each installed runtime version.
 * <p>
 * On restart, a version is only trusted as installed when both its payload directory and this record exist and the
 * record says {@link InstallState#INSTALLED}.
 *
 * @param versionId
 *     The version id.
 * @param state
 *     The install state at the time of writing.
 * @param sha256
 *     The SHA-256 digest of the downloaded asset.
 * @param sizeBytes
 *     The size of the downloaded asset in bytes.
 * @param sourceUri
 *     Where the asset was downloaded from.
 * @param installedAt
 *     When the version was committed.
 * @param lastUsedAt
 *     When the version was last leased.
 */
public record InstallMetadata(
    String versionId,
    InstallState state,
    String sha256,
    long sizeBytes,
    @Nullable String sourceUri,
    Instant installedAt,
    @Nullable Instant lastUsedAt
)
{
    /**
     * @return The time the version was last used, or the install time if it was never used.
     */
    public Instant effectiveLastUsedAt()
    {
        return lastUsedAt == null ? installedAt : lastUsedAt;
    }

    public InstallMetadata withLastUsedAt(Instant instant)
    {
        return new InstallMetadata(versionId, state, sha256, sizeBytes, sourceUri, installedAt, instant);
    }
}
