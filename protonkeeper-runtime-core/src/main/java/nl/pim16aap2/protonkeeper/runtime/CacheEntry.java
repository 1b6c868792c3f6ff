package nl.pim16aap2.protonkeeper.runtime;

import java.nio.file.Path;
import java.time.Instant;

/**
 * An installed runtime version.
 *
 * @param versionId
 *     The version id.
 * @param directoryPath
 *     The directory holding the installed payload.
 * @param installedAt
 *     When the version was committed.
 * @param lastUsedAt
 *     When a lease on the version was last acquired. Equal to {@code installedAt} for unused versions.
 * @param isCurrent
 *     Whether this version is the current one. At most one entry is current at a time.
 */
public record CacheEntry(
    String versionId,
    Path directoryPath,
    Instant installedAt,
    Instant lastUsedAt,
    boolean isCurrent
)
{
}
