package nl.pim16aap2.protonkeeper.manager.fetch;

/**
 * The result of a completed download.
 *
 * @param versionId
 *     The version id of the downloaded asset.
 * @param sha256
 *     The SHA-256 digest computed while streaming the asset.
 * @param sizeBytes
 *     The number of bytes written.
 */
public record FetchedPayload(
    String versionId,
    String sha256,
    long sizeBytes
)
{
}
