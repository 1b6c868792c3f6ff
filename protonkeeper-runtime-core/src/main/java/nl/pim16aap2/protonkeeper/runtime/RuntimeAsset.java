package nl.pim16aap2.protonkeeper.runtime;

import java.net.URI;
import java.util.Objects;

/**
 * A runtime version as published by a registry.
 *
 * @param versionId
 *     The stable version id, e.g. {@code ge-8.26}.
 * @param downloadUri
 *     Where the asset can be downloaded.
 * @param fileName
 *     The file name of the asset. Used to decide how the payload is unpacked.
 * @param integrity
 *     The declared digest and/or size.
 */
public record RuntimeAsset(
    String versionId,
    URI downloadUri,
    String fileName,
    IntegrityCheck integrity
)
{
    public RuntimeAsset
    {
        Objects.requireNonNull(versionId, "versionId may not be null.");
        Objects.requireNonNull(downloadUri, "downloadUri may not be null.");
        Objects.requireNonNull(fileName, "fileName may not be null.");
        Objects.requireNonNull(integrity, "integrity may not be null.");
        if (versionId.isBlank())
            throw new IllegalArgumentException("versionId may not be blank.");
    }
}
