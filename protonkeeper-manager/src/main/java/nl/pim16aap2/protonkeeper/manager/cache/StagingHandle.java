package nl.pim16aap2.protonkeeper.manager.cache;

import lombok.AccessLevel;
import lombok.Getter;
import lombok.ToString;
import lombok.experimental.Accessors;
import nl.pim16aap2.protonkeeper.runtime.RuntimeAsset;

import java.nio.file.Path;

/**
 * An exclusive staging location for a single install attempt.
 * <p>
 * Handles are compared by identity: a handle from an earlier, discarded attempt can never commit.
 */
@Getter
@Accessors(fluent = true)
@ToString
public final class StagingHandle
{
    private final String versionId;

    private final RuntimeAsset asset;

    /**
     * The staging directory owned by this attempt.
     */
    private final Path directory;

    /**
     * The file the asset is downloaded into.
     */
    private final Path downloadFile;

    /**
     * The directory the downloaded asset is unpacked into.
     */
    @Getter(AccessLevel.PACKAGE)
    private final Path unpackDirectory;

    StagingHandle(RuntimeAsset asset, Path directory)
    {
        this.versionId = asset.versionId();
        this.asset = asset;
        this.directory = directory;
        this.downloadFile = directory.resolve("download.part");
        this.unpackDirectory = directory.resolve("unpacked");
    }
}
