package nl.pim16aap2.protonkeeper.manager.cache;

import com.google.errorprone.annotations.concurrent.GuardedBy;
import lombok.extern.java.Log;
import nl.pim16aap2.protonkeeper.manager.config.RuntimeManagerConfig;
import nl.pim16aap2.protonkeeper.manager.fetch.FetchedPayload;
import nl.pim16aap2.protonkeeper.manager.util.FileUtil;
import nl.pim16aap2.protonkeeper.runtime.CacheEntry;
import nl.pim16aap2.protonkeeper.runtime.FailureReason;
import nl.pim16aap2.protonkeeper.runtime.InstallMetadata;
import nl.pim16aap2.protonkeeper.runtime.InstallMetadataCodec;
import nl.pim16aap2.protonkeeper.runtime.InstallState;
import nl.pim16aap2.protonkeeper.runtime.IntegrityCheck;
import nl.pim16aap2.protonkeeper.runtime.RuntimeAsset;
import nl.pim16aap2.protonkeeper.runtime.RuntimeInstallException;
import nl.pim16aap2.protonkeeper.runtime.RuntimeVersion;
import org.jspecify.annotations.Nullable;

import javax.inject.Inject;
import javax.inject.Singleton;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Clock;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.logging.Level;

/**
 * The on-disk registry of installed runtime versions.
 * <p>
 * Every mutation of a version happens while holding that version's slot lock, so unrelated versions can be installed
 * and evicted concurrently. A version directory is only ever exposed once it has been fully written: payloads are
 * unpacked in a staging directory and renamed into place in a single atomic move, after which the metadata record is
 * written. On startup, directories without a valid metadata record and all staging directories are deleted.
 */
@Log
@Singleton
public final class RuntimeCacheStore
{
    private static final String VERSIONS_DIRECTORY = "versions";
    private static final String METADATA_DIRECTORY = "metadata";
    private static final String STAGING_DIRECTORY = "staging";
    private static final String CURRENT_FILE = "current";
    private static final String METADATA_SUFFIX = ".json";

    private final InstallMetadataCodec metadataCodec = new InstallMetadataCodec();
    private final Map<String, VersionSlot> slots = new ConcurrentHashMap<>();
    private final Clock clock;

    private final Path versionsDirectory;
    private final Path metadataDirectory;
    private final Path stagingDirectory;
    private final Path currentFile;

    private final Object currentLock = new Object();
    @GuardedBy("currentLock")
    private @Nullable String currentVersionId;

    @Inject
    public RuntimeCacheStore(RuntimeManagerConfig config)
    {
        this(config.cacheRoot(), Clock.systemUTC());
    }

    /**
     * Opens (and if needed, creates) a cache.
     *
     * @param cacheRoot
     *     The root directory of the cache.
     * @param clock
     *     The clock used for install and usage timestamps.
     * @throws IllegalStateException
     *     If the cache directories could not be created or recovered.
     */
    public RuntimeCacheStore(Path cacheRoot, Clock clock)
    {
        this.clock = Objects.requireNonNull(clock, "clock may not be null.");
        Objects.requireNonNull(cacheRoot, "cacheRoot may not be null.");
        this.versionsDirectory = cacheRoot.resolve(VERSIONS_DIRECTORY);
        this.metadataDirectory = cacheRoot.resolve(METADATA_DIRECTORY);
        this.stagingDirectory = cacheRoot.resolve(STAGING_DIRECTORY);
        this.currentFile = cacheRoot.resolve(CURRENT_FILE);

        try
        {
            FileUtil.createDirectories(versionsDirectory, "versions directory");
            FileUtil.createDirectories(metadataDirectory, "metadata directory");
            FileUtil.createDirectories(stagingDirectory, "staging directory");
            recoverAbandonedStaging();
            loadInstalledVersions();
            loadCurrentVersion();
        }
        catch (IOException exception)
        {
            throw new IllegalStateException("Failed to open runtime cache at '%s'.".formatted(cacheRoot), exception);
        }
    }

    /**
     * @param versionId
     *     The version id.
     * @return The install state of the version. Versions that were never seen before are {@link InstallState#MISSING}.
     */
    public InstallState has(String versionId)
    {
        final VersionSlot slot = slot(versionId);
        synchronized (slot)
        {
            return slot.state;
        }
    }

    /**
     * @param versionId
     *     The version id.
     * @return The full state of the version. Installed versions report the digest and size of the payload they were
     * installed from, other versions the integrity declaration of their latest install attempt.
     */
    public RuntimeVersion version(String versionId)
    {
        final VersionSlot slot = slot(versionId);
        synchronized (slot)
        {
            final @Nullable IntegrityCheck integrity = slot.metadata == null ?
                slot.integrity :
                IntegrityCheck.ofSha256(slot.metadata.sha256(), slot.metadata.sizeBytes());
            return new RuntimeVersion(versionId, integrity, slot.state);
        }
    }

    /**
     * @param versionId
     *     The version id.
     * @return The directory of the version if it is installed.
     */
    public Optional<Path> path(String versionId)
    {
        final VersionSlot slot = slot(versionId);
        synchronized (slot)
        {
            return slot.state == InstallState.INSTALLED ? Optional.of(versionDirectory(versionId)) : Optional.empty();
        }
    }

    /**
     * Allocates a staging location for a new install attempt.
     * <p>
     * Callers should go through the download coordinator rather than calling this directly, so concurrent requests for
     * the same version share a single attempt.
     *
     * @param asset
     *     The asset that will be installed.
     * @return The handle of the new staging location.
     *
     * @throws RuntimeInstallException
     *     With {@link FailureReason#ALREADY_INSTALLING} if the version is already staging or installed, or
     *     {@link FailureReason#DISK_ERROR} if the staging directory could not be created.
     */
    public StagingHandle beginInstall(RuntimeAsset asset)
        throws RuntimeInstallException
    {
        final String versionId = asset.versionId();
        final VersionSlot slot = slot(versionId);
        synchronized (slot)
        {
            if (slot.staging != null)
                throw new RuntimeInstallException(
                    FailureReason.ALREADY_INSTALLING,
                    "Runtime version '%s' is already being installed.".formatted(versionId)
                );
            if (slot.state == InstallState.INSTALLED)
                throw new RuntimeInstallException(
                    FailureReason.ALREADY_INSTALLING,
                    "Runtime version '%s' is already installed.".formatted(versionId)
                );

            final Path directory = stagingDirectory.resolve(versionId);
            try
            {
                FileUtil.deleteRecursively(directory, "stale staging directory");
                FileUtil.createDirectories(directory, "staging directory");
            }
            catch (IOException exception)
            {
                throw new RuntimeInstallException(
                    FailureReason.DISK_ERROR,
                    "Failed to create staging directory for runtime version '%s'.".formatted(versionId),
                    exception
                );
            }

            final StagingHandle handle = new StagingHandle(asset, directory);
            slot.staging = handle;
            slot.state = InstallState.STAGING;
            slot.integrity = asset.integrity();
            log.fine(() -> "Staging runtime version '%s' in '%s'.".formatted(versionId, directory));
            return handle;
        }
    }

    /**
     * Verifies a downloaded payload and atomically moves it into the version's final directory.
     * <p>
     * On failure, the staging location is discarded and the version ends up {@link InstallState#FAILED}.
     *
     * @param handle
     *     The staging handle the payload was downloaded into.
     * @param payload
     *     The digest and size computed while downloading.
     * @return The directory of the installed version.
     *
     * @throws RuntimeInstallException
     *     With {@link FailureReason#INTEGRITY_ERROR} if the payload does not match the declared digest or size, or is
     *     not a valid archive, or with {@link FailureReason#DISK_ERROR} if the payload could not be moved into place.
     */
    public Path commitInstall(StagingHandle handle, FetchedPayload payload)
        throws RuntimeInstallException
    {
        final String versionId = handle.versionId();
        final VersionSlot slot = slot(versionId);
        synchronized (slot)
        {
            requireActive(slot, handle);
            slot.state = InstallState.VERIFYING;
        }

        try
        {
            final IntegrityCheck integrity = handle.asset().integrity();
            final String mismatch = integrity.mismatch(payload.sha256(), payload.sizeBytes());
            if (mismatch != null)
                throw new RuntimeInstallException(
                    FailureReason.INTEGRITY_ERROR,
                    "Integrity check failed for runtime version '%s': %s.".formatted(versionId, mismatch)
                );

            final Path payloadRoot =
                ArchiveUnpacker.unpack(handle.downloadFile(), handle.asset().fileName(), handle.unpackDirectory());

            synchronized (slot)
            {
                requireActive(slot, handle);
                final Path target = moveIntoPlace(versionId, payloadRoot);
                final InstallMetadata metadata = new InstallMetadata(
                    versionId,
                    InstallState.INSTALLED,
                    payload.sha256(),
                    payload.sizeBytes(),
                    handle.asset().downloadUri().toString(),
                    clock.instant(),
                    null
                );
                writeMetadata(metadata, target);

                slot.staging = null;
                slot.metadata = metadata;
                slot.state = InstallState.INSTALLED;
                deleteStagingDirectory(handle);
                log.info("Installed runtime version '%s' in '%s'.".formatted(versionId, target));
                return target;
            }
        }
        catch (RuntimeInstallException exception)
        {
            discardInstall(handle, exception.getReason());
            throw exception;
        }
    }

    /**
     * Discards an install attempt and deletes its staging location.
     * <p>
     * Nothing happens if the handle is no longer the active attempt of its version.
     *
     * @param handle
     *     The staging handle to discard.
     * @param reason
     *     Why the attempt is discarded. Cancelled attempts return the version to {@link InstallState#MISSING}, any
     *     other reason leaves it {@link InstallState#FAILED}.
     */
    public void discardInstall(StagingHandle handle, FailureReason reason)
    {
        final VersionSlot slot = slot(handle.versionId());
        synchronized (slot)
        {
            if (slot.staging != handle)
                return;

            slot.staging = null;
            slot.state = reason == FailureReason.CANCELLED ? InstallState.MISSING : InstallState.FAILED;
            deleteStagingDirectory(handle);
            log.fine(() -> "Discarded install of runtime version '%s' (%s).".formatted(handle.versionId(), reason));
        }
    }

    /**
     * Claims an installed version so it cannot be evicted while it is in use.
     *
     * @param versionId
     *     The version to claim.
     * @return The lease. Closing it releases the claim.
     *
     * @throws RuntimeInstallException
     *     With {@link FailureReason#NOT_INSTALLED} if the version is not installed.
     */
    public RuntimeLease acquire(String versionId)
        throws RuntimeInstallException
    {
        final VersionSlot slot = slot(versionId);
        synchronized (slot)
        {
            if (slot.state != InstallState.INSTALLED || slot.metadata == null)
                throw notInstalled(versionId);

            slot.activeUsers++;
            slot.metadata = slot.metadata.withLastUsedAt(clock.instant());
            try
            {
                metadataCodec.write(slot.metadata, metadataFile(versionId));
            }
            catch (IOException exception)
            {
                log.log(
                    Level.WARNING,
                    "Failed to persist last-used time of runtime version '%s'.".formatted(versionId),
                    exception
                );
            }
            return new RuntimeLease(this, versionId, versionDirectory(versionId));
        }
    }

    void release(String versionId)
    {
        final VersionSlot slot = slot(versionId);
        synchronized (slot)
        {
            if (slot.activeUsers > 0)
                slot.activeUsers--;
        }
    }

    /**
     * @param versionId
     *     The version id.
     * @return The number of open leases on the version.
     */
    public int activeUsers(String versionId)
    {
        final VersionSlot slot = slot(versionId);
        synchronized (slot)
        {
            return slot.activeUsers;
        }
    }

    /**
     * Removes an installed version.
     * <p>
     * The metadata record is deleted before the payload directory, so a partially deleted directory is never trusted
     * again. If the version was the current one, the current pointer is cleared.
     *
     * @param versionId
     *     The version to evict.
     * @throws RuntimeInstallException
     *     With {@link FailureReason#BUSY} if the version has active users, {@link FailureReason#NOT_INSTALLED} if it
     *     is not installed or {@link FailureReason#DISK_ERROR} if it could not be deleted.
     */
    public void evict(String versionId)
        throws RuntimeInstallException
    {
        final VersionSlot slot = slot(versionId);
        synchronized (slot)
        {
            if (slot.state != InstallState.INSTALLED)
                throw notInstalled(versionId);
            if (slot.activeUsers > 0)
                throw new RuntimeInstallException(
                    FailureReason.BUSY,
                    "Runtime version '%s' is in use by %d caller(s).".formatted(versionId, slot.activeUsers)
                );

            try
            {
                Files.deleteIfExists(metadataFile(versionId));
                slot.state = InstallState.MISSING;
                slot.metadata = null;
                slot.integrity = null;
                clearCurrentIfMatches(versionId);
                FileUtil.deleteRecursively(versionDirectory(versionId), "runtime version directory");
            }
            catch (IOException exception)
            {
                throw new RuntimeInstallException(
                    FailureReason.DISK_ERROR,
                    "Failed to evict runtime version '%s'.".formatted(versionId),
                    exception
                );
            }
            log.info("Evicted runtime version '%s'.".formatted(versionId));
        }
    }

    /**
     * Makes an installed version the current one.
     *
     * @param versionId
     *     The version to make current.
     * @throws RuntimeInstallException
     *     With {@link FailureReason#NOT_INSTALLED} if the version is not installed or {@link FailureReason#DISK_ERROR}
     *     if the pointer could not be written.
     */
    public void setCurrent(String versionId)
        throws RuntimeInstallException
    {
        final VersionSlot slot = slot(versionId);
        synchronized (slot)
        {
            if (slot.state != InstallState.INSTALLED)
                throw notInstalled(versionId);

            synchronized (currentLock)
            {
                if (versionId.equals(currentVersionId))
                    return;
                try
                {
                    final Path temporary = currentFile.resolveSibling(CURRENT_FILE + ".tmp");
                    Files.writeString(temporary, versionId, StandardCharsets.UTF_8);
                    Files.move(
                        temporary, currentFile, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
                }
                catch (IOException exception)
                {
                    throw new RuntimeInstallException(
                        FailureReason.DISK_ERROR,
                        "Failed to make runtime version '%s' current.".formatted(versionId),
                        exception
                    );
                }
                currentVersionId = versionId;
            }
        }
        log.info("Runtime version '%s' is now current.".formatted(versionId));
    }

    /**
     * @return The id of the current version, if any.
     */
    public Optional<String> current()
    {
        synchronized (currentLock)
        {
            return Optional.ofNullable(currentVersionId);
        }
    }

    /**
     * @return All installed versions, most recently used first.
     */
    public List<CacheEntry> listCached()
    {
        final String current = current().orElse(null);
        final List<CacheEntry> ret = new ArrayList<>();
        for (final Map.Entry<String, VersionSlot> entry : slots.entrySet())
        {
            final VersionSlot slot = entry.getValue();
            synchronized (slot)
            {
                if (slot.state != InstallState.INSTALLED || slot.metadata == null)
                    continue;
                ret.add(new CacheEntry(
                    entry.getKey(),
                    versionDirectory(entry.getKey()),
                    slot.metadata.installedAt(),
                    slot.metadata.effectiveLastUsedAt(),
                    entry.getKey().equals(current)
                ));
            }
        }
        ret.sort(Comparator.comparing(CacheEntry::lastUsedAt).reversed().thenComparing(CacheEntry::versionId));
        return ret;
    }

    /**
     * Deletes every staging directory that does not belong to an active install attempt.
     *
     * @return The number of deleted staging directories.
     *
     * @throws IOException
     *     If the staging directory could not be listed or an abandoned directory could not be deleted.
     */
    public int recoverAbandonedStaging()
        throws IOException
    {
        final List<Path> children;
        try (var stream = Files.list(stagingDirectory))
        {
            children = stream.toList();
        }

        int deleted = 0;
        for (final Path child : children)
        {
            final String name = child.getFileName().toString();
            final @Nullable VersionSlot slot = slots.get(name);
            if (slot != null)
            {
                synchronized (slot)
                {
                    if (slot.staging != null && slot.staging.directory().equals(child))
                        continue;
                    deleteAbandoned(child);
                }
            }
            else
            {
                deleteAbandoned(child);
            }
            ++deleted;
        }
        return deleted;
    }

    private void deleteAbandoned(Path path)
        throws IOException
    {
        log.warning("Deleting abandoned staging location '%s'.".formatted(path));
        FileUtil.deleteRecursively(path, "abandoned staging location");
    }

    private void loadInstalledVersions()
        throws IOException
    {
        final List<Path> metadataFiles;
        try (var stream = Files.list(metadataDirectory))
        {
            metadataFiles = stream.toList();
        }

        for (final Path metadataFile : metadataFiles)
        {
            final String fileName = metadataFile.getFileName().toString();
            if (!fileName.endsWith(METADATA_SUFFIX))
            {
                FileUtil.deleteRecursively(metadataFile, "stray metadata file");
                continue;
            }

            final String versionId = fileName.substring(0, fileName.length() - METADATA_SUFFIX.length());
            final @Nullable InstallMetadata metadata = readTrustedMetadata(versionId, metadataFile);
            if (metadata == null)
            {
                FileUtil.deleteRecursively(metadataFile, "untrusted metadata file");
                continue;
            }

            final VersionSlot slot = slot(versionId);
            synchronized (slot)
            {
                slot.state = InstallState.INSTALLED;
                slot.metadata = metadata;
            }
        }

        final List<Path> versionDirectories;
        try (var stream = Files.list(versionsDirectory))
        {
            versionDirectories = stream.toList();
        }

        for (final Path versionDirectory : versionDirectories)
        {
            final String name = versionDirectory.getFileName().toString();
            final @Nullable VersionSlot slot = slots.get(name);
            if (slot != null && slot.isInstalled())
                continue;
            log.warning("Deleting runtime directory '%s' without install metadata.".formatted(versionDirectory));
            FileUtil.deleteRecursively(versionDirectory, "untrusted runtime directory");
        }
    }

    private @Nullable InstallMetadata readTrustedMetadata(String versionId, Path metadataFile)
    {
        try
        {
            FileUtil.requireSafeName(versionId, "version id");
            final InstallMetadata metadata = metadataCodec.read(metadataFile);
            if (!versionId.equals(metadata.versionId()) || metadata.state() != InstallState.INSTALLED)
            {
                log.warning("Ignoring metadata '%s' for version '%s' in state %s."
                    .formatted(metadataFile, metadata.versionId(), metadata.state()));
                return null;
            }
            if (!Files.isDirectory(versionDirectory(versionId)))
            {
                log.warning("Ignoring metadata '%s' because its runtime directory is missing.".formatted(metadataFile));
                return null;
            }
            // Throws for a malformed digest.
            IntegrityCheck.ofSha256(metadata.sha256(), metadata.sizeBytes());
            return metadata;
        }
        catch (IOException | IllegalArgumentException exception)
        {
            log.log(Level.WARNING, "Ignoring unreadable metadata '%s'.".formatted(metadataFile), exception);
            return null;
        }
    }

    private void loadCurrentVersion()
        throws IOException
    {
        if (Files.notExists(currentFile))
            return;

        final String versionId = Files.readString(currentFile, StandardCharsets.UTF_8).trim();
        final @Nullable VersionSlot slot = slots.get(versionId);
        if (slot == null || !slot.isInstalled())
        {
            log.warning("Clearing current pointer to runtime version '%s', which is not installed."
                .formatted(versionId));
            Files.delete(currentFile);
            return;
        }

        synchronized (currentLock)
        {
            currentVersionId = versionId;
        }
    }

    private Path moveIntoPlace(String versionId, Path payloadRoot)
        throws RuntimeInstallException
    {
        final Path target = versionDirectory(versionId);
        try
        {
            FileUtil.deleteRecursively(target, "stale runtime directory");
            Files.move(payloadRoot, target, StandardCopyOption.ATOMIC_MOVE);
            return target;
        }
        catch (IOException exception)
        {
            throw new RuntimeInstallException(
                FailureReason.DISK_ERROR,
                "Failed to move runtime version '%s' into place.".formatted(versionId),
                exception
            );
        }
    }

    private void writeMetadata(InstallMetadata metadata, Path target)
        throws RuntimeInstallException
    {
        try
        {
            metadataCodec.write(metadata, metadataFile(metadata.versionId()));
        }
        catch (IOException exception)
        {
            try
            {
                FileUtil.deleteRecursively(target, "uncommitted runtime directory");
            }
            catch (IOException cleanupException)
            {
                exception.addSuppressed(cleanupException);
            }
            throw new RuntimeInstallException(
                FailureReason.DISK_ERROR,
                "Failed to write metadata for runtime version '%s'.".formatted(metadata.versionId()),
                exception
            );
        }
    }

    private void deleteStagingDirectory(StagingHandle handle)
    {
        try
        {
            FileUtil.deleteRecursively(handle.directory(), "staging directory");
        }
        catch (IOException exception)
        {
            log.log(
                Level.WARNING,
                "Failed to delete staging directory '%s'; it will be removed on the next start."
                    .formatted(handle.directory()),
                exception
            );
        }
    }

    private void clearCurrentIfMatches(String versionId)
        throws IOException
    {
        synchronized (currentLock)
        {
            if (!versionId.equals(currentVersionId))
                return;
            Files.deleteIfExists(currentFile);
            currentVersionId = null;
        }
        log.info("Cleared current pointer to evicted runtime version '%s'.".formatted(versionId));
    }

    private static void requireActive(VersionSlot slot, StagingHandle handle)
    {
        if (slot.staging != handle)
            throw new IllegalStateException(
                "Staging handle for runtime version '%s' is no longer active.".formatted(handle.versionId()));
    }

    private static RuntimeInstallException notInstalled(String versionId)
    {
        return new RuntimeInstallException(
            FailureReason.NOT_INSTALLED,
            "Runtime version '%s' is not installed.".formatted(versionId)
        );
    }

    private Path versionDirectory(String versionId)
    {
        return versionsDirectory.resolve(versionId);
    }

    private Path metadataFile(String versionId)
    {
        return metadataDirectory.resolve(versionId + METADATA_SUFFIX);
    }

    private VersionSlot slot(String versionId)
    {
        Objects.requireNonNull(versionId, "versionId may not be null.");
        return slots.computeIfAbsent(FileUtil.requireSafeName(versionId, "version id"), ignored -> new VersionSlot());
    }

    /**
     * The mutable state of a single version. Doubles as the version's lock.
     */
    private static final class VersionSlot
    {
        @GuardedBy("this")
        private InstallState state = InstallState.MISSING;

        @GuardedBy("this")
        private @Nullable InstallMetadata metadata;

        @GuardedBy("this")
        private @Nullable StagingHandle staging;

        @GuardedBy("this")
        private @Nullable IntegrityCheck integrity;

        @GuardedBy("this")
        private int activeUsers;

        synchronized boolean isInstalled()
        {
            return state == InstallState.INSTALLED;
        }
    }
}
