package nl.pim16aap2.protonkeeper.manager;

import lombok.extern.java.Log;
import nl.pim16aap2.protonkeeper.manager.cache.RuntimeCacheStore;
import nl.pim16aap2.protonkeeper.manager.config.RuntimeManagerConfig;
import nl.pim16aap2.protonkeeper.manager.download.DownloadCoordinator;
import nl.pim16aap2.protonkeeper.manager.registry.RegistryProviders;
import nl.pim16aap2.protonkeeper.manager.resolver.ResolvedRuntime;
import nl.pim16aap2.protonkeeper.manager.resolver.VersionResolver;
import nl.pim16aap2.protonkeeper.manager.system.DirectorySystemRuntimeProbe;
import nl.pim16aap2.protonkeeper.runtime.CacheEntry;
import nl.pim16aap2.protonkeeper.runtime.CancelToken;
import nl.pim16aap2.protonkeeper.runtime.ProgressSnapshot;
import nl.pim16aap2.protonkeeper.runtime.RuntimeInstallException;
import nl.pim16aap2.protonkeeper.runtime.RuntimeVersion;
import nl.pim16aap2.protonkeeper.runtime.VersionRequirement;

import javax.inject.Inject;
import javax.inject.Singleton;
import java.util.List;
import java.util.Optional;

/**
 * The caller-facing operations of the runtime manager.
 * <p>
 * One instance owns one cache root. Instances are thread-safe; close them to stop running downloads.
 */
@Log
@Singleton
public final class RuntimeManager implements AutoCloseable
{
    private final VersionResolver versionResolver;
    private final RuntimeCacheStore cacheStore;
    private final DownloadCoordinator downloadCoordinator;

    @Inject
    RuntimeManager(
        VersionResolver versionResolver,
        RuntimeCacheStore cacheStore,
        DownloadCoordinator downloadCoordinator)
    {
        this.versionResolver = versionResolver;
        this.cacheStore = cacheStore;
        this.downloadCoordinator = downloadCoordinator;
    }

    /**
     * Creates a manager using the configured registry provider and the directory-based system runtime probe.
     *
     * @param config
     *     The configuration.
     * @return The new manager.
     */
    public static RuntimeManager create(RuntimeManagerConfig config)
    {
        log.info("Opening runtime cache at '%s' with registry '%s'."
            .formatted(config.cacheRoot(), config.registryProvider()));
        return DaggerRuntimeManagerComponent.factory()
            .create(config, RegistryProviders.defaults().create(config), new DirectorySystemRuntimeProbe(config))
            .runtimeManager();
    }

    /**
     * Resolves a requirement to a usable runtime, downloading it if needed.
     *
     * @param requirement
     *     The version requirement of the game.
     * @param cancelToken
     *     Cancels the resolution.
     * @return The outcome. Close it once the runtime is no longer used.
     */
    public ResolvedRuntime resolveRuntime(VersionRequirement requirement, CancelToken cancelToken)
    {
        return versionResolver.resolve(requirement, cancelToken);
    }

    /**
     * @see #resolveRuntime(VersionRequirement, CancelToken)
     */
    public ResolvedRuntime resolveRuntime(String requirement, CancelToken cancelToken)
    {
        return resolveRuntime(VersionRequirement.of(requirement), cancelToken);
    }

    public ProgressSnapshot getInstallProgress(String versionId)
    {
        return downloadCoordinator.progress(versionId);
    }

    /**
     * @param versionId
     *     The version id.
     * @return The install state of the version together with the integrity information it was installed with.
     */
    public RuntimeVersion getVersion(String versionId)
    {
        return cacheStore.version(versionId);
    }

    /**
     * @return The installed versions, most recently used first.
     */
    public List<CacheEntry> listCached()
    {
        return cacheStore.listCached();
    }

    /**
     * Removes an installed version.
     *
     * @param versionId
     *     The version to remove.
     * @throws RuntimeInstallException
     *     With {@link nl.pim16aap2.protonkeeper.runtime.FailureReason#BUSY} if the version is in use.
     */
    public void evict(String versionId)
        throws RuntimeInstallException
    {
        cacheStore.evict(versionId);
    }

    public void setCurrent(String versionId)
        throws RuntimeInstallException
    {
        cacheStore.setCurrent(versionId);
    }

    public Optional<String> current()
    {
        return cacheStore.current();
    }

    @Override
    public void close()
    {
        downloadCoordinator.close();
    }
}
