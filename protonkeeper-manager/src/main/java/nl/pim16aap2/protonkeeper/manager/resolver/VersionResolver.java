package nl.pim16aap2.protonkeeper.manager.resolver;

import lombok.extern.java.Log;
import nl.pim16aap2.protonkeeper.manager.cache.RuntimeCacheStore;
import nl.pim16aap2.protonkeeper.manager.cache.RuntimeLease;
import nl.pim16aap2.protonkeeper.manager.download.DownloadCoordinator;
import nl.pim16aap2.protonkeeper.manager.download.DownloadSubscription;
import nl.pim16aap2.protonkeeper.manager.fallback.FallbackPolicy;
import nl.pim16aap2.protonkeeper.manager.fallback.PlanStep;
import nl.pim16aap2.protonkeeper.manager.fallback.ResolutionPlan;
import nl.pim16aap2.protonkeeper.manager.registry.RuntimeRegistry;
import nl.pim16aap2.protonkeeper.manager.system.SystemRuntimeProbe;
import nl.pim16aap2.protonkeeper.runtime.CancelToken;
import nl.pim16aap2.protonkeeper.runtime.FailureReason;
import nl.pim16aap2.protonkeeper.runtime.ResolutionResult;
import nl.pim16aap2.protonkeeper.runtime.RuntimeAsset;
import nl.pim16aap2.protonkeeper.runtime.RuntimeInstallException;
import nl.pim16aap2.protonkeeper.runtime.VersionRequirement;
import org.jspecify.annotations.Nullable;

import javax.inject.Inject;
import javax.inject.Singleton;
import java.util.Objects;

/**
 * Answers "give me a usable runtime for this requirement".
 * <p>
 * The steps of the {@link FallbackPolicy} plan are tried in order until one yields a runtime. Expected failures never
 * escape as exceptions: they move resolution on to the next step, and the final step reports the last failure.
 */
@Log
@Singleton
public final class VersionResolver
{
    private final RuntimeCacheStore cacheStore;
    private final DownloadCoordinator downloadCoordinator;
    private final RuntimeRegistry registry;
    private final SystemRuntimeProbe systemRuntimeProbe;
    private final FallbackPolicy fallbackPolicy;

    @Inject
    public VersionResolver(
        RuntimeCacheStore cacheStore,
        DownloadCoordinator downloadCoordinator,
        RuntimeRegistry registry,
        SystemRuntimeProbe systemRuntimeProbe,
        FallbackPolicy fallbackPolicy)
    {
        this.cacheStore = Objects.requireNonNull(cacheStore, "cacheStore may not be null.");
        this.downloadCoordinator = Objects.requireNonNull(downloadCoordinator, "downloadCoordinator may not be null.");
        this.registry = Objects.requireNonNull(registry, "registry may not be null.");
        this.systemRuntimeProbe = Objects.requireNonNull(systemRuntimeProbe, "systemRuntimeProbe may not be null.");
        this.fallbackPolicy = Objects.requireNonNull(fallbackPolicy, "fallbackPolicy may not be null.");
    }

    /**
     * Resolves a requirement to a usable runtime.
     *
     * @param requirement
     *     The requirement to resolve.
     * @param cancelToken
     *     Cancels the resolution, including any download it waits for.
     * @return The outcome. When it refers to a managed runtime, it holds a lease that must be closed after use.
     */
    public ResolvedRuntime resolve(VersionRequirement requirement, CancelToken cancelToken)
    {
        Objects.requireNonNull(requirement, "requirement may not be null.");
        Objects.requireNonNull(cancelToken, "cancelToken may not be null.");

        final ResolutionPlan plan =
            fallbackPolicy.decide(requirement, cacheStore.listCached(), systemRuntimeProbe.find());
        log.fine(() -> "Resolving '%s' with plan %s.".formatted(requirement, plan.steps()));

        @Nullable RuntimeInstallException lastFailure = null;
        for (final PlanStep step : plan.steps())
        {
            if (isCancelled(cancelToken))
                return cancelled(requirement);
            if (step instanceof PlanStep.Fail fail)
                return unavailable(requirement, fail, lastFailure);

            try
            {
                return attempt(step, requirement, cancelToken);
            }
            catch (RuntimeInstallException exception)
            {
                if (exception.getReason() == FailureReason.CANCELLED && isCancelled(cancelToken))
                    return cancelled(requirement);
                log.info("Could not use %s for '%s': %s"
                    .formatted(describe(step), requirement, exception.getMessage()));
                lastFailure = exception;
            }
        }
        // Unreachable: every plan ends with a failure step.
        throw new IllegalStateException("Resolution plan for '%s' did not terminate.".formatted(requirement));
    }

    private ResolvedRuntime attempt(PlanStep step, VersionRequirement requirement, CancelToken cancelToken)
        throws RuntimeInstallException
    {
        if (step instanceof PlanStep.UseInstalled useInstalled)
        {
            final RuntimeLease lease = cacheStore.acquire(useInstalled.versionId());
            return new ResolvedRuntime(new ResolutionResult.UsedRequested(lease.versionId(), lease.directory()), lease);
        }

        if (step instanceof PlanStep.FetchFromRegistry fetch)
            return fetchAndInstall(fetch.versionId(), cancelToken);

        if (step instanceof PlanStep.UseCachedAlternate alternate)
        {
            final RuntimeLease lease = cacheStore.acquire(alternate.versionId());
            log.warning("Substituting cached runtime version '%s' for '%s'."
                .formatted(alternate.versionId(), requirement));
            return new ResolvedRuntime(
                new ResolutionResult.UsedCachedAlternate(lease.versionId(), lease.directory()), lease);
        }

        if (step instanceof PlanStep.UseSystemRuntime system)
        {
            log.warning("Falling back to system runtime '%s' for '%s'.".formatted(system.directory(), requirement));
            return ResolvedRuntime.unmanaged(new ResolutionResult.UsedSystemFallback(system.directory()));
        }

        throw new IllegalArgumentException("Unsupported plan step: " + step);
    }

    private ResolvedRuntime fetchAndInstall(String versionId, CancelToken cancelToken)
        throws RuntimeInstallException
    {
        final RuntimeAsset asset = registry.find(versionId, cancelToken).orElseThrow(() -> new RuntimeInstallException(
            FailureReason.NOT_FOUND,
            "Runtime version '%s' is not listed in the registry.".formatted(versionId)
        ));
        cancelToken.throwIfCancelled(versionId);

        final DownloadSubscription subscription = downloadCoordinator.request(asset);
        final Runnable unregister = cancelToken.onCancel(subscription::cancel);
        try
        {
            subscription.await();
        }
        finally
        {
            unregister.run();
        }

        final RuntimeLease lease = cacheStore.acquire(versionId);
        try
        {
            cacheStore.setCurrent(versionId);
        }
        catch (RuntimeInstallException exception)
        {
            log.warning("Installed runtime version '%s' but could not make it current: %s"
                .formatted(versionId, exception.getMessage()));
        }
        return new ResolvedRuntime(new ResolutionResult.UsedRequested(versionId, lease.directory()), lease);
    }

    private static ResolvedRuntime unavailable(
        VersionRequirement requirement,
        PlanStep.Fail fail,
        @Nullable RuntimeInstallException lastFailure)
    {
        final String message = lastFailure == null ?
            fail.message() :
            "%s Last error: %s".formatted(fail.message(), lastFailure.getMessage());
        log.warning("No runtime available for '%s': %s".formatted(requirement, message));
        return ResolvedRuntime.unmanaged(new ResolutionResult.Failed(fail.reason(), message));
    }

    /**
     * An interrupted resolving thread counts as cancelled.
     */
    private static boolean isCancelled(CancelToken cancelToken)
    {
        return cancelToken.isCancelled() || Thread.currentThread().isInterrupted();
    }

    private static ResolvedRuntime cancelled(VersionRequirement requirement)
    {
        log.info("Resolution of '%s' was cancelled.".formatted(requirement));
        return ResolvedRuntime.unmanaged(new ResolutionResult.Failed(
            FailureReason.CANCELLED,
            "Resolution of '%s' was cancelled.".formatted(requirement)
        ));
    }

    private static String describe(PlanStep step)
    {
        if (step instanceof PlanStep.UseInstalled useInstalled)
            return "installed version '%s'".formatted(useInstalled.versionId());
        if (step instanceof PlanStep.FetchFromRegistry fetch)
            return "registry version '%s'".formatted(fetch.versionId());
        if (step instanceof PlanStep.UseCachedAlternate alternate)
            return "cached version '%s'".formatted(alternate.versionId());
        return step.toString();
    }
}
