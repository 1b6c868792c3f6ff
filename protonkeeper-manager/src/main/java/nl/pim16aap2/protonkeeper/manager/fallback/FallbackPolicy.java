package nl.pim16aap2.protonkeeper.manager.fallback;

import nl.pim16aap2.protonkeeper.runtime.CacheEntry;
import nl.pim16aap2.protonkeeper.runtime.FailureReason;
import nl.pim16aap2.protonkeeper.runtime.VersionRequirement;
import org.jspecify.annotations.Nullable;

import javax.inject.Inject;
import javax.inject.Singleton;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * Decides in which order the sources of a runtime are tried.
 * <p>
 * For an exact requirement the order is:
 * <ol>
 *     <li>the requested version, if it is installed;</li>
 *     <li>the requested version, fetched from the registry;</li>
 *     <li>the other cached versions, most recently used first;</li>
 *     <li>the system runtime, if there is one;</li>
 *     <li>failure with {@link FailureReason#RUNTIME_UNAVAILABLE}.</li>
 * </ol>
 * A requirement that accepts any runtime skips the first two tiers.
 */
@Singleton
public final class FallbackPolicy
{
    @Inject
    public FallbackPolicy()
    {
    }

    /**
     * Creates the plan for a requirement.
     *
     * @param requirement
     *     The requirement to resolve.
     * @param cached
     *     The installed versions.
     * @param systemRuntime
     *     The unmanaged runtime, if one was found.
     * @return The plan.
     */
    public ResolutionPlan decide(VersionRequirement requirement, List<CacheEntry> cached, Optional<Path> systemRuntime)
    {
        final List<PlanStep> steps = new ArrayList<>();
        final List<CacheEntry> mostRecentlyUsed = new ArrayList<>(cached);
        mostRecentlyUsed.sort(
            Comparator.comparing(CacheEntry::lastUsedAt).reversed().thenComparing(CacheEntry::versionId));

        final @Nullable String requestedId = requirement.isAny() ? null : requirement.versionId();
        if (requestedId != null)
        {
            for (final CacheEntry entry : mostRecentlyUsed)
            {
                if (entry.versionId().equals(requestedId))
                    steps.add(new PlanStep.UseInstalled(requestedId, entry.directoryPath()));
            }
            steps.add(new PlanStep.FetchFromRegistry(requestedId));
        }

        for (final CacheEntry entry : mostRecentlyUsed)
        {
            if (!entry.versionId().equals(requestedId))
                steps.add(new PlanStep.UseCachedAlternate(entry.versionId(), entry.directoryPath()));
        }

        systemRuntime.ifPresent(path -> steps.add(new PlanStep.UseSystemRuntime(path)));

        steps.add(new PlanStep.Fail(
            FailureReason.RUNTIME_UNAVAILABLE,
            requestedId == null ?
                "No cached or system runtime is available." :
                "Runtime version '%s' is unavailable and no substitute was found.".formatted(requestedId)
        ));
        return new ResolutionPlan(requirement, steps);
    }
}
