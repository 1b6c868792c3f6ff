package nl.pim16aap2.protonkeeper.manager.fallback;

import nl.pim16aap2.protonkeeper.runtime.FailureReason;

import java.nio.file.Path;

/**
 * A single attempt in a {@link ResolutionPlan}.
 */
public sealed interface PlanStep
    permits PlanStep.UseInstalled,
    PlanStep.FetchFromRegistry,
    PlanStep.UseCachedAlternate,
    PlanStep.UseSystemRuntime,
    PlanStep.Fail
{
    /**
     * Use the requested version, which is already installed.
     *
     * @param versionId
     *     The requested version id.
     * @param directory
     *     The installed directory at the time the plan was made.
     */
    record UseInstalled(String versionId, Path directory) implements PlanStep
    {
    }

    /**
     * Look up the requested version in the registry and install it.
     *
     * @param versionId
     *     The requested version id.
     */
    record FetchFromRegistry(String versionId) implements PlanStep
    {
    }

    /**
     * Substitute a different cached version.
     *
     * @param versionId
     *     The substitute version id.
     * @param directory
     *     The installed directory at the time the plan was made.
     */
    record UseCachedAlternate(String versionId, Path directory) implements PlanStep
    {
    }

    /**
     * Substitute an unmanaged runtime.
     *
     * @param directory
     *     The directory of the unmanaged runtime.
     */
    record UseSystemRuntime(Path directory) implements PlanStep
    {
    }

    /**
     * Give up.
     *
     * @param reason
     *     The failure reason to report.
     * @param message
     *     A human-readable description.
     */
    record Fail(FailureReason reason, String message) implements PlanStep
    {
    }
}
