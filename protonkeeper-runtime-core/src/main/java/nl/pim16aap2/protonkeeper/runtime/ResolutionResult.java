package nl.pim16aap2.protonkeeper.runtime;

import java.nio.file.Path;
import java.util.Optional;

/**
 * The outcome of resolving a {@link VersionRequirement}.
 * <p>
 * Every outcome other than {@link UsedRequested} is either a substitution or a failure, so callers can warn the user
 * when they did not get exactly what the game asked for.
 */
public sealed interface ResolutionResult
    permits ResolutionResult.UsedRequested,
    ResolutionResult.UsedCachedAlternate,
    ResolutionResult.UsedSystemFallback,
    ResolutionResult.Failed
{
    /**
     * @return The usable runtime path, if any.
     */
    Optional<Path> path();

    /**
     * @return {@code true} if this outcome provides a usable runtime.
     */
    default boolean isUsable()
    {
        return path().isPresent();
    }

    /**
     * @return {@code true} if the runtime is not the one that was requested.
     */
    default boolean isSubstitution()
    {
        return this instanceof UsedCachedAlternate || this instanceof UsedSystemFallback;
    }

    /**
     * The exact requested version is installed and ready.
     *
     * @param versionId
     *     The installed version id.
     * @param directory
     *     The installed version's directory.
     */
    record UsedRequested(String versionId, Path directory) implements ResolutionResult
    {
        @Override
        public Optional<Path> path()
        {
            return Optional.of(directory);
        }
    }

    /**
     * The requested version was unobtainable. A different, previously cached version is used instead.
     *
     * @param versionId
     *     The substituted version id.
     * @param directory
     *     The substituted version's directory.
     */
    record UsedCachedAlternate(String versionId, Path directory) implements ResolutionResult
    {
        @Override
        public Optional<Path> path()
        {
            return Optional.of(directory);
        }
    }

    /**
     * No managed runtime was available. An externally installed runtime is used instead.
     *
     * @param directory
     *     The unmanaged runtime's directory.
     */
    record UsedSystemFallback(Path directory) implements ResolutionResult
    {
        @Override
        public Optional<Path> path()
        {
            return Optional.of(directory);
        }
    }

    /**
     * No runtime could be provided.
     *
     * @param reason
     *     Why resolution failed.
     * @param message
     *     A human-readable description.
     */
    record Failed(FailureReason reason, String message) implements ResolutionResult
    {
        @Override
        public Optional<Path> path()
        {
            return Optional.empty();
        }
    }
}
