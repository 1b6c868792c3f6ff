package nl.pim16aap2.protonkeeper.manager.system;

import java.nio.file.Path;
import java.util.Optional;

/**
 * Finds a runtime that was installed outside of the cache.
 * <p>
 * Such runtimes are not managed: they are never evicted and carry no lease.
 */
@FunctionalInterface
public interface SystemRuntimeProbe
{
    /**
     * @return The directory of an unmanaged runtime, if one is available.
     */
    Optional<Path> find();

    /**
     * @return A probe that never finds anything.
     */
    static SystemRuntimeProbe none()
    {
        return Optional::empty;
    }
}
