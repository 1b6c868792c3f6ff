package nl.pim16aap2.protonkeeper.manager.resolver;

import nl.pim16aap2.protonkeeper.manager.cache.RuntimeLease;
import nl.pim16aap2.protonkeeper.runtime.ResolutionResult;
import org.jspecify.annotations.Nullable;

import java.util.Objects;

/**
 * The outcome of a resolution together with the lease that keeps a managed runtime from being evicted.
 * <p>
 * Close this once the runtime is no longer used. Unmanaged runtimes and failures carry no lease.
 *
 * @param result
 *     The outcome.
 * @param lease
 *     The lease on the resolved managed runtime, or {@code null} if there is nothing to release.
 */
public record ResolvedRuntime(ResolutionResult result, @Nullable RuntimeLease lease) implements AutoCloseable
{
    public ResolvedRuntime
    {
        Objects.requireNonNull(result, "result may not be null.");
    }

    public static ResolvedRuntime unmanaged(ResolutionResult result)
    {
        return new ResolvedRuntime(result, null);
    }

    @Override
    public void close()
    {
        if (lease != null)
            lease.close();
    }
}
