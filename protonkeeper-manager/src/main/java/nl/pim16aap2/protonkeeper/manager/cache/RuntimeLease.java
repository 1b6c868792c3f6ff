package nl.pim16aap2.protonkeeper.manager.cache;

import lombok.Getter;
import lombok.experimental.Accessors;

import java.nio.file.Path;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * A claim on an installed runtime version.
 * <p>
 * While at least one lease on a version is open, the version cannot be evicted. Closing a lease more than once has no
 * further effect.
 */
@Accessors(fluent = true)
public final class RuntimeLease implements AutoCloseable
{
    private final RuntimeCacheStore cacheStore;
    private final AtomicBoolean released = new AtomicBoolean(false);

    @Getter
    private final String versionId;

    @Getter
    private final Path directory;

    RuntimeLease(RuntimeCacheStore cacheStore, String versionId, Path directory)
    {
        this.cacheStore = cacheStore;
        this.versionId = versionId;
        this.directory = directory;
    }

    public boolean isReleased()
    {
        return released.get();
    }

    @Override
    public void close()
    {
        if (released.compareAndSet(false, true))
            cacheStore.release(versionId);
    }
}
