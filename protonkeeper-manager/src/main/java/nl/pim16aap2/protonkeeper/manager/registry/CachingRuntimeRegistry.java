package nl.pim16aap2.protonkeeper.manager.registry;

import com.google.errorprone.annotations.concurrent.GuardedBy;
import lombok.extern.java.Log;
import nl.pim16aap2.protonkeeper.runtime.CancelToken;
import nl.pim16aap2.protonkeeper.runtime.FailureReason;
import nl.pim16aap2.protonkeeper.runtime.RuntimeAsset;
import nl.pim16aap2.protonkeeper.runtime.RuntimeInstallException;
import org.jspecify.annotations.Nullable;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * Reuses the listing of another registry for a fixed duration.
 * <p>
 * When refreshing an expired listing fails, the stale listing is returned instead, so a registry outage does not
 * hide versions that were known a moment ago.
 */
@Log
public final class CachingRuntimeRegistry implements RuntimeRegistry
{
    private final RuntimeRegistry delegate;
    private final Duration timeToLive;
    private final Clock clock;

    @GuardedBy("this")
    private @Nullable List<RuntimeAsset> listing;

    @GuardedBy("this")
    private Instant fetchedAt = Instant.MIN;

    public CachingRuntimeRegistry(RuntimeRegistry delegate, Duration timeToLive, Clock clock)
    {
        this.delegate = Objects.requireNonNull(delegate, "delegate may not be null.");
        this.timeToLive = Objects.requireNonNull(timeToLive, "timeToLive may not be null.");
        this.clock = Objects.requireNonNull(clock, "clock may not be null.");
    }

    @Override
    public synchronized List<RuntimeAsset> listVersions(CancelToken cancelToken)
        throws RuntimeInstallException
    {
        final Instant now = clock.instant();
        if (listing != null && now.isBefore(fetchedAt.plus(timeToLive)))
            return listing;

        try
        {
            listing = List.copyOf(delegate.listVersions(cancelToken));
            fetchedAt = now;
            return listing;
        }
        catch (RuntimeInstallException exception)
        {
            if (listing == null || exception.getReason() == FailureReason.CANCELLED)
                throw exception;
            log.warning("Failed to refresh runtime registry, using the listing from %s: %s"
                .formatted(fetchedAt, exception.getMessage()));
            return listing;
        }
    }

    /**
     * Forgets the cached listing so the next call queries the underlying registry.
     */
    public synchronized void invalidate()
    {
        listing = null;
        fetchedAt = Instant.MIN;
    }
}
