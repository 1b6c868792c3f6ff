package nl.pim16aap2.protonkeeper.manager.registry;

import nl.pim16aap2.protonkeeper.runtime.CancelToken;
import nl.pim16aap2.protonkeeper.runtime.FailureReason;
import nl.pim16aap2.protonkeeper.runtime.IntegrityCheck;
import nl.pim16aap2.protonkeeper.runtime.RuntimeAsset;
import nl.pim16aap2.protonkeeper.runtime.RuntimeInstallException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.net.URI;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatExceptionOfType;

class CachingRuntimeRegistryTest
{
    private static final List<RuntimeAsset> LISTING = List.of(new RuntimeAsset(
        "ge-8.26", URI.create("https://example.invalid/ge-8.26.tar.gz"), "ge-8.26.tar.gz", IntegrityCheck.ofSize(1)));

    private final AtomicInteger calls = new AtomicInteger();
    private final AtomicBoolean failing = new AtomicBoolean();
    private final MutableClock clock = new MutableClock();

    private CachingRuntimeRegistry registry;

    @BeforeEach
    void init()
    {
        registry = new CachingRuntimeRegistry(
            cancelToken ->
            {
                calls.incrementAndGet();
                cancelToken.throwIfCancelled("registry listing");
                if (failing.get())
                    throw new RuntimeInstallException(FailureReason.NETWORK_ERROR, "Registry is down.");
                return LISTING;
            },
            Duration.ofMinutes(5),
            clock
        );
    }

    @Test
    void listVersions_shouldReuseListingWithinTimeToLive()
        throws Exception
    {
        // execute
        registry.listVersions();
        clock.advance(Duration.ofMinutes(4));
        final List<RuntimeAsset> listing = registry.listVersions();

        // verify
        assertThat(listing).isEqualTo(LISTING);
        assertThat(calls).hasValue(1);
    }

    @Test
    void listVersions_shouldRefreshExpiredListing()
        throws Exception
    {
        // execute
        registry.listVersions();
        clock.advance(Duration.ofMinutes(5));
        registry.listVersions();

        // verify
        assertThat(calls).hasValue(2);
    }

    @Test
    void listVersions_shouldFallBackToStaleListingWhenRefreshFails()
        throws Exception
    {
        // setup
        registry.listVersions();
        clock.advance(Duration.ofHours(1));
        failing.set(true);

        // execute
        final List<RuntimeAsset> listing = registry.listVersions();

        // verify
        assertThat(listing).isEqualTo(LISTING);
        assertThat(calls).hasValue(2);
    }

    @Test
    void listVersions_shouldPropagateFailureWithoutListing()
    {
        // setup
        failing.set(true);

        // execute & verify
        assertThatExceptionOfType(RuntimeInstallException.class)
            .isThrownBy(registry::listVersions)
            .withMessage("Registry is down.");
    }

    @Test
    void listVersions_shouldNotServeStaleListingToCancelledCaller()
        throws Exception
    {
        // setup
        registry.listVersions();
        clock.advance(Duration.ofHours(1));
        final CancelToken cancelToken = CancelToken.create();
        cancelToken.cancel();

        // execute & verify
        assertThatExceptionOfType(RuntimeInstallException.class)
            .isThrownBy(() -> registry.listVersions(cancelToken))
            .satisfies(exception -> assertThat(exception.getReason()).isEqualTo(FailureReason.CANCELLED));
        assertThat(registry.listVersions()).isEqualTo(LISTING);
    }

    @Test
    void invalidate_shouldForceRefresh()
        throws Exception
    {
        // setup
        registry.listVersions();

        // execute
        registry.invalidate();
        registry.listVersions();

        // verify
        assertThat(calls).hasValue(2);
    }

    private static final class MutableClock extends Clock
    {
        private volatile Instant now = Instant.parse("2026-01-01T00:00:00Z");

        void advance(Duration duration)
        {
            now = now.plus(duration);
        }

        @Override
        public ZoneId getZone()
        {
            return ZoneOffset.UTC;
        }

        @Override
        public Clock withZone(ZoneId zone)
        {
            return this;
        }

        @Override
        public Instant instant()
        {
            return now;
        }
    }
}
