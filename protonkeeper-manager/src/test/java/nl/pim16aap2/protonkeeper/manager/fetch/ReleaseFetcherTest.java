package nl.pim16aap2.protonkeeper.manager.fetch;

import nl.pim16aap2.protonkeeper.manager.TestAssetServer;
import nl.pim16aap2.protonkeeper.manager.TestAssets;
import nl.pim16aap2.protonkeeper.manager.cache.RuntimeCacheStore;
import nl.pim16aap2.protonkeeper.manager.cache.StagingHandle;
import nl.pim16aap2.protonkeeper.manager.util.HashUtil;
import nl.pim16aap2.protonkeeper.runtime.CancelToken;
import nl.pim16aap2.protonkeeper.runtime.FailureReason;
import nl.pim16aap2.protonkeeper.runtime.IntegrityCheck;
import nl.pim16aap2.protonkeeper.runtime.RuntimeAsset;
import nl.pim16aap2.protonkeeper.runtime.RuntimeInstallException;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatExceptionOfType;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ReleaseFetcherTest
{
    private static final String VERSION_ID = "ge-8.26";

    @TempDir
    private Path cacheRoot;

    private TestAssetServer server;
    private RuntimeCacheStore cacheStore;
    private ReleaseFetcher fetcher;

    @BeforeEach
    void init()
        throws Exception
    {
        server = TestAssetServer.start();
        cacheStore = new RuntimeCacheStore(cacheRoot, Clock.systemUTC());
        fetcher = new ReleaseFetcher(TestAssets.config(cacheRoot));
    }

    @AfterEach
    void cleanup()
    {
        server.close();
        fetcher.close();
    }

    @Test
    void fetch_shouldStreamPayloadAndComputeDigest()
        throws Exception
    {
        // setup
        final byte[] payload = TestAssets.payload(300_000);
        server.serve("/runtime.bin", payload);
        final RuntimeAsset asset = TestAssets.singleFileAsset(VERSION_ID, server.uri("/runtime.bin"), payload);
        final StagingHandle handle = cacheStore.beginInstall(asset);
        final RecordingListener listener = new RecordingListener();

        // execute
        final FetchedPayload result = fetcher.fetch(asset, handle, CancelToken.none(), listener);

        // verify
        assertThat(result.versionId()).isEqualTo(VERSION_ID);
        assertThat(result.sha256()).isEqualTo(HashUtil.sha256(payload));
        assertThat(result.sizeBytes()).isEqualTo(payload.length);
        assertThat(handle.downloadFile()).hasBinaryContent(payload);
        assertThat(listener.attempts).containsExactly(1);
        assertThat(listener.lastBytesDone).isEqualTo(payload.length);
        assertThat(listener.lastBytesTotal).isEqualTo(payload.length);
    }

    @Test
    void fetch_shouldRetryTransientFailures()
        throws Exception
    {
        // setup
        final byte[] payload = TestAssets.payload(1024);
        final TestAssetServer.Route route = server.serve("/runtime.bin", payload).failFirst(2, 503);
        final RuntimeAsset asset = TestAssets.singleFileAsset(VERSION_ID, server.uri("/runtime.bin"), payload);
        final StagingHandle handle = cacheStore.beginInstall(asset);
        final RecordingListener listener = new RecordingListener();

        // execute
        final FetchedPayload result = fetcher.fetch(asset, handle, CancelToken.none(), listener);

        // verify
        assertThat(result.sha256()).isEqualTo(HashUtil.sha256(payload));
        assertThat(route.requestCount()).isEqualTo(3);
        assertThat(listener.attempts).containsExactly(1, 2, 3);
    }

    @Test
    void fetch_shouldGiveUpAfterMaxAttempts()
        throws Exception
    {
        // setup
        final byte[] payload = TestAssets.payload(1024);
        final TestAssetServer.Route route = server.serve("/runtime.bin", payload).failFirst(10, 500);
        final RuntimeAsset asset = TestAssets.singleFileAsset(VERSION_ID, server.uri("/runtime.bin"), payload);
        final StagingHandle handle = cacheStore.beginInstall(asset);

        // execute & verify
        assertThatExceptionOfType(RuntimeInstallException.class)
            .isThrownBy(() -> fetcher.fetch(asset, handle, CancelToken.none(), FetchProgressListener.NONE))
            .satisfies(exception -> assertThat(exception.getReason()).isEqualTo(FailureReason.NETWORK_ERROR))
            .withMessageContaining("status 500");
        assertThat(route.requestCount()).isEqualTo(3);
    }

    @Test
    void fetch_shouldNotRetryMissingAsset()
        throws Exception
    {
        // setup
        final RuntimeAsset asset = TestAssets.singleFileAsset(
            VERSION_ID, server.uri("/missing.bin"), TestAssets.payload(8));
        final StagingHandle handle = cacheStore.beginInstall(asset);
        final RecordingListener listener = new RecordingListener();

        // execute & verify
        assertThatExceptionOfType(RuntimeInstallException.class)
            .isThrownBy(() -> fetcher.fetch(asset, handle, CancelToken.none(), listener))
            .satisfies(exception -> assertThat(exception.getReason()).isEqualTo(FailureReason.NOT_FOUND));
        assertThat(listener.attempts).containsExactly(1);
    }

    @Test
    void fetch_shouldRejectPayloadLargerThanDeclaredSize()
        throws Exception
    {
        // setup
        server.serve("/runtime.bin", TestAssets.payload(2048));
        final RuntimeAsset asset =
            new RuntimeAsset(VERSION_ID, server.uri("/runtime.bin"), "runtime.bin", IntegrityCheck.ofSize(1024));
        final StagingHandle handle = cacheStore.beginInstall(asset);

        // execute & verify
        assertThatExceptionOfType(RuntimeInstallException.class)
            .isThrownBy(() -> fetcher.fetch(asset, handle, CancelToken.none(), FetchProgressListener.NONE))
            .satisfies(exception -> assertThat(exception.getReason()).isEqualTo(FailureReason.INTEGRITY_ERROR));
    }

    @Test
    void fetch_shouldAbortWhenCancelledMidStream()
        throws Exception
    {
        // setup
        final byte[] payload = TestAssets.payload(512 * 1024);
        final TestAssetServer.Route route = server.serve("/runtime.bin", payload).pauseFirstResponseHalfway();
        final RuntimeAsset asset = TestAssets.singleFileAsset(VERSION_ID, server.uri("/runtime.bin"), payload);
        final StagingHandle handle = cacheStore.beginInstall(asset);
        final CancelToken cancelToken = CancelToken.create();
        final ExecutorService executor = Executors.newSingleThreadExecutor();

        try
        {
            final Future<FetchedPayload> result =
                executor.submit(() -> fetcher.fetch(asset, handle, cancelToken, FetchProgressListener.NONE));
            assertThat(route.awaitHalfway()).isTrue();

            // execute
            cancelToken.cancel();
            route.release();

            // verify
            assertThatThrownBy(() -> result.get(10, TimeUnit.SECONDS))
                .isInstanceOf(ExecutionException.class)
                .cause()
                .isInstanceOfSatisfying(
                    RuntimeInstallException.class,
                    exception -> assertThat(exception.getReason()).isEqualTo(FailureReason.CANCELLED)
                );
            assertThat(route.requestCount()).isEqualTo(1);
        }
        finally
        {
            executor.shutdownNow();
        }
    }

    @Test
    void fetch_shouldFailStalledAttemptOnceItsTimeLimitPasses()
        throws Exception
    {
        // setup
        final byte[] payload = TestAssets.payload(512 * 1024);
        final TestAssetServer.Route route = server.serve("/runtime.bin", payload).pauseFirstResponseHalfway();
        final RuntimeAsset asset = TestAssets.singleFileAsset(VERSION_ID, server.uri("/runtime.bin"), payload);
        final StagingHandle handle = cacheStore.beginInstall(asset);

        try (ReleaseFetcher limitedFetcher =
                 new ReleaseFetcher(TestAssets.config(cacheRoot, 1, Duration.ofMillis(500))))
        {
            // execute
            final long startNanos = System.nanoTime();
            assertThatExceptionOfType(RuntimeInstallException.class)
                .isThrownBy(() -> limitedFetcher.fetch(asset, handle, CancelToken.none(), FetchProgressListener.NONE))
                .satisfies(exception -> assertThat(exception.getReason()).isEqualTo(FailureReason.NETWORK_ERROR))
                .withMessageContaining("did not finish within");
            final Duration elapsed = Duration.ofNanos(System.nanoTime() - startNanos);

            // verify
            assertThat(elapsed).isLessThan(Duration.ofSeconds(5));
            assertThat(route.requestCount()).isEqualTo(1);
        }
    }

    @Test
    void fetch_shouldRetryAfterStalledAttemptTimesOut()
        throws Exception
    {
        // setup
        final byte[] payload = TestAssets.payload(512 * 1024);
        final TestAssetServer.Route route = server.serve("/runtime.bin", payload).pauseFirstResponseHalfway();
        final RuntimeAsset asset = TestAssets.singleFileAsset(VERSION_ID, server.uri("/runtime.bin"), payload);
        final StagingHandle handle = cacheStore.beginInstall(asset);
        final RecordingListener listener = new RecordingListener();

        try (ReleaseFetcher limitedFetcher =
                 new ReleaseFetcher(TestAssets.config(cacheRoot, 2, Duration.ofMillis(500))))
        {
            // execute
            final FetchedPayload result = limitedFetcher.fetch(asset, handle, CancelToken.none(), listener);

            // verify
            assertThat(result.sha256()).isEqualTo(HashUtil.sha256(payload));
            assertThat(handle.downloadFile()).hasBinaryContent(payload);
            assertThat(listener.attempts).containsExactly(1, 2);
            assertThat(route.requestCount()).isEqualTo(2);
        }
    }

    @Test
    void fetch_shouldNotStartWhenAlreadyCancelled()
        throws Exception
    {
        // setup
        final byte[] payload = TestAssets.payload(16);
        final TestAssetServer.Route route = server.serve("/runtime.bin", payload);
        final RuntimeAsset asset = TestAssets.singleFileAsset(VERSION_ID, server.uri("/runtime.bin"), payload);
        final StagingHandle handle = cacheStore.beginInstall(asset);
        final CancelToken cancelToken = CancelToken.create();
        cancelToken.cancel();

        // execute & verify
        assertThatExceptionOfType(RuntimeInstallException.class)
            .isThrownBy(() -> fetcher.fetch(asset, handle, cancelToken, FetchProgressListener.NONE))
            .satisfies(exception -> assertThat(exception.getReason()).isEqualTo(FailureReason.CANCELLED));
        assertThat(route.requestCount()).isZero();
    }

    @ParameterizedTest
    @CsvSource({
        "404, NOT_FOUND",
        "403, NOT_FOUND",
        "410, NOT_FOUND",
        "408, NETWORK_ERROR",
        "429, NETWORK_ERROR",
        "500, NETWORK_ERROR",
        "503, NETWORK_ERROR",
    })
    void classifyStatus_shouldOnlyRetryTransientStatusCodes(int statusCode, FailureReason expected)
    {
        // execute & verify
        assertThat(ReleaseFetcher.classifyStatus(statusCode)).isEqualTo(expected);
    }

    private static final class RecordingListener implements FetchProgressListener
    {
        private final List<Integer> attempts = new CopyOnWriteArrayList<>();
        private volatile long lastBytesDone = -1L;
        private volatile long lastBytesTotal = -1L;

        @Override
        public void onProgress(long bytesDone, long bytesTotal)
        {
            lastBytesDone = bytesDone;
            lastBytesTotal = bytesTotal;
        }

        @Override
        public void onAttempt(int attempt, int maxAttempts)
        {
            attempts.add(attempt);
        }
    }
}
