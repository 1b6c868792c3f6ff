package nl.pim16aap2.protonkeeper.manager.fetch;

import lombok.extern.java.Log;
import nl.pim16aap2.protonkeeper.manager.cache.StagingHandle;
import nl.pim16aap2.protonkeeper.manager.config.RuntimeManagerConfig;
import nl.pim16aap2.protonkeeper.manager.util.HashUtil;
import nl.pim16aap2.protonkeeper.runtime.CancelToken;
import nl.pim16aap2.protonkeeper.runtime.FailureReason;
import nl.pim16aap2.protonkeeper.runtime.IntegrityCheck;
import nl.pim16aap2.protonkeeper.runtime.RuntimeAsset;
import nl.pim16aap2.protonkeeper.runtime.RuntimeInstallException;
import org.apache.commons.io.IOUtils;
import org.jspecify.annotations.Nullable;

import javax.inject.Inject;
import javax.inject.Singleton;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.file.Files;
import java.nio.file.StandardOpenOption;
import java.security.MessageDigest;
import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.ScheduledThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.logging.Level;

/**
 * Streams runtime assets into staging locations while computing their SHA-256 digest.
 * <p>
 * Transient failures (connection problems, timeouts, 408/429 and 5xx responses) are retried with exponential backoff
 * up to {@link RuntimeManagerConfig#maxAttempts()} attempts. Every attempt starts from scratch: partially downloaded
 * data is never resumed. Any other failure is terminal.
 * <p>
 * An attempt that does not finish within {@link RuntimeManagerConfig#attemptTimeout()} has its response body closed
 * from a watchdog thread, which turns a stalled read into a retryable network failure.
 */
@Log
@Singleton
public final class ReleaseFetcher implements AutoCloseable
{
    private static final int BUFFER_SIZE = 64 * 1024;

    private final RuntimeManagerConfig config;
    private final HttpClient httpClient;
    private final ScheduledThreadPoolExecutor watchdog;

    @Inject
    public ReleaseFetcher(RuntimeManagerConfig config)
    {
        this(
            config,
            HttpClient.newBuilder()
                .followRedirects(HttpClient.Redirect.NORMAL)
                .connectTimeout(config.connectTimeout())
                .build()
        );
    }

    public ReleaseFetcher(RuntimeManagerConfig config, HttpClient httpClient)
    {
        this.config = Objects.requireNonNull(config, "config may not be null.");
        this.httpClient = Objects.requireNonNull(httpClient, "httpClient may not be null.");

        this.watchdog = new ScheduledThreadPoolExecutor(1, runnable ->
        {
            final Thread thread = new Thread(runnable, "protonkeeper-fetch-watchdog");
            thread.setDaemon(true);
            return thread;
        });
        this.watchdog.setRemoveOnCancelPolicy(true);
    }

    /**
     * Downloads an asset into a staging location.
     *
     * @param asset
     *     The asset to download.
     * @param stagingHandle
     *     The staging location to download into.
     * @param cancelToken
     *     The token that aborts the download when cancelled.
     * @param progressListener
     *     Receives progress updates.
     * @return The digest and size of the downloaded payload. The caller validates these against the declared values.
     *
     * @throws RuntimeInstallException
     *     If the download failed terminally or was cancelled.
     */
    public FetchedPayload fetch(
        RuntimeAsset asset,
        StagingHandle stagingHandle,
        CancelToken cancelToken,
        FetchProgressListener progressListener)
        throws RuntimeInstallException
    {
        final int maxAttempts = config.maxAttempts();
        for (int attempt = 1; ; ++attempt)
        {
            cancelToken.throwIfCancelled(asset.versionId());
            progressListener.onAttempt(attempt, maxAttempts);
            try
            {
                return attemptFetch(asset, stagingHandle, cancelToken, progressListener);
            }
            catch (RuntimeInstallException exception)
            {
                if (!exception.isRetryable() || attempt >= maxAttempts)
                    throw exception;

                final Duration delay = config.backoffFor(attempt);
                log.warning("Attempt %d/%d to download runtime version '%s' failed: %s Retrying in %d ms."
                    .formatted(attempt, maxAttempts, asset.versionId(), exception.getMessage(), delay.toMillis()));
                sleep(delay, cancelToken, asset.versionId());
            }
        }
    }

    private FetchedPayload attemptFetch(
        RuntimeAsset asset,
        StagingHandle stagingHandle,
        CancelToken cancelToken,
        FetchProgressListener progressListener)
        throws RuntimeInstallException
    {
        final String versionId = asset.versionId();
        final long startNanos = System.nanoTime();
        final HttpResponse<InputStream> response = send(asset, cancelToken);
        final Duration remaining = config.attemptTimeout().minusNanos(System.nanoTime() - startNanos);
        if (remaining.isNegative() || remaining.isZero())
        {
            closeBody(response, versionId);
            throw attemptTimedOut(versionId);
        }

        final IntegrityCheck integrity = asset.integrity();
        final long bytesTotal = response.headers().firstValueAsLong("Content-Length").orElse(integrity.sizeBytes());

        final MessageDigest digest = HashUtil.newSha256Digest();
        final byte[] buffer = new byte[BUFFER_SIZE];
        long bytesDone = 0L;
        progressListener.onProgress(0L, bytesTotal);

        final AtomicBoolean timedOut = new AtomicBoolean();
        try (InputStream body = response.body(); OutputStream output = openDownloadFile(stagingHandle))
        {
            final Runnable abort = () -> IOUtils.closeQuietly(body, exception -> log.log(
                Level.FINE, "Failed to close download stream of runtime version '%s'.".formatted(versionId),
                exception));
            final Runnable unregister = cancelToken.onCancel(abort);
            final ScheduledFuture<?> timer = watchdog.schedule(
                () ->
                {
                    timedOut.set(true);
                    log.fine(() -> "Download attempt of runtime version '%s' timed out.".formatted(versionId));
                    abort.run();
                },
                remaining.toNanos(),
                TimeUnit.NANOSECONDS
            );
            try
            {
                while (true)
                {
                    cancelToken.throwIfCancelled(versionId);
                    if (timedOut.get())
                        throw attemptTimedOut(versionId);

                    final int read = readChunk(body, buffer, cancelToken, timedOut, versionId);
                    if (read == -1)
                        break;

                    writeChunk(output, buffer, read, stagingHandle);
                    digest.update(buffer, 0, read);
                    bytesDone += read;

                    if (!integrity.hasDigest() && bytesDone > integrity.sizeBytes())
                        throw new RuntimeInstallException(
                            FailureReason.INTEGRITY_ERROR,
                            "Runtime version '%s' exceeds its declared size of %d bytes."
                                .formatted(versionId, integrity.sizeBytes())
                        );
                    progressListener.onProgress(bytesDone, bytesTotal);
                }
            }
            finally
            {
                timer.cancel(false);
                unregister.run();
            }
        }
        catch (IOException exception)
        {
            throw failure(
                exception, cancelToken, timedOut, versionId, "Failed to close download of runtime version '%s'.");
        }

        // A body closed by the watchdog or a cancellation may report a normal end of stream.
        cancelToken.throwIfCancelled(versionId);
        if (timedOut.get())
            throw attemptTimedOut(versionId);

        final String sha256 = HashUtil.toHex(digest.digest());
        final long sizeBytes = bytesDone;
        log.fine(() -> "Downloaded %d bytes for runtime version '%s' (sha256=%s)."
            .formatted(sizeBytes, versionId, sha256));
        return new FetchedPayload(versionId, sha256, sizeBytes);
    }

    private HttpResponse<InputStream> send(RuntimeAsset asset, CancelToken cancelToken)
        throws RuntimeInstallException
    {
        final HttpRequest request = HttpRequest.newBuilder(asset.downloadUri())
            .header("User-Agent", config.userAgent())
            .header("Accept", "application/octet-stream")
            .timeout(config.attemptTimeout())
            .GET()
            .build();

        final HttpResponse<InputStream> response;
        try
        {
            response = httpClient.send(request, HttpResponse.BodyHandlers.ofInputStream());
        }
        catch (InterruptedException exception)
        {
            Thread.currentThread().interrupt();
            throw new RuntimeInstallException(
                FailureReason.CANCELLED,
                "Download of runtime version '%s' was interrupted.".formatted(asset.versionId()),
                exception
            );
        }
        catch (IOException exception)
        {
            throw failure(
                exception, cancelToken, null, asset.versionId(), "Failed to request runtime version '%s'.");
        }

        final int statusCode = response.statusCode();
        if (statusCode >= 200 && statusCode < 300)
            return response;

        closeBody(response, asset.versionId());
        final FailureReason reason = classifyStatus(statusCode);
        throw new RuntimeInstallException(
            reason,
            "Download of runtime version '%s' from '%s' failed with status %d."
                .formatted(asset.versionId(), asset.downloadUri(), statusCode)
        );
    }

    static FailureReason classifyStatus(int statusCode)
    {
        if (statusCode == 408 || statusCode == 429 || statusCode >= 500)
            return FailureReason.NETWORK_ERROR;
        return FailureReason.NOT_FOUND;
    }

    private static OutputStream openDownloadFile(StagingHandle stagingHandle)
        throws RuntimeInstallException
    {
        try
        {
            return Files.newOutputStream(
                stagingHandle.downloadFile(),
                StandardOpenOption.CREATE,
                StandardOpenOption.TRUNCATE_EXISTING,
                StandardOpenOption.WRITE
            );
        }
        catch (IOException exception)
        {
            throw new RuntimeInstallException(
                FailureReason.DISK_ERROR,
                "Failed to open download file '%s'.".formatted(stagingHandle.downloadFile()),
                exception
            );
        }
    }

    private int readChunk(
        InputStream body,
        byte[] buffer,
        CancelToken cancelToken,
        AtomicBoolean timedOut,
        String versionId)
        throws RuntimeInstallException
    {
        try
        {
            return body.read(buffer);
        }
        catch (IOException exception)
        {
            throw failure(
                exception, cancelToken, timedOut, versionId, "Connection lost while downloading runtime version '%s'.");
        }
    }

    private static void writeChunk(OutputStream output, byte[] buffer, int length, StagingHandle stagingHandle)
        throws RuntimeInstallException
    {
        try
        {
            output.write(buffer, 0, length);
        }
        catch (IOException exception)
        {
            throw new RuntimeInstallException(
                FailureReason.DISK_ERROR,
                "Failed to write to download file '%s'.".formatted(stagingHandle.downloadFile()),
                exception
            );
        }
    }

    private RuntimeInstallException attemptTimedOut(String versionId)
    {
        return new RuntimeInstallException(
            FailureReason.NETWORK_ERROR,
            "Download of runtime version '%s' did not finish within %s."
                .formatted(versionId, config.attemptTimeout())
        );
    }

    private RuntimeInstallException failure(
        IOException exception,
        CancelToken cancelToken,
        @Nullable AtomicBoolean timedOut,
        String versionId,
        String messageFormat)
    {
        if (cancelToken.isCancelled())
            return new RuntimeInstallException(
                FailureReason.CANCELLED,
                "Download of runtime version '%s' was cancelled.".formatted(versionId),
                exception
            );
        if (timedOut != null && timedOut.get())
        {
            final RuntimeInstallException timeout = attemptTimedOut(versionId);
            timeout.addSuppressed(exception);
            return timeout;
        }
        return new RuntimeInstallException(FailureReason.NETWORK_ERROR, messageFormat.formatted(versionId), exception);
    }

    private static void closeBody(HttpResponse<InputStream> response, String versionId)
    {
        IOUtils.closeQuietly(response.body(), exception -> log.log(
            Level.FINE, "Failed to close error response of runtime version '%s'.".formatted(versionId), exception));
    }

    private static void sleep(Duration delay, CancelToken cancelToken, String versionId)
        throws RuntimeInstallException
    {
        final CountDownLatch latch = new CountDownLatch(1);
        final Runnable unregister = cancelToken.onCancel(latch::countDown);
        try
        {
            if (latch.await(delay.toMillis(), TimeUnit.MILLISECONDS))
                throw RuntimeInstallException.cancelled(versionId);
        }
        catch (InterruptedException exception)
        {
            Thread.currentThread().interrupt();
            throw new RuntimeInstallException(
                FailureReason.CANCELLED,
                "Retry of runtime version '%s' was interrupted.".formatted(versionId),
                exception
            );
        }
        finally
        {
            unregister.run();
        }
    }

    /**
     * Stops the watchdog thread. Attempts that are still running lose their time limit.
     */
    @Override
    public void close()
    {
        watchdog.shutdownNow();
    }
}
