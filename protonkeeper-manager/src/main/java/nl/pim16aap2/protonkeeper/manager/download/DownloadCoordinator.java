package nl.pim16aap2.protonkeeper.manager.download;

import com.google.errorprone.annotations.concurrent.GuardedBy;
import lombok.extern.java.Log;
import nl.pim16aap2.protonkeeper.manager.cache.RuntimeCacheStore;
import nl.pim16aap2.protonkeeper.manager.cache.StagingHandle;
import nl.pim16aap2.protonkeeper.manager.config.RuntimeManagerConfig;
import nl.pim16aap2.protonkeeper.manager.fetch.FetchedPayload;
import nl.pim16aap2.protonkeeper.manager.fetch.ReleaseFetcher;
import nl.pim16aap2.protonkeeper.runtime.FailureReason;
import nl.pim16aap2.protonkeeper.runtime.InstallState;
import nl.pim16aap2.protonkeeper.runtime.ProgressSnapshot;
import nl.pim16aap2.protonkeeper.runtime.RuntimeAsset;
import nl.pim16aap2.protonkeeper.runtime.RuntimeInstallException;
import org.jspecify.annotations.Nullable;

import javax.inject.Inject;
import javax.inject.Singleton;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.logging.Level;

/**
 * Deduplicates install requests per version.
 * <p>
 * While an install attempt of a version is running, every new request for that version subscribes to the running
 * attempt instead of starting a new one, and all subscribers observe the same result. The underlying download is
 * cancelled once its last subscriber cancels. A new request for a version whose abandoned attempt is still winding
 * down starts a fresh attempt that waits for the abandoned one to release its staging location.
 */
@Log
@Singleton
public final class DownloadCoordinator implements AutoCloseable
{
    private static final long SHUTDOWN_TIMEOUT_SECONDS = 10L;

    private final RuntimeCacheStore cacheStore;
    private final ReleaseFetcher releaseFetcher;
    private final ExecutorService executor;

    private final Object lock = new Object();

    @GuardedBy("lock")
    private final Map<String, DownloadTask> activeTasks = new HashMap<>();

    @GuardedBy("lock")
    private final Map<String, DownloadTask> abandonedTasks = new HashMap<>();

    @GuardedBy("lock")
    private boolean closed;

    private final Map<String, ProgressSnapshot> lastSnapshots = new ConcurrentHashMap<>();

    @Inject
    public DownloadCoordinator(RuntimeManagerConfig config, RuntimeCacheStore cacheStore, ReleaseFetcher releaseFetcher)
    {
        this(
            cacheStore,
            releaseFetcher,
            Executors.newFixedThreadPool(config.downloadThreads(), new DownloadThreadFactory())
        );
    }

    public DownloadCoordinator(RuntimeCacheStore cacheStore, ReleaseFetcher releaseFetcher, ExecutorService executor)
    {
        this.cacheStore = Objects.requireNonNull(cacheStore, "cacheStore may not be null.");
        this.releaseFetcher = Objects.requireNonNull(releaseFetcher, "releaseFetcher may not be null.");
        this.executor = Objects.requireNonNull(executor, "executor may not be null.");
    }

    /**
     * Requests a version to be installed, joining the running attempt for that version if there is one.
     *
     * @param asset
     *     The asset to install.
     * @return A subscription on the shared install attempt.
     *
     * @throws IllegalStateException
     *     If this coordinator has been closed.
     */
    public DownloadSubscription request(RuntimeAsset asset)
    {
        Objects.requireNonNull(asset, "asset may not be null.");
        final String versionId = asset.versionId();

        final DownloadTask task;
        final DownloadSubscription subscription;
        final boolean created;
        synchronized (lock)
        {
            if (closed)
                throw new IllegalStateException("The download coordinator has been closed.");

            final @Nullable DownloadTask existing = activeTasks.get(versionId);
            created = existing == null;
            task = created ? new DownloadTask(asset, abandonedTasks.get(versionId)) : existing;
            if (created)
            {
                activeTasks.put(versionId, task);
                lastSnapshots.remove(versionId);
            }
            task.subscribe();
            subscription = new DownloadSubscription(this, task);
        }

        if (created)
        {
            log.fine(() -> "Starting install attempt %s.".formatted(task));
            final @Nullable DownloadTask predecessor = task.predecessor();
            if (predecessor == null)
                schedule(task);
            else
                predecessor.future().whenComplete((path, throwable) -> schedule(task));
        }
        else
        {
            log.fine(() -> "Joined running install attempt %s.".formatted(task));
        }
        return subscription;
    }

    /**
     * @param versionId
     *     The version id.
     * @return The progress of the running install attempt of the version, or the final progress of its last attempt.
     */
    public ProgressSnapshot progress(String versionId)
    {
        synchronized (lock)
        {
            final @Nullable DownloadTask task = activeTasks.get(versionId);
            if (task != null)
                return task.snapshot();
        }

        final InstallState state = cacheStore.has(versionId);
        final @Nullable ProgressSnapshot last = lastSnapshots.get(versionId);
        if (last != null && last.state() == state)
            return last;
        return ProgressSnapshot.of(versionId, state);
    }

    /**
     * @param versionId
     *     The version id.
     * @return {@code true} if an install attempt of the version is running and accepting subscribers.
     */
    public boolean isInstalling(String versionId)
    {
        synchronized (lock)
        {
            return activeTasks.containsKey(versionId);
        }
    }

    void unsubscribe(DownloadTask task)
    {
        synchronized (lock)
        {
            if (task.unsubscribe() > 0 || task.future().isDone())
                return;

            // Abandoned: new requests must not join a cancelled attempt.
            activeTasks.remove(task.versionId(), task);
            abandonedTasks.put(task.versionId(), task);
        }
        log.info("Cancelling install of runtime version '%s': no subscribers remain.".formatted(task.versionId()));
        task.cancelToken().cancel();
    }

    private void schedule(DownloadTask task)
    {
        try
        {
            executor.execute(() -> run(task));
        }
        catch (RejectedExecutionException exception)
        {
            finish(task, null, new RuntimeInstallException(
                FailureReason.CANCELLED,
                "Install of runtime version '%s' was rejected: the coordinator is shutting down."
                    .formatted(task.versionId()),
                exception
            ));
        }
    }

    private void run(DownloadTask task)
    {
        try
        {
            finish(task, install(task), null);
        }
        catch (RuntimeInstallException exception)
        {
            finish(task, null, exception);
        }
        catch (RuntimeException exception)
        {
            log.log(Level.SEVERE, "Unexpected failure installing runtime version '%s'.".formatted(task.versionId()),
                exception);
            finish(task, null, exception);
        }
    }

    private Path install(DownloadTask task)
        throws RuntimeInstallException
    {
        final String versionId = task.versionId();
        task.cancelToken().throwIfCancelled(versionId);

        final Optional<Path> installed = cacheStore.path(versionId);
        if (installed.isPresent())
            return installed.get();

        final StagingHandle handle = cacheStore.beginInstall(task.asset());
        try
        {
            final FetchedPayload payload = releaseFetcher.fetch(task.asset(), handle, task.cancelToken(), task);
            task.cancelToken().throwIfCancelled(versionId);
            task.enterPhase(InstallState.VERIFYING);
            return cacheStore.commitInstall(handle, payload);
        }
        catch (RuntimeInstallException exception)
        {
            cacheStore.discardInstall(handle, exception.getReason());
            throw exception;
        }
        catch (RuntimeException exception)
        {
            cacheStore.discardInstall(handle, FailureReason.DISK_ERROR);
            throw exception;
        }
    }

    private void finish(DownloadTask task, @Nullable Path path, @Nullable Exception failure)
    {
        final String versionId = task.versionId();
        final ProgressSnapshot progress = task.snapshot();
        final @Nullable FailureReason reason = failure == null ? null : reasonOf(failure);
        final InstallState state = failure == null ? InstallState.INSTALLED :
            (reason == FailureReason.CANCELLED ? InstallState.MISSING : InstallState.FAILED);

        synchronized (lock)
        {
            activeTasks.remove(versionId, task);
            abandonedTasks.remove(versionId, task);
            lastSnapshots.put(
                versionId,
                new ProgressSnapshot(versionId, progress.bytesDone(), progress.bytesTotal(), state, reason)
            );
        }

        if (failure == null)
        {
            task.future().complete(Objects.requireNonNull(path));
            return;
        }

        if (reason == FailureReason.CANCELLED)
            log.info("Install of runtime version '%s' was cancelled.".formatted(versionId));
        else
            log.warning("Failed to install runtime version '%s': %s".formatted(versionId, failure.getMessage()));
        task.future().completeExceptionally(failure);
    }

    private static FailureReason reasonOf(Exception exception)
    {
        return exception instanceof RuntimeInstallException runtimeInstallException ?
            runtimeInstallException.getReason() : FailureReason.DISK_ERROR;
    }

    /**
     * Cancels every running install attempt and stops the download threads and the fetcher.
     */
    @Override
    public void close()
    {
        final List<DownloadTask> running;
        synchronized (lock)
        {
            if (closed)
                return;
            closed = true;
            running = new ArrayList<>(activeTasks.values());
            running.addAll(abandonedTasks.values());
        }

        for (final DownloadTask task : running)
            task.cancelToken().cancel();

        executor.shutdown();
        try
        {
            if (!executor.awaitTermination(SHUTDOWN_TIMEOUT_SECONDS, TimeUnit.SECONDS))
            {
                log.warning("Download threads did not stop within %d seconds; interrupting them."
                    .formatted(SHUTDOWN_TIMEOUT_SECONDS));
                executor.shutdownNow();
            }
        }
        catch (InterruptedException exception)
        {
            Thread.currentThread().interrupt();
            executor.shutdownNow();
        }
        finally
        {
            releaseFetcher.close();
        }
    }

    private static final class DownloadThreadFactory implements ThreadFactory
    {
        private final AtomicInteger counter = new AtomicInteger();

        @Override
        public Thread newThread(Runnable runnable)
        {
            final Thread thread = new Thread(runnable, "protonkeeper-download-" + counter.getAndIncrement());
            thread.setDaemon(true);
            return thread;
        }
    }
}
