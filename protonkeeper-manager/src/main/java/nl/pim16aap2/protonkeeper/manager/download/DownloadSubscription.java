package nl.pim16aap2.protonkeeper.manager.download;

import nl.pim16aap2.protonkeeper.runtime.FailureReason;
import nl.pim16aap2.protonkeeper.runtime.RuntimeInstallException;

import java.nio.file.Path;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;

/**
 * One caller's claim on a shared install attempt.
 * <p>
 * Cancelling a subscription only completes this subscription. The underlying download keeps running for as long as
 * other subscriptions remain.
 */
public final class DownloadSubscription
{
    private final DownloadCoordinator coordinator;
    private final DownloadTask task;
    private final CompletableFuture<Path> result = new CompletableFuture<>();

    DownloadSubscription(DownloadCoordinator coordinator, DownloadTask task)
    {
        this.coordinator = coordinator;
        this.task = task;
        task.future().whenComplete((path, throwable) ->
        {
            if (throwable == null)
                result.complete(path);
            else
                result.completeExceptionally(unwrap(throwable));
        });
    }

    public String versionId()
    {
        return task.versionId();
    }

    /**
     * @return The future that completes with the installed directory, or exceptionally with a
     * {@link RuntimeInstallException}.
     */
    public CompletableFuture<Path> future()
    {
        return result.copy();
    }

    public boolean isDone()
    {
        return result.isDone();
    }

    /**
     * Blocks until the install attempt has finished or this subscription was cancelled.
     *
     * @return The directory of the installed version.
     *
     * @throws RuntimeInstallException
     *     The failure of the install attempt, or {@link FailureReason#CANCELLED} if this subscription was cancelled or
     *     the waiting thread was interrupted.
     */
    public Path await()
        throws RuntimeInstallException
    {
        try
        {
            return result.get();
        }
        catch (InterruptedException exception)
        {
            Thread.currentThread().interrupt();
            cancel();
            throw new RuntimeInstallException(
                FailureReason.CANCELLED,
                "Interrupted while waiting for runtime version '%s'.".formatted(versionId()),
                exception
            );
        }
        catch (ExecutionException exception)
        {
            final Throwable cause = exception.getCause();
            if (cause instanceof RuntimeInstallException runtimeInstallException)
                throw runtimeInstallException;
            if (cause instanceof RuntimeException runtimeException)
                throw runtimeException;
            throw new IllegalStateException(
                "Unexpected failure while installing runtime version '%s'.".formatted(versionId()), cause);
        }
    }

    /**
     * Cancels this subscription. Has no effect once the subscription has completed.
     */
    public void cancel()
    {
        if (result.completeExceptionally(RuntimeInstallException.cancelled(versionId())))
            coordinator.unsubscribe(task);
    }

    private static Throwable unwrap(Throwable throwable)
    {
        if (throwable instanceof CompletionException && throwable.getCause() != null)
            return throwable.getCause();
        return throwable;
    }
}
