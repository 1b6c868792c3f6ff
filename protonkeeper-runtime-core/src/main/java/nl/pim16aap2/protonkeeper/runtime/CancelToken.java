package nl.pim16aap2.protonkeeper.runtime;

import java.util.List;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * A caller-owned cancellation flag.
 * <p>
 * Long-running operations poll {@link #isCancelled()} at every suspension point and may register callbacks that run
 * once when the token is cancelled. Callbacks registered after cancellation run immediately.
 */
public final class CancelToken
{
    private final AtomicBoolean cancelled = new AtomicBoolean(false);
    private final List<Runnable> callbacks = new CopyOnWriteArrayList<>();

    /**
     * @return A new token that is not cancelled.
     */
    public static CancelToken create()
    {
        return new CancelToken();
    }

    /**
     * @return A token that is never cancelled.
     */
    public static CancelToken none()
    {
        return new CancelToken();
    }

    public boolean isCancelled()
    {
        return cancelled.get();
    }

    /**
     * Cancels this token. Only the first call has any effect.
     */
    public void cancel()
    {
        if (!cancelled.compareAndSet(false, true))
            return;
        // Whoever removes a callback runs it: this loop or a concurrent onCancel.
        for (final Runnable callback : callbacks)
        {
            if (callbacks.remove(callback))
                callback.run();
        }
    }

    /**
     * Registers a callback that runs when this token is cancelled.
     *
     * @param callback
     *     The callback to run.
     * @return A handle that unregisters the callback when run.
     */
    public Runnable onCancel(Runnable callback)
    {
        Objects.requireNonNull(callback, "callback may not be null.");
        callbacks.add(callback);
        if (cancelled.get() && callbacks.remove(callback))
            callback.run();
        return () -> callbacks.remove(callback);
    }

    /**
     * @param versionId
     *     The version id used in the exception message.
     * @throws RuntimeInstallException
     *     If this token has been cancelled.
     */
    public void throwIfCancelled(String versionId)
        throws RuntimeInstallException
    {
        if (isCancelled())
            throw RuntimeInstallException.cancelled(versionId);
    }
}
