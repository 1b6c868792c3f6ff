package nl.pim16aap2.protonkeeper.manager.fetch;

/**
 * Receives progress updates while an asset is downloaded.
 */
@FunctionalInterface
public interface FetchProgressListener
{
    FetchProgressListener NONE = (bytesDone, bytesTotal) ->
    {
    };

    /**
     * Called after every chunk.
     *
     * @param bytesDone
     *     The number of bytes received in the current attempt.
     * @param bytesTotal
     *     The expected total, or {@code -1} if unknown.
     */
    void onProgress(long bytesDone, long bytesTotal);

    /**
     * Called before every attempt, including the first one.
     *
     * @param attempt
     *     The 1-based attempt number.
     * @param maxAttempts
     *     The maximum number of attempts.
     */
    default void onAttempt(int attempt, int maxAttempts)
    {
    }
}
