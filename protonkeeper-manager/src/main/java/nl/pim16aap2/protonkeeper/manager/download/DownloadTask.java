package nl.pim16aap2.protonkeeper.manager.download;

import lombok.Getter;
import lombok.ToString;
import lombok.experimental.Accessors;
import nl.pim16aap2.protonkeeper.manager.fetch.FetchProgressListener;
import nl.pim16aap2.protonkeeper.runtime.CancelToken;
import nl.pim16aap2.protonkeeper.runtime.InstallState;
import nl.pim16aap2.protonkeeper.runtime.ProgressSnapshot;
import nl.pim16aap2.protonkeeper.runtime.RuntimeAsset;
import org.jspecify.annotations.Nullable;

import java.nio.file.Path;
import java.util.concurrent.CompletableFuture;

/**
 * A single install attempt of one version, shared by all of its subscribers.
 * <p>
 * The subscriber count is only read and written while holding the owning coordinator's lock.
 */
@Getter
@Accessors(fluent = true)
@ToString(onlyExplicitlyIncluded = true)
final class DownloadTask implements FetchProgressListener
{
    @ToString.Include
    private final String versionId;

    private final RuntimeAsset asset;

    private final CancelToken cancelToken = CancelToken.create();

    private final CompletableFuture<Path> future = new CompletableFuture<>();

    /**
     * The abandoned task of the same version that must finish before this one may start.
     */
    private final @Nullable DownloadTask predecessor;

    @ToString.Include
    private int subscribers;

    private volatile long bytesDone;
    private volatile long bytesTotal = -1L;
    private volatile InstallState phase = InstallState.STAGING;

    DownloadTask(RuntimeAsset asset, @Nullable DownloadTask predecessor)
    {
        this.versionId = asset.versionId();
        this.asset = asset;
        this.predecessor = predecessor;
    }

    int subscribe()
    {
        return ++subscribers;
    }

    int unsubscribe()
    {
        return subscribers > 0 ? --subscribers : 0;
    }

    void enterPhase(InstallState phase)
    {
        this.phase = phase;
    }

    @Override
    public void onProgress(long bytesDone, long bytesTotal)
    {
        this.bytesDone = bytesDone;
        this.bytesTotal = bytesTotal;
    }

    @Override
    public void onAttempt(int attempt, int maxAttempts)
    {
        bytesDone = 0L;
    }

    ProgressSnapshot snapshot()
    {
        return new ProgressSnapshot(versionId, bytesDone, bytesTotal, phase, null);
    }
}
