package nl.pim16aap2.protonkeeper.manager.registry;

import nl.pim16aap2.protonkeeper.runtime.CancelToken;
import nl.pim16aap2.protonkeeper.runtime.RuntimeAsset;
import nl.pim16aap2.protonkeeper.runtime.RuntimeInstallException;

import java.util.List;
import java.util.Optional;

/**
 * A listing of the runtime versions that can be downloaded.
 */
public interface RuntimeRegistry
{
    /**
     * Lists all downloadable versions.
     * <p>
     * Implementations that block on remote calls should abort them when the token is cancelled.
     *
     * @param cancelToken
     *     Aborts the lookup when cancelled.
     * @return The versions, newest first. Version ids are stable across calls.
     *
     * @throws RuntimeInstallException
     *     With {@link nl.pim16aap2.protonkeeper.runtime.FailureReason#NETWORK_ERROR} if the registry could not be
     *     reached or returned an unusable response, or with
     *     {@link nl.pim16aap2.protonkeeper.runtime.FailureReason#CANCELLED} if the token was cancelled.
     */
    List<RuntimeAsset> listVersions(CancelToken cancelToken)
        throws RuntimeInstallException;

    default List<RuntimeAsset> listVersions()
        throws RuntimeInstallException
    {
        return listVersions(CancelToken.none());
    }

    /**
     * Looks up a single version.
     *
     * @param versionId
     *     The version id to look for.
     * @param cancelToken
     *     Aborts the lookup when cancelled.
     * @return The asset of the version, or an empty optional if the registry does not know the version.
     *
     * @throws RuntimeInstallException
     *     If the registry could not be queried or the lookup was cancelled.
     */
    default Optional<RuntimeAsset> find(String versionId, CancelToken cancelToken)
        throws RuntimeInstallException
    {
        cancelToken.throwIfCancelled(versionId);
        for (final RuntimeAsset asset : listVersions(cancelToken))
        {
            if (asset.versionId().equals(versionId))
                return Optional.of(asset);
        }
        return Optional.empty();
    }

    default Optional<RuntimeAsset> find(String versionId)
        throws RuntimeInstallException
    {
        return find(versionId, CancelToken.none());
    }
}
