package nl.pim16aap2.protonkeeper.manager.registry;

import com.fasterxml.jackson.databind.JsonNode;
import nl.pim16aap2.protonkeeper.manager.util.FileUtil;
import nl.pim16aap2.protonkeeper.runtime.CancelToken;
import nl.pim16aap2.protonkeeper.runtime.FailureReason;
import nl.pim16aap2.protonkeeper.runtime.IntegrityCheck;
import nl.pim16aap2.protonkeeper.runtime.RuntimeAsset;
import nl.pim16aap2.protonkeeper.runtime.RuntimeInstallException;
import org.jspecify.annotations.Nullable;

import java.net.URI;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Lists runtime versions from a JSON manifest.
 * <p>
 * The manifest is either an array of entries or an object with a {@code versions} array:
 * <pre>{@code
 * [
 *   {"id": "ge-8.26", "url": "ge-8.26.tar.gz", "sha256": "...", "size": 123},
 *   ...
 * ]
 * }</pre>
 * {@code url} may be relative to the manifest. {@code fileName} defaults to the last segment of the url. At least one
 * of {@code sha256} and {@code size} is required.
 */
public final class ManifestRuntimeRegistry implements RuntimeRegistry
{
    private final RegistryHttpClient httpClient;
    private final URI manifestUri;

    ManifestRuntimeRegistry(RegistryHttpClient httpClient, URI manifestUri)
    {
        this.httpClient = Objects.requireNonNull(httpClient, "httpClient may not be null.");
        this.manifestUri = Objects.requireNonNull(manifestUri, "manifestUri may not be null.");
    }

    @Override
    public List<RuntimeAsset> listVersions(CancelToken cancelToken)
        throws RuntimeInstallException
    {
        final JsonNode root = httpClient.fetchJson(manifestUri, "application/json", cancelToken);
        final JsonNode entries = root.isObject() ? root.path("versions") : root;
        if (!entries.isArray())
            throw invalid("expected an array of versions");

        final List<RuntimeAsset> ret = new ArrayList<>();
        final Set<String> seen = new HashSet<>();
        for (final JsonNode entry : entries)
        {
            final RuntimeAsset asset = parseEntry(entry);
            if (!seen.add(asset.versionId()))
                throw invalid("duplicate version id '%s'".formatted(asset.versionId()));
            ret.add(asset);
        }
        return ret;
    }

    private RuntimeAsset parseEntry(JsonNode entry)
        throws RuntimeInstallException
    {
        final String id = entry.path("id").asText("");
        final String url = entry.path("url").asText("");
        if (id.isBlank() || url.isBlank())
            throw invalid("every entry needs an 'id' and a 'url'");

        try
        {
            FileUtil.requireSafeName(id, "version id");
            final URI downloadUri = manifestUri.resolve(url);
            final String fileName = entry.hasNonNull("fileName") ?
                entry.get("fileName").asText() : lastSegment(downloadUri);
            final @Nullable String sha256 = entry.hasNonNull("sha256") ? entry.get("sha256").asText() : null;
            final long size = entry.hasNonNull("size") ? entry.get("size").asLong(-1L) : -1L;
            return new RuntimeAsset(id, downloadUri, fileName, new IntegrityCheck(sha256, size));
        }
        catch (IllegalArgumentException exception)
        {
            throw new RuntimeInstallException(
                FailureReason.NETWORK_ERROR,
                "Invalid entry '%s' in runtime manifest '%s': %s".formatted(id, manifestUri, exception.getMessage()),
                exception
            );
        }
    }

    private static String lastSegment(URI uri)
    {
        final String path = Objects.requireNonNullElse(uri.getPath(), "");
        final int index = path.lastIndexOf('/');
        final String ret = index < 0 ? path : path.substring(index + 1);
        if (ret.isBlank())
            throw new IllegalArgumentException("Cannot derive a file name from '%s'.".formatted(uri));
        return ret;
    }

    private RuntimeInstallException invalid(String problem)
    {
        return new RuntimeInstallException(
            FailureReason.NETWORK_ERROR,
            "Invalid runtime manifest '%s': %s.".formatted(manifestUri, problem)
        );
    }
}
