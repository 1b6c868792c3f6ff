package nl.pim16aap2.protonkeeper.manager.registry;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.extern.java.Log;
import nl.pim16aap2.protonkeeper.manager.util.FileUtil;
import nl.pim16aap2.protonkeeper.runtime.CancelToken;
import nl.pim16aap2.protonkeeper.runtime.FailureReason;
import nl.pim16aap2.protonkeeper.runtime.IntegrityCheck;
import nl.pim16aap2.protonkeeper.runtime.RuntimeAsset;
import nl.pim16aap2.protonkeeper.runtime.RuntimeInstallException;
import org.jspecify.annotations.Nullable;

import java.io.IOException;
import java.net.URI;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Lists runtime versions published as GitHub releases.
 * <p>
 * Release tags of the form {@code GE-Proton<major>-<minor>} are mapped to version ids {@code ge-<major>.<minor>};
 * other tags are used lowercased. The {@code .tar.gz} asset of every release is the downloadable payload. Its
 * {@code sha256:} digest is used when GitHub publishes one, otherwise its declared size.
 */
@Log
public final class GitHubReleasesRegistry implements RuntimeRegistry
{
    public static final URI DEFAULT_URI =
        URI.create("https://api.github.com/repos/GloriousEggroll/proton-ge-custom/releases?per_page=100");

    private static final Pattern GE_PROTON_TAG = Pattern.compile("GE-Proton(?<major>\\d+)-(?<minor>\\d+)");
    private static final String DIGEST_PREFIX = "sha256:";
    private static final String ACCEPT = "application/vnd.github+json";

    private final RegistryHttpClient httpClient;
    private final URI releasesUri;

    GitHubReleasesRegistry(RegistryHttpClient httpClient, @Nullable URI releasesUri)
    {
        this.httpClient = Objects.requireNonNull(httpClient, "httpClient may not be null.");
        this.releasesUri = releasesUri == null ? DEFAULT_URI : releasesUri;
    }

    @Override
    public List<RuntimeAsset> listVersions(CancelToken cancelToken)
        throws RuntimeInstallException
    {
        final JsonNode root = httpClient.fetchJson(releasesUri, ACCEPT, cancelToken);
        if (!root.isArray())
            throw new RuntimeInstallException(
                FailureReason.NETWORK_ERROR,
                "Expected GitHub releases endpoint '%s' to return an array.".formatted(releasesUri)
            );

        final List<ReleaseResponse> releases;
        try
        {
            releases = httpClient.objectMapper().readValue(root.traverse(), new TypeReference<>()
            {
            });
        }
        catch (IOException exception)
        {
            throw new RuntimeInstallException(
                FailureReason.NETWORK_ERROR,
                "Failed to parse GitHub releases from '%s'.".formatted(releasesUri),
                exception
            );
        }

        final List<RuntimeAsset> ret = new ArrayList<>();
        for (final ReleaseResponse release : releases)
            toAsset(release).ifPresent(ret::add);
        log.fine(() -> "Found %d runtime versions at '%s'.".formatted(ret.size(), releasesUri));
        return ret;
    }

    /**
     * Maps a release tag to a version id.
     *
     * @param tag
     *     The release tag.
     * @return The version id.
     */
    static String versionIdOf(String tag)
    {
        final Matcher matcher = GE_PROTON_TAG.matcher(tag.trim());
        if (matcher.matches())
            return "ge-%s.%s".formatted(matcher.group("major"), matcher.group("minor"));
        return tag.trim().toLowerCase(Locale.ROOT);
    }

    private static Optional<RuntimeAsset> toAsset(ReleaseResponse release)
    {
        if (release.draft() || release.tagName() == null || release.assets() == null)
            return Optional.empty();

        final String versionId = versionIdOf(release.tagName());
        try
        {
            FileUtil.requireSafeName(versionId, "version id");
        }
        catch (IllegalArgumentException exception)
        {
            log.fine(() -> "Skipping release '%s': %s".formatted(release.tagName(), exception.getMessage()));
            return Optional.empty();
        }

        for (final AssetResponse asset : release.assets())
        {
            if (asset.name() == null || asset.browserDownloadUrl() == null ||
                !asset.name().toLowerCase(Locale.ROOT).endsWith(".tar.gz"))
                continue;

            final @Nullable String digest = asset.digest();
            try
            {
                final IntegrityCheck integrity = digest != null && digest.startsWith(DIGEST_PREFIX) ?
                    IntegrityCheck.ofSha256(digest.substring(DIGEST_PREFIX.length()), asset.size()) :
                    IntegrityCheck.ofSize(asset.size());
                return Optional.of(
                    new RuntimeAsset(versionId, URI.create(asset.browserDownloadUrl()), asset.name(), integrity)
                );
            }
            catch (IllegalArgumentException exception)
            {
                log.warning("Skipping asset '%s' of release '%s': %s"
                    .formatted(asset.name(), release.tagName(), exception.getMessage()));
            }
        }

        log.fine(() -> "Skipping release '%s' without a .tar.gz asset.".formatted(release.tagName()));
        return Optional.empty();
    }

    private record ReleaseResponse(
        @JsonProperty("tag_name") @Nullable String tagName,
        boolean draft,
        @Nullable List<AssetResponse> assets
    )
    {
    }

    private record AssetResponse(
        @Nullable String name,
        @JsonProperty("browser_download_url") @Nullable String browserDownloadUrl,
        long size,
        @Nullable String digest
    )
    {
    }
}
