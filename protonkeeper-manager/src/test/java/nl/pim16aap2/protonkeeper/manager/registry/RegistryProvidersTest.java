package nl.pim16aap2.protonkeeper.manager.registry;

import nl.pim16aap2.protonkeeper.manager.TestAssets;
import nl.pim16aap2.protonkeeper.manager.config.RuntimeManagerConfig;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.net.URI;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatIllegalArgumentException;

class RegistryProvidersTest
{
    @TempDir
    private Path cacheRoot;

    @Test
    void create_shouldCreateGitHubRegistryByDefault()
    {
        // execute
        final RuntimeRegistry registry = RegistryProviders.defaults().create(TestAssets.config(cacheRoot));

        // verify
        assertThat(registry).isInstanceOf(GitHubReleasesRegistry.class);
    }

    @Test
    void create_shouldWrapRegistryInCacheWhenTimeToLiveIsPositive()
    {
        // setup
        final RuntimeManagerConfig config = withProvider("GitHub", null, Duration.ofMinutes(10));

        // execute
        final RuntimeRegistry registry = RegistryProviders.defaults().create(config);

        // verify
        assertThat(registry).isInstanceOf(CachingRuntimeRegistry.class);
    }

    @Test
    void create_shouldRequireUriForManifestProvider()
    {
        // setup
        final RuntimeManagerConfig config = withProvider(RegistryProviders.MANIFEST, null, Duration.ZERO);

        // execute & verify
        assertThatIllegalArgumentException()
            .isThrownBy(() -> RegistryProviders.defaults().create(config))
            .withMessageContaining("registryUri");
    }

    @Test
    void create_shouldCreateManifestRegistry()
    {
        // setup
        final RuntimeManagerConfig config = withProvider(
            RegistryProviders.MANIFEST, URI.create("https://example.org/runtimes.json"), Duration.ZERO);

        // execute & verify
        assertThat(RegistryProviders.defaults().create(config)).isInstanceOf(ManifestRuntimeRegistry.class);
    }

    @Test
    void create_shouldRejectUnknownProvider()
    {
        // setup
        final RuntimeManagerConfig config = withProvider("ftp", null, Duration.ZERO);

        // execute & verify
        assertThatIllegalArgumentException()
            .isThrownBy(() -> RegistryProviders.defaults().create(config))
            .withMessageContaining("Unknown registry provider 'ftp'");
    }

    @Test
    void register_shouldAddCustomProvider()
    {
        // setup
        final RuntimeRegistry custom = cancelToken -> List.of();
        final RegistryProviders providers = RegistryProviders.defaults().register("Custom", config -> custom);

        // execute & verify
        assertThat(providers.create(withProvider("custom", null, Duration.ZERO))).isSameAs(custom);
    }

    private RuntimeManagerConfig withProvider(String provider, URI registryUri, Duration registryCacheTtl)
    {
        final RuntimeManagerConfig base = TestAssets.config(cacheRoot);
        return new RuntimeManagerConfig(
            base.cacheRoot(),
            provider,
            registryUri,
            base.maxAttempts(),
            base.backoffBase(),
            base.backoffMax(),
            base.connectTimeout(),
            base.attemptTimeout(),
            base.userAgent(),
            base.downloadThreads(),
            base.systemRuntimeCandidates(),
            registryCacheTtl
        );
    }
}
