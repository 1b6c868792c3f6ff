package nl.pim16aap2.protonkeeper.manager.registry;

import nl.pim16aap2.protonkeeper.manager.config.RuntimeManagerConfig;
import org.jspecify.annotations.Nullable;

import java.net.URI;
import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.function.Function;

/**
 * Maps registry provider names to the factories that create them.
 * <p>
 * The built-in providers are {@value #GITHUB} and {@value #MANIFEST}. Additional providers can be registered before
 * {@link #create(RuntimeManagerConfig)} is called.
 */
public final class RegistryProviders
{
    public static final String GITHUB = "github";
    public static final String MANIFEST = "manifest";

    private final Map<String, Function<RuntimeManagerConfig, RuntimeRegistry>> factories = new LinkedHashMap<>();

    private RegistryProviders()
    {
    }

    /**
     * @return A new instance with the built-in providers registered.
     */
    public static RegistryProviders defaults()
    {
        return new RegistryProviders()
            .register(GITHUB, config -> new GitHubReleasesRegistry(
                new RegistryHttpClient(config),
                config.registryUri()
            ))
            .register(MANIFEST, config -> new ManifestRuntimeRegistry(
                new RegistryHttpClient(config),
                requireRegistryUri(config)
            ));
    }

    /**
     * Registers a provider, replacing any provider with the same name.
     *
     * @param name
     *     The case-insensitive provider name.
     * @param factory
     *     Creates the registry from the configuration.
     * @return This instance.
     */
    public RegistryProviders register(String name, Function<RuntimeManagerConfig, RuntimeRegistry> factory)
    {
        Objects.requireNonNull(factory, "factory may not be null.");
        factories.put(normalize(name), factory);
        return this;
    }

    /**
     * Creates the registry selected by {@link RuntimeManagerConfig#registryProvider()}.
     * <p>
     * The registry listing is cached for {@link RuntimeManagerConfig#registryCacheTtl()} unless that duration is zero.
     *
     * @param config
     *     The configuration.
     * @return The registry.
     *
     * @throws IllegalArgumentException
     *     If no provider with the configured name is registered.
     */
    public RuntimeRegistry create(RuntimeManagerConfig config)
    {
        final String name = normalize(config.registryProvider());
        final @Nullable Function<RuntimeManagerConfig, RuntimeRegistry> factory = factories.get(name);
        if (factory == null)
            throw new IllegalArgumentException(
                "Unknown registry provider '%s'. Known providers: %s.".formatted(name, factories.keySet()));

        final RuntimeRegistry registry = factory.apply(config);
        if (config.registryCacheTtl().isZero() || config.registryCacheTtl().isNegative())
            return registry;
        return new CachingRuntimeRegistry(registry, config.registryCacheTtl(), Clock.systemUTC());
    }

    private static URI requireRegistryUri(RuntimeManagerConfig config)
    {
        final URI uri = config.registryUri();
        if (uri == null)
            throw new IllegalArgumentException(
                "The '%s' registry provider requires '%sregistryUri' to be set."
                    .formatted(MANIFEST, RuntimeManagerConfig.PROPERTY_PREFIX));
        return uri;
    }

    private static String normalize(String name)
    {
        Objects.requireNonNull(name, "name may not be null.");
        if (name.isBlank())
            throw new IllegalArgumentException("Provider name may not be blank.");
        return name.trim().toLowerCase(Locale.ROOT);
    }
}
