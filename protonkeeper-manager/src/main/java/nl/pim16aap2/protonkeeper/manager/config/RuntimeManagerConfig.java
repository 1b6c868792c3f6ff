package nl.pim16aap2.protonkeeper.manager.config;

import org.jspecify.annotations.Nullable;

import java.io.File;
import java.net.URI;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Properties;
import java.util.function.Function;

/**
 * Configuration of the runtime manager.
 *
 * @param cacheRoot
 *     The directory holding installed versions, staging directories and metadata.
 * @param registryProvider
 *     The name of the registry provider to use, e.g. {@code github}.
 * @param registryUri
 *     The location the registry provider reads from, or {@code null} for the provider's default.
 * @param maxAttempts
 *     The number of attempts a download gets before a transient network error becomes terminal.
 * @param backoffBase
 *     The delay before the first retry. Every following retry doubles the delay.
 * @param backoffMax
 *     The upper bound for the delay between retries.
 * @param connectTimeout
 *     The connect timeout for HTTP requests.
 * @param attemptTimeout
 *     The maximum duration of a single download attempt.
 * @param userAgent
 *     The User-Agent header sent with every request.
 * @param downloadThreads
 *     The number of downloads that may run in parallel.
 * @param systemRuntimeCandidates
 *     Directories searched for an externally installed runtime.
 * @param registryCacheTtl
 *     How long a registry listing is reused before it is fetched again.
 */
public record RuntimeManagerConfig(
    Path cacheRoot,
    String registryProvider,
    @Nullable URI registryUri,
    int maxAttempts,
    Duration backoffBase,
    Duration backoffMax,
    Duration connectTimeout,
    Duration attemptTimeout,
    String userAgent,
    int downloadThreads,
    List<Path> systemRuntimeCandidates,
    Duration registryCacheTtl
)
{
    public static final String PROPERTY_PREFIX = "protonkeeper.";
    public static final String DEFAULT_USER_AGENT = "ProtonKeeper/0.1";

    public RuntimeManagerConfig
    {
        Objects.requireNonNull(cacheRoot, "cacheRoot may not be null.");
        Objects.requireNonNull(registryProvider, "registryProvider may not be null.");
        Objects.requireNonNull(backoffBase, "backoffBase may not be null.");
        Objects.requireNonNull(backoffMax, "backoffMax may not be null.");
        Objects.requireNonNull(connectTimeout, "connectTimeout may not be null.");
        Objects.requireNonNull(attemptTimeout, "attemptTimeout may not be null.");
        Objects.requireNonNull(registryCacheTtl, "registryCacheTtl may not be null.");

        if (userAgent == null || userAgent.isBlank())
            throw new IllegalArgumentException("A non-empty User-Agent is required.");
        if (maxAttempts < 1)
            throw new IllegalArgumentException("maxAttempts must be at least 1, but was %d.".formatted(maxAttempts));
        if (downloadThreads < 1)
            throw new IllegalArgumentException(
                "downloadThreads must be at least 1, but was %d.".formatted(downloadThreads));
        if (backoffBase.isNegative() || backoffMax.compareTo(backoffBase) < 0)
            throw new IllegalArgumentException(
                "Invalid backoff: base=%s max=%s.".formatted(backoffBase, backoffMax));

        registryProvider = registryProvider.trim().toLowerCase(Locale.ROOT);
        systemRuntimeCandidates = systemRuntimeCandidates == null ? List.of() : List.copyOf(systemRuntimeCandidates);
    }

    /**
     * Creates a configuration with default values for everything except the cache root.
     *
     * @param cacheRoot
     *     The cache root to use.
     * @return The new configuration.
     */
    public static RuntimeManagerConfig defaults(Path cacheRoot)
    {
        return new RuntimeManagerConfig(
            cacheRoot,
            "github",
            null,
            3,
            Duration.ofMillis(500),
            Duration.ofSeconds(8),
            Duration.ofSeconds(15),
            Duration.ofMinutes(10),
            DEFAULT_USER_AGENT,
            2,
            defaultSystemRuntimeCandidates(Path.of(System.getProperty("user.home", "."))),
            Duration.ofMinutes(5)
        );
    }

    /**
     * Loads the configuration from the JVM system properties and the process environment.
     *
     * @return The loaded configuration.
     */
    public static RuntimeManagerConfig load()
    {
        return load(System.getProperties(), System.getenv());
    }

    /**
     * Loads the configuration.
     * <p>
     * Each key {@code protonkeeper.some.key} is looked up in the properties first. When absent, the environment
     * variable {@code PROTONKEEPER_SOME_KEY} is used. Missing values fall back to their defaults.
     *
     * @param properties
     *     The properties to read.
     * @param environment
     *     The environment variables to read.
     * @return The loaded configuration.
     *
     * @throws IllegalArgumentException
     *     If a value is present but invalid.
     */
    public static RuntimeManagerConfig load(Properties properties, Map<String, String> environment)
    {
        final Function<String, @Nullable String> lookup = key ->
        {
            final String property = properties.getProperty(PROPERTY_PREFIX + key);
            if (property != null && !property.isBlank())
                return property.trim();
            final String variable = environment.get(toEnvironmentName(key));
            return variable == null || variable.isBlank() ? null : variable.trim();
        };

        final Path userHome = Path.of(properties.getProperty("user.home", "."));
        final String cacheRoot = lookup.apply("cacheRoot");
        final RuntimeManagerConfig defaults =
            defaults(cacheRoot == null ? userHome.resolve(".cache").resolve("protonkeeper") : Path.of(cacheRoot));

        final String registryUri = lookup.apply("registryUri");
        final String candidates = lookup.apply("systemRuntimeCandidates");

        return new RuntimeManagerConfig(
            defaults.cacheRoot(),
            Objects.requireNonNullElse(lookup.apply("registry"), defaults.registryProvider()),
            registryUri == null ? null : URI.create(registryUri),
            parseInt(lookup, "fetch.maxAttempts", defaults.maxAttempts()),
            Duration.ofMillis(parseLong(lookup, "fetch.backoffBaseMillis", defaults.backoffBase().toMillis())),
            Duration.ofMillis(parseLong(lookup, "fetch.backoffMaxMillis", defaults.backoffMax().toMillis())),
            Duration.ofSeconds(
                parseLong(lookup, "fetch.connectTimeoutSeconds", defaults.connectTimeout().toSeconds())),
            Duration.ofSeconds(
                parseLong(lookup, "fetch.attemptTimeoutSeconds", defaults.attemptTimeout().toSeconds())),
            Objects.requireNonNullElse(lookup.apply("userAgent"), defaults.userAgent()),
            parseInt(lookup, "downloadThreads", defaults.downloadThreads()),
            candidates == null ? defaultSystemRuntimeCandidates(userHome) : splitPaths(candidates),
            Duration.ofSeconds(parseLong(lookup, "registryCacheSeconds", defaults.registryCacheTtl().toSeconds()))
        );
    }

    /**
     * Computes the delay before the given retry.
     *
     * @param retry
     *     The 1-based retry number.
     * @return The delay, doubling per retry and capped at {@link #backoffMax()}.
     */
    public Duration backoffFor(int retry)
    {
        if (retry < 1)
            return Duration.ZERO;
        final long multiplier = 1L << Math.min(retry - 1, 30);
        final long millis = backoffBase.toMillis() * multiplier;
        if (millis < 0 || millis > backoffMax.toMillis())
            return backoffMax;
        return Duration.ofMillis(millis);
    }

    static List<Path> defaultSystemRuntimeCandidates(Path userHome)
    {
        return List.of(
            userHome.resolve(".steam/root/compatibilitytools.d"),
            userHome.resolve(".local/share/Steam/compatibilitytools.d"),
            Path.of("/usr/share/steam/compatibilitytools.d")
        );
    }

    static String toEnvironmentName(String key)
    {
        return "PROTONKEEPER_" + key.replaceAll("([a-z])([A-Z])", "$1_$2").replace('.', '_').toUpperCase(Locale.ROOT);
    }

    private static List<Path> splitPaths(String value)
    {
        final List<Path> ret = new ArrayList<>();
        for (final String part : value.split(File.pathSeparator))
        {
            if (!part.isBlank())
                ret.add(Path.of(part.trim()));
        }
        return ret;
    }

    private static int parseInt(Function<String, @Nullable String> lookup, String key, int defaultValue)
    {
        final long value = parseLong(lookup, key, defaultValue);
        if (value > Integer.MAX_VALUE || value < Integer.MIN_VALUE)
            throw new IllegalArgumentException(
                "Value for '%s%s' is out of range: %d.".formatted(PROPERTY_PREFIX, key, value));
        return (int) value;
    }

    private static long parseLong(Function<String, @Nullable String> lookup, String key, long defaultValue)
    {
        final String value = lookup.apply(key);
        if (value == null)
            return defaultValue;
        try
        {
            return Long.parseLong(value);
        }
        catch (NumberFormatException exception)
        {
            throw new IllegalArgumentException(
                "Value for '%s%s' is not a number: '%s'.".formatted(PROPERTY_PREFIX, key, value), exception);
        }
    }
}
