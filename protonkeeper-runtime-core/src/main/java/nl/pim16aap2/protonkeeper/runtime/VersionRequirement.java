package nl.pim16aap2.protonkeeper.runtime;

import java.util.Locale;
import java.util.Objects;
import java.util.Set;

/**
 * The runtime version a game asks for.
 * <p>
 * The value is opaque: it is only ever compared for equality with registry and cache version ids. The sentinels
 * {@code system} and {@code any} (and a blank value) mean that any usable runtime is acceptable.
 *
 * @param value
 *     The trimmed requirement string as supplied by the game metadata.
 */
public record VersionRequirement(String value)
{
    private static final Set<String> ANY_SENTINELS = Set.of("", "any", "system");

    public VersionRequirement
    {
        value = Objects.requireNonNull(value, "value may not be null.").trim();
    }

    public static VersionRequirement of(String value)
    {
        return new VersionRequirement(value);
    }

    /**
     * @return {@code true} if this requirement accepts any available runtime instead of a specific version.
     */
    public boolean isAny()
    {
        return ANY_SENTINELS.contains(value.toLowerCase(Locale.ROOT));
    }

    /**
     * @return The version id this requirement asks for.
     *
     * @throws IllegalStateException
     *     If this requirement is one of the "any" sentinels.
     */
    public String versionId()
    {
        if (isAny())
            throw new IllegalStateException("Requirement '%s' does not name a specific version.".formatted(value));
        return value;
    }

    @Override
    public String toString()
    {
        return value;
    }
}
