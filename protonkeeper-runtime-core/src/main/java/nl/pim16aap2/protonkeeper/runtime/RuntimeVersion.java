package nl.pim16aap2.protonkeeper.runtime;

import org.jspecify.annotations.Nullable;

/**
 * The state of a single runtime version as known to the cache.
 *
 * @param id
 *     The version id.
 * @param integrity
 *     The integrity information it was (or is being) installed with, if known.
 * @param installState
 *     The current install state.
 */
public record RuntimeVersion(
    String id,
    @Nullable IntegrityCheck integrity,
    InstallState installState
)
{
}
