/**
 * Remote listings of downloadable runtime versions.
 * <p>
 * Providers are registered by name in {@link nl.pim16aap2.protonkeeper.manager.registry.RegistryProviders}.
 */
@NullMarked
package nl.pim16aap2.protonkeeper.manager.registry;

import org.jspecify.annotations.NullMarked;
