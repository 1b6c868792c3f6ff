/**
 * Resolves, downloads and caches compatibility runtimes.
 * <p>
 * {@link RuntimeManager} is the entry point. Create one through {@link RuntimeManager#create} or
 * {@link RuntimeManagerComponent}.
 */
@NullMarked
package nl.pim16aap2.protonkeeper.manager;

import org.jspecify.annotations.NullMarked;
