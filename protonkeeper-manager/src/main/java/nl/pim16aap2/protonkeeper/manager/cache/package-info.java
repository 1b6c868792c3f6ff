/**
 * The on-disk registry of installed runtime versions.
 * <p>
 * Layout of the cache root:
 * <ul>
 *     <li>{@code versions/<id>/}: the installed payload of a version.</li>
 *     <li>{@code metadata/<id>.json}: the {@link nl.pim16aap2.protonkeeper.runtime.InstallMetadata} of a version.</li>
 *     <li>{@code staging/<id>/}: a download in progress.</li>
 *     <li>{@code current}: the id of the current version.</li>
 * </ul>
 */
@NullMarked
package nl.pim16aap2.protonkeeper.manager.cache;

import org.jspecify.annotations.NullMarked;
