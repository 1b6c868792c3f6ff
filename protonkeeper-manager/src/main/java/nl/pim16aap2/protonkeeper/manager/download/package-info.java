/**
 * Coalesces concurrent install requests so every version is downloaded at most once at a time.
 */
@NullMarked
package nl.pim16aap2.protonkeeper.manager.download;

import org.jspecify.annotations.NullMarked;
