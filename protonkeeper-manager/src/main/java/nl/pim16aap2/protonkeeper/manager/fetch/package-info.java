/**
 * Downloads runtime assets into staging locations.
 */
@NullMarked
package nl.pim16aap2.protonkeeper.manager.fetch;

import org.jspecify.annotations.NullMarked;
