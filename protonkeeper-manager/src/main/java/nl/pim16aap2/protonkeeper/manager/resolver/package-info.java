/**
 * Turns version requirements into usable runtime installations.
 */
@NullMarked
package nl.pim16aap2.protonkeeper.manager.resolver;

import org.jspecify.annotations.NullMarked;
