/**
 * Value types shared between the runtime manager and its callers.
 * <p>
 * A runtime is a versioned binary distribution of the compatibility layer used to run a game. Everything in this
 * package is immutable or thread-safe.
 */
@NullMarked
package nl.pim16aap2.protonkeeper.runtime;

import org.jspecify.annotations.NullMarked;
