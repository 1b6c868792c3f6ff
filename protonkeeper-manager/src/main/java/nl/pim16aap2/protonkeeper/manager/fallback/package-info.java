@NullMarked
package nl.pim16aap2.protonkeeper.manager.fallback;

import org.jspecify.annotations.NullMarked;
