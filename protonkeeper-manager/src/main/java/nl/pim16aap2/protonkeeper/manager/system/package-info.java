@NullMarked
package nl.pim16aap2.protonkeeper.manager.system;

import org.jspecify.annotations.NullMarked;
