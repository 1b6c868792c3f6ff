@NullMarked
package nl.pim16aap2.protonkeeper.manager.util;

import org.jspecify.annotations.NullMarked;
