@NullMarked
package nl.pim16aap2.protonkeeper.manager.config;

import org.jspecify.annotations.NullMarked;
