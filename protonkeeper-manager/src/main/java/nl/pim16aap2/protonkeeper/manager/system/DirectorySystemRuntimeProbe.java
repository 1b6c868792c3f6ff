package nl.pim16aap2.protonkeeper.manager.system;

import lombok.extern.java.Log;
import nl.pim16aap2.protonkeeper.manager.config.RuntimeManagerConfig;

import javax.inject.Inject;
import java.io.IOException;
import java.math.BigInteger;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.logging.Level;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Stream;

/**
 * Looks for an unmanaged runtime in a list of candidate directories.
 * <p>
 * A candidate is used directly when it is a runtime directory itself. Otherwise it is treated as a tools directory
 * (such as Steam's {@code compatibilitytools.d}) and its runtime subdirectory with the highest version-like name is
 * used, so {@code GE-Proton10-1} wins over {@code GE-Proton9-27}. The first candidate that yields a runtime wins.
 */
@Log
public final class DirectorySystemRuntimeProbe implements SystemRuntimeProbe
{
    private static final Pattern CHUNK = Pattern.compile("\\d+|\\D+");
    private static final List<String> MARKER_FILES = List.of("proton", "compatibilitytool.vdf");

    private final List<Path> candidates;

    @Inject
    public DirectorySystemRuntimeProbe(RuntimeManagerConfig config)
    {
        this(config.systemRuntimeCandidates());
    }

    public DirectorySystemRuntimeProbe(List<Path> candidates)
    {
        this.candidates = List.copyOf(Objects.requireNonNull(candidates, "candidates may not be null."));
    }

    @Override
    public Optional<Path> find()
    {
        for (final Path candidate : candidates)
        {
            final Optional<Path> runtime = probe(candidate);
            if (runtime.isPresent())
            {
                log.fine(() -> "Found system runtime at '%s'.".formatted(runtime.get()));
                return runtime;
            }
        }
        return Optional.empty();
    }

    private static Optional<Path> probe(Path candidate)
    {
        if (!Files.isDirectory(candidate))
            return Optional.empty();
        if (isRuntimeDirectory(candidate))
            return Optional.of(candidate);

        try (Stream<Path> children = Files.list(candidate))
        {
            return children
                .filter(Files::isDirectory)
                .filter(DirectorySystemRuntimeProbe::isRuntimeDirectory)
                .max(Comparator.comparing(
                    (Path path) -> path.getFileName().toString(),
                    DirectorySystemRuntimeProbe::compareNames
                ));
        }
        catch (IOException exception)
        {
            log.log(Level.FINE, "Failed to list runtime candidates in '%s'.".formatted(candidate), exception);
            return Optional.empty();
        }
    }

    /**
     * Compares names chunk by chunk, comparing runs of digits numerically.
     */
    static int compareNames(String first, String second)
    {
        final Matcher firstMatcher = CHUNK.matcher(first);
        final Matcher secondMatcher = CHUNK.matcher(second);
        while (firstMatcher.find())
        {
            if (!secondMatcher.find())
                return 1;

            final String firstChunk = firstMatcher.group();
            final String secondChunk = secondMatcher.group();
            final boolean firstNumeric = Character.isDigit(firstChunk.charAt(0));
            final boolean secondNumeric = Character.isDigit(secondChunk.charAt(0));
            final int result = firstNumeric && secondNumeric ?
                new BigInteger(firstChunk).compareTo(new BigInteger(secondChunk)) :
                firstChunk.compareTo(secondChunk);
            if (result != 0)
                return result;
        }
        return secondMatcher.find() ? -1 : 0;
    }

    static boolean isRuntimeDirectory(Path directory)
    {
        for (final String marker : MARKER_FILES)
        {
            if (Files.isRegularFile(directory.resolve(marker)))
                return true;
        }
        return false;
    }
}
