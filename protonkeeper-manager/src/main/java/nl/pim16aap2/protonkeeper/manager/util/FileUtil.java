package nl.pim16aap2.protonkeeper.manager.util;

import org.apache.commons.io.file.PathUtils;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.LinkOption;
import java.nio.file.Path;
import java.util.regex.Pattern;

public final class FileUtil
{
    private static final Pattern SAFE_NAME = Pattern.compile("[A-Za-z0-9][A-Za-z0-9._+-]*");

    private FileUtil()
    {
    }

    /**
     * Creates a directory if it does not already exist.
     *
     * @param path
     *     the directory to create.
     * @param name
     *     the name of the directory. This is used for logging purposes only.
     * @throws IOException
     *     If the path exists but is not a directory, or if the directory could not be created.
     */
    public static void createDirectories(Path path, String name)
        throws IOException
    {
        if (Files.exists(path) && !Files.isDirectory(path))
            throw new IOException("The path '" + path + "' exists but is not a directory.");

        try
        {
            Files.createDirectories(path);
        }
        catch (IOException exception)
        {
            throw new IOException("Failed to create directory '" + name + "' at path '" + path + "'.", exception);
        }
    }

    /**
     * Deletes a file or directory tree. Symbolic links are deleted, never followed.
     * <p>
     * Nothing happens if the path does not exist.
     *
     * @param path
     *     the path to delete.
     * @param context
     *     a description of the path. This is used for error messages only.
     * @throws IOException
     *     If the path could not be deleted.
     */
    public static void deleteRecursively(Path path, String context)
        throws IOException
    {
        if (Files.notExists(path, LinkOption.NOFOLLOW_LINKS))
            return;

        try
        {
            if (Files.isDirectory(path, LinkOption.NOFOLLOW_LINKS))
                PathUtils.deleteDirectory(path);
            else
                Files.delete(path);
        }
        catch (IOException exception)
        {
            throw new IOException("Failed to delete %s at '%s'.".formatted(context, path), exception);
        }
    }

    /**
     * Checks that a name can be used as a single directory or file name on every supported platform.
     *
     * @param name
     *     the name to check.
     * @param context
     *     a description of the name. This is used for error messages only.
     * @return the name.
     *
     * @throws IllegalArgumentException
     *     If the name is blank, contains path separators or is a relative path element.
     */
    public static String requireSafeName(String name, String context)
    {
        if (!SAFE_NAME.matcher(name).matches() || name.contains(".."))
            throw new IllegalArgumentException("Invalid %s: '%s'.".formatted(context, name));
        return name;
    }

    /**
     * Resolves a child path and ensures it does not escape its root.
     *
     * @param root
     *     the root directory.
     * @param childName
     *     the (relative) path of the child.
     * @param context
     *     a description of the child. This is used for error messages only.
     * @return the normalized child path.
     *
     * @throws IOException
     *     If the resolved path escapes the root.
     */
    public static Path resolveInside(Path root, String childName, String context)
        throws IOException
    {
        final Path normalizedRoot = root.toAbsolutePath().normalize();
        final Path child = normalizedRoot.resolve(childName).normalize();
        if (!child.startsWith(normalizedRoot) || child.equals(normalizedRoot))
            throw new IOException("Resolved %s path '%s' escapes root '%s'.".formatted(context, child, normalizedRoot));
        return child;
    }
}
