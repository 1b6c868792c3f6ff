package nl.pim16aap2.protonkeeper.manager.cache;

import nl.pim16aap2.protonkeeper.manager.util.FileUtil;
import nl.pim16aap2.protonkeeper.runtime.FailureReason;
import nl.pim16aap2.protonkeeper.runtime.RuntimeInstallException;
import org.apache.commons.compress.archivers.tar.TarArchiveEntry;
import org.apache.commons.compress.archivers.tar.TarArchiveInputStream;
import org.apache.commons.compress.compressors.gzip.GzipCompressorInputStream;

import java.io.BufferedInputStream;
import java.io.EOFException;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.FileSystemException;
import java.nio.file.Files;
import java.nio.file.LinkOption;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.attribute.PosixFileAttributeView;
import java.nio.file.attribute.PosixFilePermission;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.zip.ZipEntry;
import java.util.zip.ZipException;
import java.util.zip.ZipInputStream;

/**
 * Unpacks downloaded runtime assets into a staging directory.
 * <p>
 * {@code .tar.gz} and {@code .tgz} assets are unpacked with Commons Compress and {@code .zip} assets with
 * {@link ZipInputStream}. Any other asset is treated as a single-file payload.
 */
final class ArchiveUnpacker
{
    private static final int OWNER_EXECUTE = 0100;

    private ArchiveUnpacker()
    {
    }

    /**
     * Unpacks an asset.
     *
     * @param asset
     *     The downloaded asset.
     * @param fileName
     *     The original file name of the asset.
     * @param targetDirectory
     *     The empty directory to unpack into.
     * @return The root of the payload. When the archive holds exactly one top-level directory, that directory is the
     * root. Otherwise, the root is {@code targetDirectory} itself.
     *
     * @throws RuntimeInstallException
     *     With {@link FailureReason#INTEGRITY_ERROR} if the archive is malformed or contains entries escaping the
     *     target directory, or {@link FailureReason#DISK_ERROR} if the payload could not be written.
     */
    static Path unpack(Path asset, String fileName, Path targetDirectory)
        throws RuntimeInstallException
    {
        final String normalizedName = fileName.toLowerCase(Locale.ROOT);
        try
        {
            FileUtil.createDirectories(targetDirectory, "unpack directory");
            if (normalizedName.endsWith(".tar.gz") || normalizedName.endsWith(".tgz"))
                unpackTarGz(asset, targetDirectory);
            else if (normalizedName.endsWith(".zip"))
                unpackZip(asset, targetDirectory);
            else
                Files.move(asset, FileUtil.resolveInside(targetDirectory, fileName, "asset file"));
            return resolvePayloadRoot(targetDirectory);
        }
        catch (MalformedArchiveException | ZipException | EOFException exception)
        {
            throw new RuntimeInstallException(
                FailureReason.INTEGRITY_ERROR,
                "Asset '%s' is not a valid archive: %s".formatted(fileName, exception.getMessage()),
                exception
            );
        }
        catch (IOException exception)
        {
            throw new RuntimeInstallException(
                exception instanceof FileSystemException ? FailureReason.DISK_ERROR : FailureReason.INTEGRITY_ERROR,
                "Failed to unpack asset '%s' into '%s'.".formatted(fileName, targetDirectory),
                exception
            );
        }
    }

    private static void unpackTarGz(Path archive, Path targetDirectory)
        throws IOException
    {
        try (
            InputStream inputStream = new BufferedInputStream(Files.newInputStream(archive));
            GzipCompressorInputStream gzipInputStream = new GzipCompressorInputStream(inputStream);
            TarArchiveInputStream tarInputStream = new TarArchiveInputStream(gzipInputStream))
        {
            TarArchiveEntry entry;
            while ((entry = tarInputStream.getNextEntry()) != null)
            {
                final String entryName = entry.getName();
                if (entryName == null || entryName.isBlank() || entryName.equals("./"))
                    continue;

                final Path entryPath = resolveEntry(targetDirectory, entryName);
                if (entry.isDirectory())
                {
                    Files.createDirectories(entryPath);
                }
                else if (entry.isSymbolicLink())
                {
                    createParent(entryPath);
                    createSymbolicLink(targetDirectory, entryPath, entry.getLinkName());
                }
                else if (entry.isLink())
                {
                    createParent(entryPath);
                    Files.createLink(entryPath, resolveEntry(targetDirectory, entry.getLinkName()));
                }
                else if (entry.isFile())
                {
                    createParent(entryPath);
                    Files.copy(tarInputStream, entryPath, StandardCopyOption.REPLACE_EXISTING);
                    if ((entry.getMode() & OWNER_EXECUTE) != 0)
                        markExecutable(entryPath);
                }
            }
        }
    }

    private static void unpackZip(Path archive, Path targetDirectory)
        throws IOException
    {
        try (ZipInputStream zipInputStream = new ZipInputStream(new BufferedInputStream(Files.newInputStream(archive))))
        {
            ZipEntry entry;
            while ((entry = zipInputStream.getNextEntry()) != null)
            {
                final String entryName = entry.getName();
                if (entryName == null || entryName.isBlank())
                    continue;

                final Path entryPath = resolveEntry(targetDirectory, entryName);
                if (entry.isDirectory())
                {
                    Files.createDirectories(entryPath);
                }
                else
                {
                    createParent(entryPath);
                    Files.copy(zipInputStream, entryPath, StandardCopyOption.REPLACE_EXISTING);
                }
                zipInputStream.closeEntry();
            }
        }
    }

    private static Path resolvePayloadRoot(Path targetDirectory)
        throws IOException
    {
        final List<Path> topLevelEntries;
        try (var stream = Files.list(targetDirectory))
        {
            topLevelEntries = stream.toList();
        }

        if (topLevelEntries.isEmpty())
            throw new MalformedArchiveException("The archive is empty.");

        final Path onlyEntry = topLevelEntries.get(0);
        if (topLevelEntries.size() == 1 && Files.isDirectory(onlyEntry, LinkOption.NOFOLLOW_LINKS))
            return onlyEntry;
        return targetDirectory;
    }

    private static Path resolveEntry(Path targetDirectory, String entryName)
        throws IOException
    {
        final Path root = targetDirectory.toAbsolutePath().normalize();
        final Path entryPath = root.resolve(entryName).normalize();
        if (!entryPath.startsWith(root))
            throw new MalformedArchiveException(
                "Archive entry '%s' escapes root '%s'.".formatted(entryName, root));
        return entryPath;
    }

    private static void createSymbolicLink(Path targetDirectory, Path linkPath, String linkTarget)
        throws IOException
    {
        final Path target = linkPath.getFileSystem().getPath(linkTarget);
        if (target.isAbsolute())
            throw new MalformedArchiveException(
                "Archive link '%s' has absolute target '%s'.".formatted(linkPath, linkTarget));

        final Path root = targetDirectory.toAbsolutePath().normalize();
        final Path resolvedTarget = linkPath.toAbsolutePath().getParent().resolve(target).normalize();
        if (!resolvedTarget.startsWith(root))
            throw new MalformedArchiveException("Archive link '%s' points outside of the archive.".formatted(linkPath));

        Files.deleteIfExists(linkPath);
        Files.createSymbolicLink(linkPath, target);
    }

    private static void createParent(Path path)
        throws IOException
    {
        final Path parent = path.getParent();
        if (parent != null)
            Files.createDirectories(parent);
    }

    private static void markExecutable(Path path)
        throws IOException
    {
        final PosixFileAttributeView view = Files.getFileAttributeView(path, PosixFileAttributeView.class);
        if (view == null)
            return;
        final Set<PosixFilePermission> permissions = new HashSet<>(view.readAttributes().permissions());
        permissions.add(PosixFilePermission.OWNER_EXECUTE);
        permissions.add(PosixFilePermission.GROUP_EXECUTE);
        permissions.add(PosixFilePermission.OTHERS_EXECUTE);
        view.setPermissions(permissions);
    }

    /**
     * Thrown when an archive is structurally invalid.
     */
    private static final class MalformedArchiveException extends IOException
    {
        private static final long serialVersionUID = 1L;

        MalformedArchiveException(String message)
        {
            super(message);
        }
    }
}
