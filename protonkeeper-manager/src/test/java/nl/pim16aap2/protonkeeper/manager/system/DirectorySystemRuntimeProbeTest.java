package nl.pim16aap2.protonkeeper.manager.system;

import com.google.common.jimfs.Configuration;
import com.google.common.jimfs.Jimfs;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.io.IOException;
import java.nio.file.FileSystem;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class DirectorySystemRuntimeProbeTest
{
    private FileSystem fileSystem;
    private Path toolsDirectory;

    @BeforeEach
    void init()
        throws IOException
    {
        fileSystem = Jimfs.newFileSystem(Configuration.unix());
        toolsDirectory = Files.createDirectories(fileSystem.getPath("/home/user/.steam/root/compatibilitytools.d"));
    }

    @AfterEach
    void cleanup()
        throws IOException
    {
        fileSystem.close();
    }

    @Test
    void find_shouldPickHighestVersionedRuntimeInToolsDirectory()
        throws IOException
    {
        // setup
        createRuntime(toolsDirectory.resolve("GE-Proton9-27"), "proton");
        createRuntime(toolsDirectory.resolve("GE-Proton10-1"), "compatibilitytool.vdf");
        createRuntime(toolsDirectory.resolve("GE-Proton10-3"), null);
        Files.writeString(toolsDirectory.resolve("README"), "not a runtime");

        // execute & verify
        assertThat(new DirectorySystemRuntimeProbe(List.of(toolsDirectory)).find())
            .contains(toolsDirectory.resolve("GE-Proton10-1"));
    }

    @Test
    void find_shouldUseCandidateThatIsRuntimeItself()
        throws IOException
    {
        // setup
        final Path runtime = createRuntime(fileSystem.getPath("/usr/share/steam/proton"), "proton");

        // execute & verify
        assertThat(new DirectorySystemRuntimeProbe(List.of(runtime)).find()).contains(runtime);
    }

    @Test
    void find_shouldTryCandidatesInOrder()
        throws IOException
    {
        // setup
        final Path missing = fileSystem.getPath("/opt/does-not-exist");
        final Path empty = Files.createDirectories(fileSystem.getPath("/opt/empty"));
        final Path runtime = createRuntime(toolsDirectory.resolve("GE-Proton8-26"), "proton");
        final Path later = createRuntime(fileSystem.getPath("/opt/other/proton-9"), "proton");

        // execute & verify
        assertThat(new DirectorySystemRuntimeProbe(List.of(missing, empty, toolsDirectory, later)).find())
            .contains(runtime);
    }

    @Test
    void find_shouldReturnEmptyWithoutRuntime()
    {
        // execute & verify
        assertThat(new DirectorySystemRuntimeProbe(List.of(toolsDirectory)).find()).isEmpty();
        assertThat(SystemRuntimeProbe.none().find()).isEmpty();
    }

    @ParameterizedTest
    @CsvSource({
        "GE-Proton10-1, GE-Proton9-27, 1",
        "GE-Proton9-27, GE-Proton9-3, 1",
        "GE-Proton8-26, GE-Proton8-26, 0",
        "GE-Proton8, GE-Proton8-1, -1",
        "Proton-7.0, Proton-Experimental, -1",
    })
    void compareNames_shouldCompareDigitRunsNumerically(String first, String second, int expectedSign)
    {
        // execute & verify
        assertThat(Integer.signum(DirectorySystemRuntimeProbe.compareNames(first, second))).isEqualTo(expectedSign);
        assertThat(Integer.signum(DirectorySystemRuntimeProbe.compareNames(second, first))).isEqualTo(-expectedSign);
    }

    private static Path createRuntime(Path directory, String marker)
        throws IOException
    {
        Files.createDirectories(directory);
        if (marker != null)
            Files.writeString(directory.resolve(marker), "");
        return directory;
    }
}
