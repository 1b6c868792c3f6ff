package nl.pim16aap2.protonkeeper.runtime;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class InstallMetadataCodecTest
{
    private static final String SHA256 = "9b3d2892049c9ae3cba25acaeeee01826f36da04369416ea94ea026ae1a58e2b";

    @Test
    void read_shouldThrowExceptionWhenSha256IsMissing(@TempDir Path tempDirectory)
        throws IOException
    {
        // setup
        final Path metadataPath = tempDirectory.resolve("ge-8.26.json");
        Files.writeString(metadataPath, """
            {
              "versionId": "ge-8.26",
              "state": "INSTALLED",
              "sizeBytes": 11,
              "installedAt": "2026-01-02T03:04:05Z"
            }
            """
        );

        // execute
        final InstallMetadataCodec codec = new InstallMetadataCodec();

        // verify
        assertThatThrownBy(() -> codec.read(metadataPath))
            .isInstanceOf(IOException.class)
            .hasMessageContaining("sha256");
    }

    @Test
    void read_shouldParseMetadataWhenAllRequiredFieldsExist(@TempDir Path tempDirectory)
        throws IOException
    {
        // setup
        final Path metadataPath = tempDirectory.resolve("ge-8.26.json");
        Files.writeString(metadataPath, """
            {
              "versionId": "ge-8.26",
              "state": "installed",
              "sha256": "%s",
              "sizeBytes": 11,
              "sourceUri": "https://example.invalid/ge-8.26.tar.gz",
              "installedAt": "2026-01-02T03:04:05Z",
              "unknownField": true
            }
            """.formatted(SHA256)
        );

        // execute
        final InstallMetadata metadata = new InstallMetadataCodec().read(metadataPath);

        // verify
        assertThat(metadata.versionId()).isEqualTo("ge-8.26");
        assertThat(metadata.state()).isEqualTo(InstallState.INSTALLED);
        assertThat(metadata.sizeBytes()).isEqualTo(11L);
        assertThat(metadata.lastUsedAt()).isNull();
        assertThat(metadata.effectiveLastUsedAt()).isEqualTo(Instant.parse("2026-01-02T03:04:05Z"));
    }

    @Test
    void read_shouldThrowExceptionWhenStateIsUnknown(@TempDir Path tempDirectory)
        throws IOException
    {
        // setup
        final Path metadataPath = tempDirectory.resolve("ge-8.26.json");
        Files.writeString(metadataPath, """
            {
              "versionId": "ge-8.26",
              "state": "HALF_DONE",
              "sha256": "%s",
              "installedAt": "2026-01-02T03:04:05Z"
            }
            """.formatted(SHA256)
        );

        // execute & verify
        assertThatThrownBy(() -> new InstallMetadataCodec().read(metadataPath))
            .isInstanceOf(IOException.class)
            .hasMessageContaining("invalid value");
    }

    @Test
    void write_shouldReplaceExistingRecordWithoutLeavingTemporaryFile(@TempDir Path tempDirectory)
        throws IOException
    {
        // setup
        final Path metadataPath = tempDirectory.resolve("metadata/ge-8.26.json");
        final InstallMetadataCodec codec = new InstallMetadataCodec();
        final Instant installedAt = Instant.parse("2026-01-02T03:04:05Z");
        final InstallMetadata original =
            new InstallMetadata("ge-8.26", InstallState.INSTALLED, SHA256, 11L, null, installedAt, null);
        codec.write(original, metadataPath);

        // execute
        codec.write(original.withLastUsedAt(installedAt.plusSeconds(60)), metadataPath);

        // verify
        assertThat(codec.read(metadataPath).lastUsedAt()).isEqualTo(installedAt.plusSeconds(60));
        assertThat(tempDirectory.resolve("metadata/ge-8.26.json.tmp")).doesNotExist();
    }
}
