package nl.pim16aap2.protonkeeper.runtime;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.jspecify.annotations.Nullable;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.List;
import java.util.Locale;

/**
 * Reads and writes {@link InstallMetadata} records as JSON.
 */
public final class InstallMetadataCodec
{
    private static final List<String> REQUIRED_FIELDS = List.of("versionId", "state", "sha256", "installedAt");

    private final ObjectMapper objectMapper = new ObjectMapper()
        .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false)
        .enable(SerializationFeature.INDENT_OUTPUT);

    /**
     * Reads a metadata record.
     *
     * @param path
     *     The file to read.
     * @return The parsed record.
     *
     * @throws IOException
     *     If the file cannot be read, is not valid JSON or misses a required field.
     */
    public InstallMetadata read(Path path)
        throws IOException
    {
        final JsonNode root;
        try (InputStream inputStream = Files.newInputStream(path))
        {
            root = objectMapper.readTree(inputStream);
        }

        if (root == null || !root.isObject())
            throw new IOException("Install metadata '%s' is not a JSON object.".formatted(path));

        for (final String field : REQUIRED_FIELDS)
        {
            final JsonNode value = root.get(field);
            if (value == null || value.isNull() || value.asText().isBlank())
                throw new IOException("Install metadata '%s' is missing required field '%s'.".formatted(path, field));
        }

        try
        {
            return new InstallMetadata(
                root.get("versionId").asText(),
                InstallState.valueOf(root.get("state").asText().toUpperCase(Locale.ROOT)),
                root.get("sha256").asText(),
                root.path("sizeBytes").asLong(-1L),
                textOrNull(root, "sourceUri"),
                Instant.parse(root.get("installedAt").asText()),
                root.hasNonNull("lastUsedAt") ? Instant.parse(root.get("lastUsedAt").asText()) : null
            );
        }
        catch (IllegalArgumentException | DateTimeParseException exception)
        {
            throw new IOException("Install metadata '%s' contains an invalid value.".formatted(path), exception);
        }
    }

    /**
     * Writes a metadata record.
     * <p>
     * The record is first written to a sibling temporary file which then replaces the target, so readers never see
     * a partially written record.
     *
     * @param metadata
     *     The record to write.
     * @param path
     *     The target file.
     * @throws IOException
     *     If the record could not be written.
     */
    public void write(InstallMetadata metadata, Path path)
        throws IOException
    {
        final Path parent = path.getParent();
        if (parent != null)
            Files.createDirectories(parent);

        final ObjectNode root = objectMapper.createObjectNode()
            .put("versionId", metadata.versionId())
            .put("state", metadata.state().name())
            .put("sha256", metadata.sha256())
            .put("sizeBytes", metadata.sizeBytes())
            .put("sourceUri", metadata.sourceUri())
            .put("installedAt", metadata.installedAt().toString());
        if (metadata.lastUsedAt() != null)
            root.put("lastUsedAt", metadata.lastUsedAt().toString());

        final Path temporary = path.resolveSibling(path.getFileName() + ".tmp");
        try (OutputStream outputStream = Files.newOutputStream(temporary))
        {
            objectMapper.writeValue(outputStream, root);
        }
        Files.move(temporary, path, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
    }

    private static @Nullable String textOrNull(JsonNode root, String field)
    {
        final JsonNode value = root.get(field);
        return value == null || value.isNull() ? null : value.asText();
    }
}
