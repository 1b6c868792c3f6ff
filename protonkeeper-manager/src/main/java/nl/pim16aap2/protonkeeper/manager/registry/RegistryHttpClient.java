package nl.pim16aap2.protonkeeper.manager.registry;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import nl.pim16aap2.protonkeeper.manager.config.RuntimeManagerConfig;
import nl.pim16aap2.protonkeeper.runtime.CancelToken;
import nl.pim16aap2.protonkeeper.runtime.FailureReason;
import nl.pim16aap2.protonkeeper.runtime.RuntimeInstallException;
import org.jspecify.annotations.Nullable;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;

/**
 * Reads JSON documents for registry providers from HTTP(S) or {@code file:} locations.
 */
final class RegistryHttpClient
{
    private static final Duration REQUEST_TIMEOUT = Duration.ofSeconds(30);

    private final HttpClient httpClient;
    private final ObjectMapper objectMapper;
    private final String userAgent;

    RegistryHttpClient(RuntimeManagerConfig config)
    {
        this(
            HttpClient.newBuilder()
                .followRedirects(HttpClient.Redirect.NORMAL)
                .connectTimeout(config.connectTimeout())
                .build(),
            config.userAgent()
        );
    }

    RegistryHttpClient(HttpClient httpClient, String userAgent)
    {
        this.httpClient = Objects.requireNonNull(httpClient, "httpClient may not be null.");
        this.userAgent = Objects.requireNonNull(userAgent, "userAgent may not be null.");
        this.objectMapper = new ObjectMapper()
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    }

    ObjectMapper objectMapper()
    {
        return objectMapper;
    }

    /**
     * Reads a JSON document.
     * <p>
     * HTTP requests are sent asynchronously so a cancelled token releases the caller right away, without waiting for
     * the registry to answer or the request to time out.
     */
    JsonNode fetchJson(URI uri, String accept, CancelToken cancelToken)
        throws RuntimeInstallException
    {
        throwIfCancelled(uri, cancelToken, null);
        if ("file".equalsIgnoreCase(uri.getScheme()))
            return readFile(Path.of(uri));

        final HttpRequest request = HttpRequest.newBuilder(uri)
            .header("User-Agent", userAgent)
            .header("Accept", accept)
            .timeout(REQUEST_TIMEOUT)
            .GET()
            .build();

        final CompletableFuture<HttpResponse<String>> pending =
            httpClient.sendAsync(request, HttpResponse.BodyHandlers.ofString());
        final Runnable unregister = cancelToken.onCancel(() -> pending.cancel(true));
        final HttpResponse<String> response;
        try
        {
            response = pending.get();
        }
        catch (CancellationException exception)
        {
            throw cancelled(uri, exception);
        }
        catch (InterruptedException exception)
        {
            Thread.currentThread().interrupt();
            pending.cancel(true);
            throw cancelled(uri, exception);
        }
        catch (ExecutionException exception)
        {
            throwIfCancelled(uri, cancelToken, exception);
            throw new RuntimeInstallException(
                FailureReason.NETWORK_ERROR,
                "Failed to query runtime registry at '%s'.".formatted(uri),
                exception.getCause() == null ? exception : exception.getCause()
            );
        }
        finally
        {
            unregister.run();
        }

        if (response.statusCode() < 200 || response.statusCode() >= 300)
            throw new RuntimeInstallException(
                FailureReason.NETWORK_ERROR,
                "Runtime registry request to '%s' failed with status %d.".formatted(uri, response.statusCode())
            );

        try
        {
            return objectMapper.readTree(response.body());
        }
        catch (JsonProcessingException exception)
        {
            throw new RuntimeInstallException(
                FailureReason.NETWORK_ERROR,
                "Failed to parse runtime registry response from '%s'.".formatted(uri),
                exception
            );
        }
    }

    private static void throwIfCancelled(URI uri, CancelToken cancelToken, @Nullable Exception cause)
        throws RuntimeInstallException
    {
        if (cancelToken.isCancelled())
            throw cancelled(uri, cause);
    }

    private static RuntimeInstallException cancelled(URI uri, @Nullable Exception cause)
    {
        return new RuntimeInstallException(
            FailureReason.CANCELLED,
            "Query of runtime registry at '%s' was cancelled.".formatted(uri),
            cause
        );
    }

    private JsonNode readFile(Path file)
        throws RuntimeInstallException
    {
        try
        {
            return objectMapper.readTree(Files.readString(file));
        }
        catch (IOException exception)
        {
            throw new RuntimeInstallException(
                FailureReason.NETWORK_ERROR,
                "Failed to read runtime registry file '%s'.".formatted(file),
                exception
            );
        }
    }
}
