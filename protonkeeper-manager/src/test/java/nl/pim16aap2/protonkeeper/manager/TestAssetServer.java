package nl.pim16aap2.protonkeeper.manager;

import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetAddress;
import java.net.InetSocketAddress;
import java.net.URI;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * A loopback HTTP server that serves fixed payloads and counts requests.
 */
public final class TestAssetServer implements AutoCloseable
{
    private final HttpServer server;
    private final ExecutorService executor = Executors.newCachedThreadPool();
    private final Map<String, Route> routes = new ConcurrentHashMap<>();

    private TestAssetServer(HttpServer server)
    {
        this.server = server;
        server.setExecutor(executor);
        server.createContext("/", this::handle);
        server.start();
    }

    public static TestAssetServer start()
        throws IOException
    {
        return new TestAssetServer(HttpServer.create(new InetSocketAddress(InetAddress.getLoopbackAddress(), 0), 0));
    }

    public URI uri(String path)
    {
        return URI.create("http://%s:%d%s".formatted(
            server.getAddress().getHostString(), server.getAddress().getPort(), path));
    }

    /**
     * Serves a payload at the given path.
     */
    public Route serve(String path, byte[] body)
    {
        final Route route = new Route(body);
        routes.put(path, route);
        return route;
    }

    private void handle(HttpExchange exchange)
        throws IOException
    {
        try
        {
            final Route route = routes.get(exchange.getRequestURI().getPath());
            if (route == null)
            {
                exchange.sendResponseHeaders(404, -1);
                return;
            }
            route.respond(exchange);
        }
        finally
        {
            exchange.close();
        }
    }

    @Override
    public void close()
    {
        routes.values().forEach(Route::release);
        server.stop(0);
        executor.shutdownNow();
    }

    /**
     * A served payload.
     */
    public static final class Route
    {
        private final byte[] body;
        private final AtomicInteger requests = new AtomicInteger();
        private final AtomicInteger remainingFailures = new AtomicInteger();
        private final CountDownLatch halfwayReached = new CountDownLatch(1);
        private final CountDownLatch gate = new CountDownLatch(1);
        private volatile int failureStatus = 503;
        private volatile boolean pauseFirstResponse;

        private Route(byte[] body)
        {
            this.body = body;
        }

        /**
         * Answers the next {@code count} requests with the given status code.
         */
        public Route failFirst(int count, int statusCode)
        {
            remainingFailures.set(count);
            failureStatus = statusCode;
            return this;
        }

        /**
         * Makes the first successful response stop after sending half of the payload until {@link #release()} is
         * called.
         */
        public Route pauseFirstResponseHalfway()
        {
            pauseFirstResponse = true;
            return this;
        }

        public boolean awaitHalfway()
            throws InterruptedException
        {
            return halfwayReached.await(10, TimeUnit.SECONDS);
        }

        public void release()
        {
            gate.countDown();
        }

        public int requestCount()
        {
            return requests.get();
        }

        private void respond(HttpExchange exchange)
            throws IOException
        {
            requests.incrementAndGet();
            if (remainingFailures.getAndUpdate(value -> Math.max(0, value - 1)) > 0)
            {
                exchange.sendResponseHeaders(failureStatus, -1);
                return;
            }

            exchange.getResponseHeaders().add("Content-Type", "application/octet-stream");
            exchange.sendResponseHeaders(200, body.length);
            try (OutputStream output = exchange.getResponseBody())
            {
                if (!pauseFirstResponse || halfwayReached.getCount() == 0)
                {
                    output.write(body);
                    return;
                }

                final int half = body.length / 2;
                output.write(body, 0, half);
                output.flush();
                halfwayReached.countDown();
                try
                {
                    if (!gate.await(10, TimeUnit.SECONDS))
                        return;
                }
                catch (InterruptedException exception)
                {
                    Thread.currentThread().interrupt();
                    return;
                }
                output.write(body, half, body.length - half);
            }
        }
    }
}
