package org.dataone.artifactcache.testdata;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetAddress;
import java.net.InetSocketAddress;
import java.net.URI;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;

/*
 * In-process HTTP server for the fetch tests. Each path is given a canned response; every
 * request is counted per path and its request-target is recorded, so tests can assert how many
 * requests were made and whether they went through a proxy (absolute-form targets).
 */
public class TestHttpServer implements AutoCloseable {
    private interface Responder {
        void respond(HttpExchange exchange) throws IOException;
    }

    private final HttpServer httpServer;
    private final Map<String, Responder> responders = new ConcurrentHashMap<>();
    private final Map<String, AtomicInteger> requestCounts = new ConcurrentHashMap<>();
    private final List<URI> requestTargets = Collections.synchronizedList(new ArrayList<>());
    private final CountDownLatch closing = new CountDownLatch(1);

    public TestHttpServer() throws IOException {
        httpServer = HttpServer.create(
            new InetSocketAddress(InetAddress.getLoopbackAddress(), 0), 0);
        httpServer.createContext("/", this::handle);
        httpServer.setExecutor(null);
        httpServer.start();
    }

    /**
     * Respond to the path with a 200 and the given body
     */
    public void serveBytes(String path, byte[] body) {
        responders.put(path, exchange -> {
            exchange.sendResponseHeaders(200, body.length == 0 ? -1 : body.length);
            try (OutputStream os = exchange.getResponseBody()) {
                os.write(body);
            }
        });
    }

    /**
     * Respond to the path with a redirect status and a Location header
     */
    public void redirect(String path, int statusCode, String location) {
        responders.put(path, exchange -> {
            exchange.getResponseHeaders().add("Location", location);
            exchange.sendResponseHeaders(statusCode, -1);
            exchange.close();
        });
    }

    /**
     * Respond to the path with the given status and a short text body
     */
    public void error(String path, int statusCode) {
        byte[] body = ("status " + statusCode).getBytes();
        responders.put(path, exchange -> {
            exchange.sendResponseHeaders(statusCode, body.length);
            try (OutputStream os = exchange.getResponseBody()) {
                os.write(body);
            }
        });
    }

    /**
     * Announce a Content-Length of declaredLength but send only the given bytes before closing
     * the connection
     */
    public void truncated(String path, byte[] partialBody, long declaredLength) {
        responders.put(path, exchange -> {
            exchange.sendResponseHeaders(200, declaredLength);
            OutputStream os = exchange.getResponseBody();
            os.write(partialBody);
            os.flush();
            try {
                os.close();
            } catch (IOException expected) {
                // Closing with bytes outstanding drops the connection
            }
        });
    }

    /**
     * Hold back the response headers for the path until the server is closed
     */
    public void stalled(String path) {
        responders.put(path, exchange -> {
            try {
                closing.await(30, TimeUnit.SECONDS);
            } catch (InterruptedException ie) {
                Thread.currentThread().interrupt();
            }
            exchange.close();
        });
    }

    public String url(String path) {
        return "http://" + getHostAndPort() + path;
    }

    public String getHostAndPort() {
        InetSocketAddress address = httpServer.getAddress();
        return address.getHostString() + ":" + address.getPort();
    }

    public int requestCount(String path) {
        AtomicInteger count = requestCounts.get(path);
        return count == null ? 0 : count.get();
    }

    public int totalRequests() {
        int total = 0;
        for (AtomicInteger count : requestCounts.values()) {
            total += count.get();
        }
        return total;
    }

    public List<URI> getRequestTargets() {
        synchronized (requestTargets) {
            return new ArrayList<>(requestTargets);
        }
    }

    @Override
    public void close() {
        closing.countDown();
        httpServer.stop(0);
    }

    private void handle(HttpExchange exchange) throws IOException {
        URI requestUri = exchange.getRequestURI();
        String path = requestUri.getPath();
        requestTargets.add(requestUri);
        requestCounts.computeIfAbsent(path, p -> new AtomicInteger()).incrementAndGet();

        Responder responder = responders.get(path);
        if (responder == null) {
            exchange.sendResponseHeaders(404, -1);
            exchange.close();
            return;
        }
        responder.respond(exchange);
    }
}
