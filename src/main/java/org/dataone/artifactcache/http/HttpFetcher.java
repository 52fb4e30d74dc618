package org.dataone.artifactcache.http;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.net.ProxySelector;
import java.net.URI;
import java.net.URISyntaxException;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.time.Duration;
import java.util.Optional;

import org.apache.commons.logging.Log;
import org.apache.commons.logging.LogFactory;
import org.dataone.artifactcache.exceptions.ArtifactFetchException;
import org.dataone.artifactcache.exceptions.HttpStatusException;
import org.dataone.artifactcache.exceptions.RedirectLoopException;

/**
 * HttpFetcher opens a GET request for an artifact URL and hands back the body of the final 200
 * response as a stream. Redirects are followed here rather than by {@link HttpClient} so that
 * the number of hops can be bounded and every hop logged.
 */
public class HttpFetcher {
    private static final Log logHttpFetcher = LogFactory.getLog(HttpFetcher.class);
    private static final String USER_AGENT = "artifactcache/1.0";

    public static final int DEFAULT_MAX_REDIRECTS = 10;
    public static final Duration DEFAULT_CONNECT_TIMEOUT = Duration.ofSeconds(30);
    public static final Duration DEFAULT_REQUEST_TIMEOUT = Duration.ofSeconds(60);

    private final HttpClient httpClient;
    private final int maxRedirects;
    private final Duration requestTimeout;

    /**
     * Constructor to initialize an HttpFetcher.
     *
     * @param proxyEndpoint  URL of a forward proxy (ex. "http://proxy.example:3128"), or null to
     *                       connect directly
     * @param maxRedirects   Number of redirects that may be followed before giving up
     * @param connectTimeout Time allowed to establish a connection
     * @param requestTimeout Time allowed between sending a request and receiving the response
     *                       headers. Reading the body is not bounded by this value.
     * @throws IllegalArgumentException If the proxy endpoint cannot be parsed or a value is
     *                                  negative
     */
    public HttpFetcher(
        String proxyEndpoint, int maxRedirects, Duration connectTimeout, Duration requestTimeout
    ) throws IllegalArgumentException {
        if (maxRedirects < 0) {
            String errMsg = "HttpFetcher - maxRedirects cannot be negative: " + maxRedirects;
            logHttpFetcher.error(errMsg);
            throw new IllegalArgumentException(errMsg);
        }
        this.maxRedirects = maxRedirects;
        this.requestTimeout = requestTimeout;

        HttpClient.Builder builder = HttpClient.newBuilder()
            .version(HttpClient.Version.HTTP_1_1)
            .followRedirects(HttpClient.Redirect.NEVER)
            .connectTimeout(connectTimeout);
        InetSocketAddress proxyAddress = parseProxyEndpoint(proxyEndpoint);
        if (proxyAddress != null) {
            logHttpFetcher.debug("Routing requests through proxy: " + proxyAddress);
            builder.proxy(ProxySelector.of(proxyAddress));
        }
        this.httpClient = builder.build();
    }

    public HttpFetcher(String proxyEndpoint) {
        this(proxyEndpoint, DEFAULT_MAX_REDIRECTS, DEFAULT_CONNECT_TIMEOUT, DEFAULT_REQUEST_TIMEOUT);
    }

    /**
     * Requests the given URL, following 3xx responses that carry a 'Location' header until a
     * non-redirect response arrives. A relative location is resolved against the URL that
     * returned it. The caller owns the returned body stream and must close it.
     *
     * @param url Absolute http or https URL
     * @return The 200 response whose body is the artifact
     * @throws RedirectLoopException  If more than maxRedirects redirects are encountered
     * @throws HttpStatusException    If the final response is not a 200
     * @throws ArtifactFetchException If the request cannot be sent, times out or is interrupted,
     *                                or a redirect points at an unsupported URL
     */
    public HttpResponse<InputStream> open(String url)
        throws RedirectLoopException, HttpStatusException, ArtifactFetchException {
        URI target = toUri(url);
        int redirects = 0;

        while (true) {
            logHttpFetcher.info("downloading " + target);
            HttpResponse<InputStream> response = send(target);
            int statusCode = response.statusCode();
            Optional<String> location = response.headers().firstValue("Location");

            if (statusCode >= 300 && statusCode < 400 && location.isPresent()) {
                discardBody(response);
                if (redirects >= maxRedirects) {
                    String errMsg = "Too many redirects (" + maxRedirects + ") while requesting: "
                        + url + ". Last location: " + target;
                    logHttpFetcher.error(errMsg);
                    throw new RedirectLoopException(errMsg, maxRedirects, target.toString());
                }
                redirects++;
                URI next = resolveLocation(target, location.get());
                checkRedirectTarget(target, next);
                target = next;
                logHttpFetcher.info("following redirect to " + target);
                continue;
            }

            if (statusCode != 200) {
                discardBody(response);
                HttpStatusException hse = new HttpStatusException(
                    statusCode, reasonPhrase(statusCode), target.toString());
                logHttpFetcher.error(hse.getMessage());
                throw hse;
            }

            logHttpFetcher.debug(
                "Received 200 for: " + target + " after " + redirects + " redirect(s).");
            return response;
        }
    }

    public int getMaxRedirects() {
        return maxRedirects;
    }

    /**
     * Sends a single GET request without following redirects.
     */
    protected HttpResponse<InputStream> send(URI target) throws ArtifactFetchException {
        HttpRequest.Builder requestBuilder = HttpRequest.newBuilder(target)
            .GET()
            .header("User-Agent", USER_AGENT);
        if (requestTimeout != null) {
            requestBuilder.timeout(requestTimeout);
        }

        try {
            return httpClient.send(
                requestBuilder.build(), HttpResponse.BodyHandlers.ofInputStream());

        } catch (HttpTimeoutException hte) {
            String errMsg = "Timed out requesting: " + target + ". " + hte.getMessage();
            logHttpFetcher.error(errMsg);
            throw new ArtifactFetchException(errMsg, hte);

        } catch (IOException ioe) {
            String errMsg = "Unable to request: " + target + ". " + ioe;
            logHttpFetcher.error(errMsg);
            throw new ArtifactFetchException(errMsg, ioe);

        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            String errMsg = "Download interrupted: " + target;
            logHttpFetcher.error(errMsg);
            throw new ArtifactFetchException(errMsg, ie);
        }
    }

    /**
     * Parses a proxy endpoint such as "http://proxy:3128" or "proxy:3128" into a socket address.
     *
     * @param proxyEndpoint Proxy URL, may be null or empty
     * @return Address of the proxy, or null if none was given
     * @throws IllegalArgumentException If the endpoint has no host
     */
    protected static InetSocketAddress parseProxyEndpoint(String proxyEndpoint)
        throws IllegalArgumentException {
        if (proxyEndpoint == null || proxyEndpoint.trim().isEmpty()) {
            return null;
        }
        String endpoint = proxyEndpoint.trim();
        if (!endpoint.contains("://")) {
            endpoint = "http://" + endpoint;
        }
        URI proxyUri;
        try {
            proxyUri = new URI(endpoint);
        } catch (URISyntaxException use) {
            String errMsg = "HttpFetcher - Invalid proxy endpoint: " + proxyEndpoint + ". "
                + use.getMessage();
            logHttpFetcher.error(errMsg);
            throw new IllegalArgumentException(errMsg, use);
        }
        if (proxyUri.getHost() == null) {
            String errMsg = "HttpFetcher - Proxy endpoint has no host: " + proxyEndpoint;
            logHttpFetcher.error(errMsg);
            throw new IllegalArgumentException(errMsg);
        }
        int port = proxyUri.getPort();
        if (port == -1) {
            port = "https".equalsIgnoreCase(proxyUri.getScheme()) ? 443 : 80;
        }
        return new InetSocketAddress(proxyUri.getHost(), port);
    }

    protected static URI resolveLocation(URI current, String location)
        throws ArtifactFetchException {
        try {
            return current.resolve(new URI(location.trim()));
        } catch (URISyntaxException | IllegalArgumentException e) {
            String errMsg = "Invalid redirect location '" + location + "' from: " + current;
            logHttpFetcher.error(errMsg);
            throw new ArtifactFetchException(errMsg, e);
        }
    }

    /**
     * Refuses a redirect target that is not an http or https URL with a host, or that would
     * downgrade an https request to plain http.
     *
     * @param current URL that returned the redirect
     * @param next    Resolved redirect target
     * @throws ArtifactFetchException If the redirect must not be followed
     */
    protected static void checkRedirectTarget(URI current, URI next)
        throws ArtifactFetchException {
        checkSchemeAndHost(next, "Unsupported redirect location from: " + current + ". ");
        if ("https".equalsIgnoreCase(current.getScheme()) && "http".equalsIgnoreCase(
            next.getScheme())) {
            String errMsg = "Refusing redirect from https to http: " + current + " -> " + next;
            logHttpFetcher.error(errMsg);
            throw new ArtifactFetchException(errMsg);
        }
    }

    private static URI toUri(String url) throws ArtifactFetchException {
        URI uri;
        try {
            uri = new URI(url);
        } catch (URISyntaxException | NullPointerException e) {
            String errMsg = "Invalid artifact URL: " + url;
            logHttpFetcher.error(errMsg);
            throw new ArtifactFetchException(errMsg, e);
        }
        checkSchemeAndHost(uri, "Unsupported artifact URL. ");
        return uri;
    }

    private static void checkSchemeAndHost(URI uri, String context)
        throws ArtifactFetchException {
        String scheme = uri.getScheme();
        if (scheme == null || !(scheme.equalsIgnoreCase("https") || scheme.equalsIgnoreCase(
            "http"))) {
            String errMsg = context + "Only http and https are supported: " + uri;
            logHttpFetcher.error(errMsg);
            throw new ArtifactFetchException(errMsg);
        }
        if (uri.getHost() == null) {
            String errMsg = context + "URL has no host: " + uri;
            logHttpFetcher.error(errMsg);
            throw new ArtifactFetchException(errMsg);
        }
    }

    private static void discardBody(HttpResponse<InputStream> response) {
        try (InputStream body = response.body()) {
            body.transferTo(OutputStream.nullOutputStream());
        } catch (IOException ioe) {
            logHttpFetcher.debug("Unable to drain discarded response body: " + ioe.getMessage());
        }
    }

    private static String reasonPhrase(int statusCode) {
        switch (statusCode) {
            case 300: return "Multiple Choices";
            case 301: return "Moved Permanently";
            case 302: return "Found";
            case 303: return "See Other";
            case 304: return "Not Modified";
            case 307: return "Temporary Redirect";
            case 308: return "Permanent Redirect";
            case 400: return "Bad Request";
            case 401: return "Unauthorized";
            case 403: return "Forbidden";
            case 404: return "Not Found";
            case 407: return "Proxy Authentication Required";
            case 408: return "Request Timeout";
            case 410: return "Gone";
            case 429: return "Too Many Requests";
            case 500: return "Internal Server Error";
            case 502: return "Bad Gateway";
            case 503: return "Service Unavailable";
            case 504: return "Gateway Timeout";
            default: return statusCode >= 200 && statusCode < 300 ? "Unexpected Success Status"
                : "Unknown Status";
        }
    }
}
