package org.dataone.artifactcache.exceptions;

/**
 * An exception thrown when a server answers with a status that is neither 200 nor a redirect
 * carrying a 'Location' header.
 */
public class HttpStatusException extends ArtifactFetchException {

    private final int statusCode;
    private final String reasonPhrase;

    public HttpStatusException(int statusCode, String reasonPhrase, String url) {
        super("HTTP error: " + statusCode + " " + reasonPhrase + " (" + url + ")");
        this.statusCode = statusCode;
        this.reasonPhrase = reasonPhrase;
    }

    public int getStatusCode() {
        return statusCode;
    }

    public String getReasonPhrase() {
        return reasonPhrase;
    }
}
