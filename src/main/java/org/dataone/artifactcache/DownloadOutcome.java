package org.dataone.artifactcache;

/**
 * DownloadOutcome is a record of a single response body that was streamed to the staging file:
 * the hex digest computed while writing and the number of bytes written.
 */
public record DownloadOutcome(String digestHex, long bytesWritten) {

}
