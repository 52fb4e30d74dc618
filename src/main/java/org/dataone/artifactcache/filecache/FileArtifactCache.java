package org.dataone.artifactcache.filecache;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.http.HttpResponse;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.time.Duration;
import java.util.Properties;

import org.apache.commons.logging.Log;
import org.apache.commons.logging.LogFactory;
import org.dataone.artifactcache.ArtifactCache;
import org.dataone.artifactcache.ArtifactSpec;
import org.dataone.artifactcache.CachePaths;
import org.dataone.artifactcache.CacheResult;
import org.dataone.artifactcache.DownloadOutcome;
import org.dataone.artifactcache.digest.DigestSink;
import org.dataone.artifactcache.digest.DigestVerifier;
import org.dataone.artifactcache.exceptions.ArtifactFetchException;
import org.dataone.artifactcache.exceptions.CacheFilesystemException;
import org.dataone.artifactcache.exceptions.NonMatchingChecksumException;
import org.dataone.artifactcache.http.HttpFetcher;

/**
 * FileArtifactCache is an ArtifactCache adapter class that keeps a verified artifact at a given
 * final path on disk and downloads it through a staging file when the final path is missing or
 * stale. To instantiate FileArtifactCache, the calling app may provide properties as described
 * by FileArtifactCache's constructor; absent properties fall back to defaults.
 */
public class FileArtifactCache implements ArtifactCache {
    private static final Log logFileArtifactCache = LogFactory.getLog(FileArtifactCache.class);
    private static final int BUFFER_SIZE = 8192;
    private final DigestVerifier DIGEST_VERIFIER;
    private final int MAX_REDIRECTS;
    private final Duration CONNECT_TIMEOUT;
    private final Duration REQUEST_TIMEOUT;

    public enum ArtifactCacheProperties {
        digestAlgorithm, maxRedirects, connectTimeoutSeconds, requestTimeoutSeconds
    }

    /**
     * Constructor to initialize FileArtifactCache. Recognized keys: digestAlgorithm (default
     * SHA-256), maxRedirects (default 10), connectTimeoutSeconds (default 30) and
     * requestTimeoutSeconds (default 60).
     *
     * @param cacheProperties Properties object, keys are optional
     * @throws IllegalArgumentException Properties are null, or a value is malformed or out of
     *                                  range
     */
    public FileArtifactCache(Properties cacheProperties) throws IllegalArgumentException {
        logFileArtifactCache.debug("Initializing FileArtifactCache");
        FileArtifactCacheUtility.ensureNotNull(
            cacheProperties, "cacheProperties", "FileArtifactCache - constructor"
        );

        String digestAlgorithm = cacheProperties.getProperty(
            ArtifactCacheProperties.digestAlgorithm.name(), DigestVerifier.DEFAULT_ALGORITHM
        );
        int maxRedirects = FileArtifactCacheUtility.getIntProperty(
            cacheProperties, ArtifactCacheProperties.maxRedirects.name(),
            HttpFetcher.DEFAULT_MAX_REDIRECTS, 0
        );
        int connectTimeoutSeconds = FileArtifactCacheUtility.getIntProperty(
            cacheProperties, ArtifactCacheProperties.connectTimeoutSeconds.name(),
            (int) HttpFetcher.DEFAULT_CONNECT_TIMEOUT.getSeconds(), 1
        );
        int requestTimeoutSeconds = FileArtifactCacheUtility.getIntProperty(
            cacheProperties, ArtifactCacheProperties.requestTimeoutSeconds.name(),
            (int) HttpFetcher.DEFAULT_REQUEST_TIMEOUT.getSeconds(), 1
        );

        DIGEST_VERIFIER = new DigestVerifier(digestAlgorithm.trim());
        MAX_REDIRECTS = maxRedirects;
        CONNECT_TIMEOUT = Duration.ofSeconds(connectTimeoutSeconds);
        REQUEST_TIMEOUT = Duration.ofSeconds(requestTimeoutSeconds);
        logFileArtifactCache.debug(
            "FileArtifactCache initialized. Digest Algorithm: " + DIGEST_VERIFIER.getAlgorithm()
                + ". Max Redirects: " + MAX_REDIRECTS + ". Connect Timeout: " + CONNECT_TIMEOUT
                + ". Request Timeout: " + REQUEST_TIMEOUT);
    }

    public FileArtifactCache() {
        this(new Properties());
    }

    // ArtifactCache Public API Methods

    @Override
    public CacheResult ensureArtifact(ArtifactSpec spec, CachePaths paths, String proxyEndpoint)
        throws IOException, NonMatchingChecksumException, IllegalArgumentException {
        FileArtifactCacheUtility.ensureNotNull(spec, "spec", "ensureArtifact");
        FileArtifactCacheUtility.ensureNotNull(paths, "paths", "ensureArtifact");

        if (!spec.requiresVerification()) {
            logFileArtifactCache.info("(no checksum provided; assuming local build)");
            return CacheResult.VERIFICATION_SKIPPED;
        }
        String expectedDigest = checkExpectedDigest(spec.expectedDigestHex());
        FileArtifactCacheUtility.checkForEmptyAndValidString(
            spec.sourceUrl(), "sourceUrl", "ensureArtifact"
        );

        if (finalPathMatches(expectedDigest, paths.finalPath())) {
            logFileArtifactCache.info("local build artifact is up-to-date");
            return CacheResult.CACHE_HIT;
        }

        HttpFetcher fetcher = createFetcher(proxyEndpoint);
        DownloadOutcome outcome;
        try {
            outcome = fetchToStagingFile(fetcher, spec.sourceUrl(), paths.stagingPath());

        } catch (IOException ioe) {
            // The final path has not been touched, only the staging file needs cleaning up
            FileArtifactCacheUtility.deleteIfPresent(paths.stagingPath());
            String errMsg = "Unable to download artifact from: " + spec.sourceUrl() + ". "
                + ioe.getMessage();
            logFileArtifactCache.error(errMsg);
            throw ioe;
        }

        validateStagingFile(expectedDigest, outcome, paths.stagingPath());
        move(paths.stagingPath(), paths.finalPath());
        logFileArtifactCache.info(
            "Artifact verified and stored at: " + paths.finalPath() + " (" + outcome.bytesWritten()
                + " bytes)");
        return CacheResult.DOWNLOADED;
    }

    @Override
    public CacheResult ensureArtifact(ArtifactSpec spec, CachePaths paths) throws IOException,
        NonMatchingChecksumException, IllegalArgumentException {
        return ensureArtifact(spec, paths, null);
    }

    @Override
    public boolean isCached(ArtifactSpec spec, CachePaths paths) {
        FileArtifactCacheUtility.ensureNotNull(spec, "spec", "isCached");
        FileArtifactCacheUtility.ensureNotNull(paths, "paths", "isCached");
        if (!spec.requiresVerification()) {
            return false;
        }
        return finalPathMatches(checkExpectedDigest(spec.expectedDigestHex()), paths.finalPath());
    }

    public DigestVerifier getDigestVerifier() {
        return DIGEST_VERIFIER;
    }

    // FileArtifactCache Core & Supporting Methods

    /**
     * Confirms that the expected digest has the shape of a digest produced by the configured
     * algorithm, and returns it trimmed and in lower-case.
     *
     * @param expectedDigestHex Expected digest supplied by the caller
     * @return Normalized expected digest
     * @throws IllegalArgumentException If the digest has the wrong length or non-hex characters
     */
    protected String checkExpectedDigest(String expectedDigestHex)
        throws IllegalArgumentException {
        String expected = expectedDigestHex.trim().toLowerCase();
        if (!DIGEST_VERIFIER.isWellFormed(expected)) {
            String errMsg = "Expected digest is not a valid " + DIGEST_VERIFIER.getAlgorithm()
                + " hex digest (" + DIGEST_VERIFIER.getHexLength() + " hex characters): "
                + expectedDigestHex;
            logFileArtifactCache.error(errMsg);
            throw new IllegalArgumentException(errMsg);
        }
        return expected;
    }

    /**
     * Determines whether the final path holds a verified copy of the artifact. A missing or
     * unreadable file, or one whose digest differs, is reported as not cached.
     *
     * @param expectedDigest Normalized expected digest
     * @param finalPath      Location of the verified artifact
     * @return True if no download is needed
     */
    protected boolean finalPathMatches(String expectedDigest, Path finalPath) {
        if (!Files.exists(finalPath)) {
            logFileArtifactCache.debug("No local build artifact found at: " + finalPath);
            return false;
        }

        String actualDigest;
        try {
            actualDigest = DIGEST_VERIFIER.calculateHexDigest(Files.newInputStream(finalPath));

        } catch (IOException ioe) {
            logFileArtifactCache.warn(
                "Unable to read local build artifact: " + finalPath + ", treating it as not"
                    + " cached. Additional Details: " + ioe.getMessage());
            return false;
        }

        if (DIGEST_VERIFIER.verify(actualDigest, expectedDigest)) {
            return true;
        }
        logFileArtifactCache.info("local build artifact is outdated");
        logFileArtifactCache.debug(
            "Digest of: " + finalPath + " is: " + actualDigest + ". Expected: " + expectedDigest);
        return false;
    }

    /**
     * Creates the HttpFetcher used for a single download, routed through the given proxy.
     *
     * @param proxyEndpoint Proxy URL or null
     * @return HttpFetcher configured with this cache's redirect bound and timeouts
     */
    protected HttpFetcher createFetcher(String proxyEndpoint) {
        return new HttpFetcher(proxyEndpoint, MAX_REDIRECTS, CONNECT_TIMEOUT, REQUEST_TIMEOUT);
    }

    /**
     * Requests the artifact URL and streams the response body into the staging file.
     *
     * @param fetcher     HttpFetcher to request the URL with
     * @param sourceUrl   URL of the artifact
     * @param stagingPath File to write the body into
     * @return DownloadOutcome with the digest and length of the body
     * @throws IOException Network, redirect, status or filesystem failure
     */
    protected DownloadOutcome fetchToStagingFile(
        HttpFetcher fetcher, String sourceUrl, Path stagingPath) throws IOException {
        HttpResponse<InputStream> response = fetcher.open(sourceUrl);
        try (InputStream body = response.body()) {
            FileArtifactCacheUtility.createParentDirectories(stagingPath);
            return writeToStagingFileAndDigest(body, stagingPath);
        }
    }

    /**
     * Write the input stream into the staging file and digest it in the same pass. Each chunk
     * read is handed to the file first and then to the digest; the digest is finalized only
     * after the stream is exhausted and the file has been closed. An existing staging file is
     * truncated.
     *
     * @param dataStream  Stream of artifact bytes, not closed by this method
     * @param stagingPath File to write into
     * @return DownloadOutcome with the digest and number of bytes written
     * @throws ArtifactFetchException   If reading from the stream fails
     * @throws CacheFilesystemException If opening, writing or closing the staging file fails
     */
    protected DownloadOutcome writeToStagingFileAndDigest(InputStream dataStream, Path stagingPath)
        throws ArtifactFetchException, CacheFilesystemException {
        DigestSink digestSink = DIGEST_VERIFIER.newDigestStream();

        try (OutputStream os = openStagingFile(stagingPath)) {
            byte[] buffer = new byte[BUFFER_SIZE];
            int bytesRead;
            while ((bytesRead = readChunk(dataStream, buffer, digestSink)) != -1) {
                try {
                    os.write(buffer, 0, bytesRead);
                } catch (IOException ioe) {
                    String errMsg = "Error writing staging file: " + stagingPath + " after "
                        + digestSink.getBytesWritten() + " bytes. " + ioe.getMessage();
                    logFileArtifactCache.error(errMsg);
                    throw new CacheFilesystemException(errMsg, ioe);
                }
                digestSink.write(buffer, 0, bytesRead);
            }

        } catch (ArtifactFetchException | CacheFilesystemException e) {
            throw e;

        } catch (IOException ioe) {
            String errMsg = "Unable to close staging file: " + stagingPath + ". "
                + ioe.getMessage();
            logFileArtifactCache.error(errMsg);
            throw new CacheFilesystemException(errMsg, ioe);
        }

        String digest = DIGEST_VERIFIER.finalizeDigest(digestSink);
        logFileArtifactCache.debug(
            "Response body has been written to staging file: " + stagingPath + ". Bytes: "
                + digestSink.getBytesWritten() + ". Digest: " + digest);
        return new DownloadOutcome(digest, digestSink.getBytesWritten());
    }

    /**
     * Compares the digest of a finished download with the expected digest. If there is a
     * mismatch, the staging file will be deleted and an exception will be thrown.
     *
     * @param expectedDigest Normalized expected digest
     * @param outcome        Result of writing the staging file
     * @param stagingPath    Staging file that is being evaluated
     * @throws NonMatchingChecksumException If the digests differ
     */
    protected void validateStagingFile(
        String expectedDigest, DownloadOutcome outcome, Path stagingPath)
        throws NonMatchingChecksumException {
        if (DIGEST_VERIFIER.verify(outcome.digestHex(), expectedDigest)) {
            logFileArtifactCache.debug("Passed integrity check: " + stagingPath);
            return;
        }

        NonMatchingChecksumException nmce = new NonMatchingChecksumException(
            expectedDigest, outcome.digestHex());
        if (FileArtifactCacheUtility.deleteIfPresent(stagingPath)) {
            logFileArtifactCache.error(
                nmce.getMessage() + ". Staging file has been deleted: " + stagingPath);
        } else {
            logFileArtifactCache.error(
                nmce.getMessage() + ". Failed to delete staging file: " + stagingPath);
        }
        throw nmce;
    }

    /**
     * Moves the verified staging file onto the final path with a single atomic rename, replacing
     * any stale file there. Both paths are expected on the same file system.
     *
     * @param source Verified staging file
     * @param target Final path of the artifact
     * @throws CacheFilesystemException If the directory cannot be created, the file system does
     *                                  not support an atomic move or the rename fails
     */
    protected void move(Path source, Path target) throws CacheFilesystemException {
        logFileArtifactCache.debug("Moving artifact, from source: " + source + ", to target: "
                                       + target);
        FileArtifactCacheUtility.createParentDirectories(target);

        try {
            Files.move(
                source, target, StandardCopyOption.ATOMIC_MOVE,
                StandardCopyOption.REPLACE_EXISTING
            );
            logFileArtifactCache.debug("File moved from: " + source + ", to: " + target);

        } catch (AtomicMoveNotSupportedException amnse) {
            String errMsg = "StandardCopyOption.ATOMIC_MOVE failed. AtomicMove is not supported"
                + " across file systems. Source: " + source + ". Target: " + target;
            logFileArtifactCache.error(errMsg);
            throw new CacheFilesystemException(errMsg, amnse);

        } catch (IOException ioe) {
            String errMsg = "Unable to move file. Source: " + source + ". Target: " + target
                + ". " + ioe.getMessage();
            logFileArtifactCache.error(errMsg);
            throw new CacheFilesystemException(errMsg, ioe);
        }
    }

    private OutputStream openStagingFile(Path stagingPath) throws CacheFilesystemException {
        try {
            return Files.newOutputStream(
                stagingPath, StandardOpenOption.CREATE, StandardOpenOption.TRUNCATE_EXISTING,
                StandardOpenOption.WRITE
            );
        } catch (IOException ioe) {
            String errMsg = "Unable to open staging file: " + stagingPath + ". " + ioe.getMessage();
            logFileArtifactCache.error(errMsg);
            throw new CacheFilesystemException(errMsg, ioe);
        }
    }

    private static int readChunk(InputStream dataStream, byte[] buffer, DigestSink digestSink)
        throws ArtifactFetchException {
        try {
            return dataStream.read(buffer);
        } catch (IOException ioe) {
            String errMsg = "Response body ended unexpectedly after " + digestSink
                .getBytesWritten() + " bytes. " + ioe.getMessage();
            logFileArtifactCache.error(errMsg);
            throw new ArtifactFetchException(errMsg, ioe);
        }
    }
}
