package org.dataone.artifactcache;

import java.io.IOException;

import org.dataone.artifactcache.exceptions.ArtifactFetchException;
import org.dataone.artifactcache.exceptions.CacheFilesystemException;
import org.dataone.artifactcache.exceptions.HttpStatusException;
import org.dataone.artifactcache.exceptions.NonMatchingChecksumException;
import org.dataone.artifactcache.exceptions.RedirectLoopException;

/**
 * ArtifactCache provides a prebuilt binary archive on local disk for a package installation. It
 * downloads the archive described by an {@link ArtifactSpec} when needed, verifies its digest
 * and keeps the verified copy at a well-known final path so that later runs can reuse it
 * without touching the network. Cache implementations (like `FileArtifactCache`) must
 * implement the ArtifactCache interface to ensure proper usage of the system.
 */
public interface ArtifactCache {
        /**
         * The `ensureArtifact` method guarantees that, when it returns normally, the final path of
         * the given CachePaths holds bytes whose digest equals the expected digest of the given
         * ArtifactSpec.
         *
         * If the ArtifactSpec carries no expected digest, the caller is assumed to have a valid local
         * build and the method returns immediately without any network access. If a file already
         * exists at the final path and its digest matches, the method also returns without any
         * network access. A final file that cannot be read or does not match is treated as stale.
         *
         * Otherwise the source URL is fetched (following up to a bounded number of redirects,
         * optionally through a forward proxy). The response body is written to the staging path
         * and digested in the same pass. Only when the digest matches is the staging file renamed
         * onto the final path in a single atomic move; on a mismatch the staging file is deleted
         * and the final path is left untouched.
         *
         * Concurrent calls against the same CachePaths (from this or another process) are not
         * guarded and must be serialized by the caller.
         *
         * @param spec          URL and expected digest of the artifact
         * @param paths         Final and staging locations of the artifact
         * @param proxyEndpoint URL of an HTTP(S) forward proxy, or null for a direct connection
         * @return CacheResult describing how the artifact was provided
         * @throws HttpStatusException          When the server answers with a non-200,
         *                                      non-redirect status
         * @throws RedirectLoopException        When the redirect chain exceeds the hop bound
         * @throws ArtifactFetchException       When the connection fails or times out
         * @throws NonMatchingChecksumException When the downloaded bytes do not match the expected
         *                                      digest
         * @throws CacheFilesystemException     When the staging or final path cannot be written
         *                                      or renamed
         * @throws IOException                  Any other I/O error while streaming the body
         * @throws IllegalArgumentException     Invalid arguments, like a malformed expected digest
         */
        CacheResult ensureArtifact(ArtifactSpec spec, CachePaths paths, String proxyEndpoint)
                throws IOException, NonMatchingChecksumException, IllegalArgumentException;

        CacheResult ensureArtifact(ArtifactSpec spec, CachePaths paths) throws IOException,
                NonMatchingChecksumException, IllegalArgumentException;

        /**
         * The `isCached` method checks whether the final path holds bytes matching the expected
         * digest. Read errors, like a missing file or insufficient permissions, are reported as
         * not cached.
         *
         * @param spec  URL and expected digest of the artifact
         * @param paths Final and staging locations of the artifact
         * @return True if the final path holds a verified copy
         */
        boolean isCached(ArtifactSpec spec, CachePaths paths);
}
