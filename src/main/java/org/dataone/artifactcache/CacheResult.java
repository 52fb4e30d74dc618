package org.dataone.artifactcache;

/**
 * How an {@link ArtifactCache#ensureArtifact} call was satisfied.
 */
public enum CacheResult {
    /** No expected digest was supplied, the local build is trusted and nothing was fetched. */
    VERIFICATION_SKIPPED,
    /** The artifact at the final path already matched the expected digest. */
    CACHE_HIT,
    /** The artifact was downloaded, verified and published to the final path. */
    DOWNLOADED
}
