package org.dataone.artifactcache;

/**
 * ArtifactSpec is a record that describes the single artifact an install run must provide: the
 * URL it is downloaded from and the hex digest its bytes must match. An absent or blank digest
 * means no verification was requested (ex. a local build), in which case no download happens.
 * A non-blank digest that is not well-formed hex of the right length is rejected with an
 * IllegalArgumentException before any file or network access.
 */
public record ArtifactSpec(String sourceUrl, String expectedDigestHex) {

    /**
     * @return True if an expected digest was supplied and the artifact must be verified
     */
    public boolean requiresVerification() {
        return expectedDigestHex != null && !expectedDigestHex.trim().isEmpty();
    }
}
