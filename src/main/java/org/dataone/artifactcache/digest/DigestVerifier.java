package org.dataone.artifactcache.digest;

import java.io.IOException;
import java.io.InputStream;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;

import org.apache.commons.logging.Log;
import org.apache.commons.logging.LogFactory;
import org.dataone.artifactcache.exceptions.DigestStateException;
import org.dataone.artifactcache.exceptions.UnsupportedHashAlgorithmException;

/**
 * DigestVerifier computes hex digests over byte streams of any length without buffering them,
 * and compares computed digests with expected values. It is stateless apart from the algorithm
 * it was created with; each {@link DigestSink} it hands out carries its own state.
 */
public class DigestVerifier {
    private static final Log logDigestVerifier = LogFactory.getLog(DigestVerifier.class);

    public static final String DEFAULT_ALGORITHM = "SHA-256";

    private final String algorithm;
    private final int hexLength;

    public DigestVerifier() {
        this(DEFAULT_ALGORITHM);
    }

    /**
     * @param algorithm Name of a {@link MessageDigest} algorithm, ex. "SHA-256"
     * @throws UnsupportedHashAlgorithmException If the algorithm is not available in this JVM
     */
    public DigestVerifier(String algorithm) throws UnsupportedHashAlgorithmException {
        if (algorithm == null || algorithm.trim().isEmpty()) {
            throw new IllegalArgumentException(
                "Calling Method: DigestVerifier(): algorithm cannot be null or empty.");
        }
        this.algorithm = algorithm;
        this.hexLength = newMessageDigest().getDigestLength() * 2;
    }

    /**
     * Creates a fresh sink that accumulates a digest over the bytes written to it.
     *
     * @return DigestSink ready to receive bytes
     */
    public DigestSink newDigestStream() {
        return new DigestSink(newMessageDigest());
    }

    /**
     * Finalizes the given sink and returns its digest. No more bytes may be written afterwards.
     *
     * @param sink Sink to finalize
     * @return Lower-case hex digest
     * @throws DigestStateException If the sink was already finalized
     */
    public String finalizeDigest(DigestSink sink) throws DigestStateException {
        if (sink == null) {
            throw new IllegalArgumentException(
                "Calling Method: finalizeDigest(): sink cannot be null.");
        }
        return sink.finish();
    }

    /**
     * Calculate the hex digest of the given stream. The stream is read to its end and closed.
     *
     * @param dataStream InputStream to digest
     * @return Lower-case hex digest of the stream content
     * @throws IOException Error when reading from the stream
     */
    public String calculateHexDigest(InputStream dataStream) throws IOException {
        DigestSink sink = newDigestStream();
        try (dataStream) {
            byte[] buffer = new byte[8192];
            int bytesRead;
            while ((bytesRead = dataStream.read(buffer)) != -1) {
                sink.write(buffer, 0, bytesRead);
            }
        }
        return finalizeDigest(sink);
    }

    /**
     * Compares two hex digests. Case is ignored but length and value must match exactly.
     *
     * @param actualHex   Digest that was computed
     * @param expectedHex Digest that was expected
     * @return True if both are present and equal
     */
    public boolean verify(String actualHex, String expectedHex) {
        if (actualHex == null || expectedHex == null) {
            return false;
        }
        return actualHex.length() == expectedHex.length() && actualHex.equalsIgnoreCase(
            expectedHex);
    }

    /**
     * Checks whether a given string has the shape of a digest produced by this verifier, i.e. the
     * right number of hexadecimal characters.
     *
     * @param hex String to check
     * @return True if well-formed
     */
    public boolean isWellFormed(String hex) {
        if (hex == null || hex.length() != hexLength) {
            return false;
        }
        for (int i = 0; i < hex.length(); i++) {
            if (Character.digit(hex.charAt(i), 16) == -1) {
                return false;
            }
        }
        return true;
    }

    public String getAlgorithm() {
        return algorithm;
    }

    public int getHexLength() {
        return hexLength;
    }

    private MessageDigest newMessageDigest() {
        try {
            return MessageDigest.getInstance(algorithm);

        } catch (NoSuchAlgorithmException nsae) {
            String errMsg = "Algorithm not supported: " + algorithm + ". " + nsae.getMessage();
            logDigestVerifier.error(errMsg);
            throw new UnsupportedHashAlgorithmException(errMsg, nsae);
        }
    }
}
