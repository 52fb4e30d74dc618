package org.dataone.artifactcache.exceptions;

/**
 * An exception thrown when a checksum does not match what is expected.
 */

public class NonMatchingChecksumException extends IllegalArgumentException {

    private final String expected;
    private final String actual;

    public NonMatchingChecksumException(String expected, String actual) {
        super("Digest mismatch. Expected " + expected + " got " + actual);
        this.expected = expected;
        this.actual = actual;
    }

    public String getExpected() {
        return expected;
    }

    public String getActual() {
        return actual;
    }
}
