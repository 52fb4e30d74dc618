package org.dataone.artifactcache.digest;

import java.io.OutputStream;
import java.security.MessageDigest;

import javax.xml.bind.DatatypeConverter;

import org.dataone.artifactcache.exceptions.DigestStateException;

/**
 * DigestSink is a write-only stream that accumulates a {@link MessageDigest} over every byte
 * written to it. It holds no data besides the digest state, so it can sit next to a file or
 * network stream as a second consumer of the same bytes. Once {@link #finish()} has been called
 * the sink is closed for good.
 */
public class DigestSink extends OutputStream {
    private final MessageDigest messageDigest;
    private long bytesWritten = 0;
    private boolean finished = false;

    DigestSink(MessageDigest messageDigest) {
        this.messageDigest = messageDigest;
    }

    @Override
    public void write(int b) {
        ensureOpen("write");
        messageDigest.update((byte) b);
        bytesWritten++;
    }

    @Override
    public void write(byte[] buffer, int offset, int length) {
        ensureOpen("write");
        messageDigest.update(buffer, offset, length);
        bytesWritten += length;
    }

    /**
     * Completes the digest computation.
     *
     * @return Lower-case hex digest of all bytes written so far
     * @throws DigestStateException If the sink has already been finished
     */
    public String finish() throws DigestStateException {
        ensureOpen("finish");
        finished = true;
        return DatatypeConverter.printHexBinary(messageDigest.digest()).toLowerCase();
    }

    /**
     * Closing does not finish the digest; {@link #finish()} must still be called to obtain it.
     */
    @Override
    public void close() {
        // Nothing to release
    }

    public long getBytesWritten() {
        return bytesWritten;
    }

    public boolean isFinished() {
        return finished;
    }

    public String getAlgorithm() {
        return messageDigest.getAlgorithm();
    }

    private void ensureOpen(String operation) {
        if (finished) {
            throw new DigestStateException(
                "DigestSink." + operation + "() - digest (" + messageDigest.getAlgorithm()
                    + ") has already been finalized.");
        }
    }
}
