package org.dataone.artifactcache.filecache;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import org.dataone.artifactcache.DownloadOutcome;
import org.dataone.artifactcache.exceptions.ArtifactFetchException;
import org.dataone.artifactcache.exceptions.CacheFilesystemException;
import org.dataone.artifactcache.exceptions.NonMatchingChecksumException;
import org.dataone.artifactcache.testdata.TestDataHarness;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

/**
 * Test class for FileArtifactCache protected members
 */
public class FileArtifactCacheProtectedTest {
    private FileArtifactCache fileArtifactCache;
    private Path stagingPath;

    /**
     * Temporary folder for tests to run in
     */
    @TempDir
    public Path tempFolder;

    @BeforeEach
    public void initializeFileArtifactCache() {
        fileArtifactCache = new FileArtifactCache();
        stagingPath = tempFolder.resolve("unverified-prebuild.tmp");
    }

    /*
     * Non-test method returning a stream that fails after handing out some bytes
     */
    private static InputStream failingStream(byte[] prefix) {
        return new ByteArrayInputStream(prefix) {
            @Override
            public int read(byte[] b) throws IOException {
                int read = super.read(b, 0, b.length);
                if (read == -1) {
                    throw new IOException("Connection reset");
                }
                return read;
            }
        };
    }

    /**
     * Check that the staging file and the digest see the same bytes
     */
    @Test
    public void writeToStagingFileAndDigest() throws Exception {
        byte[] data = TestDataHarness.artifactBytes(70_001);

        DownloadOutcome outcome = fileArtifactCache.writeToStagingFileAndDigest(
            new ByteArrayInputStream(data), stagingPath);

        assertEquals(TestDataHarness.sha256Hex(data), outcome.digestHex());
        assertEquals(data.length, outcome.bytesWritten());
        assertArrayEquals(data, Files.readAllBytes(stagingPath));
    }

    /**
     * Check that an empty stream yields an empty staging file and the empty digest
     */
    @Test
    public void writeToStagingFileAndDigest_emptyStream() throws Exception {
        DownloadOutcome outcome = fileArtifactCache.writeToStagingFileAndDigest(
            new ByteArrayInputStream(new byte[0]), stagingPath);

        assertEquals(TestDataHarness.SHA256_EMPTY, outcome.digestHex());
        assertEquals(0, outcome.bytesWritten());
        assertEquals(0, Files.size(stagingPath));
    }

    /**
     * Check that a longer leftover staging file is truncated
     */
    @Test
    public void writeToStagingFileAndDigest_truncatesExisting() throws Exception {
        Files.write(stagingPath, TestDataHarness.artifactBytes(10_000));
        byte[] data = "abc".getBytes(StandardCharsets.UTF_8);

        DownloadOutcome outcome = fileArtifactCache.writeToStagingFileAndDigest(
            new ByteArrayInputStream(data), stagingPath);

        assertEquals(TestDataHarness.SHA256_ABC, outcome.digestHex());
        assertArrayEquals(data, Files.readAllBytes(stagingPath));
    }

    /**
     * Check that a read failure is reported as a fetch failure
     */
    @Test
    public void writeToStagingFileAndDigest_readFailure() {
        InputStream dataStream = failingStream(TestDataHarness.artifactBytes(20_000));

        assertThrows(
            ArtifactFetchException.class,
            () -> fileArtifactCache.writeToStagingFileAndDigest(dataStream, stagingPath));
    }

    /**
     * Check that a staging path which cannot be opened is reported as a filesystem failure
     */
    @Test
    public void writeToStagingFileAndDigest_stagingPathIsDirectory() throws Exception {
        Files.createDirectories(stagingPath);

        assertThrows(
            CacheFilesystemException.class,
            () -> fileArtifactCache.writeToStagingFileAndDigest(
                new ByteArrayInputStream(new byte[10]), stagingPath));
    }

    /**
     * Check that a matching outcome passes validation and keeps the staging file
     */
    @Test
    public void validateStagingFile_match() throws Exception {
        Files.write(stagingPath, "abc".getBytes(StandardCharsets.UTF_8));
        DownloadOutcome outcome = new DownloadOutcome(TestDataHarness.SHA256_ABC, 3);

        fileArtifactCache.validateStagingFile(TestDataHarness.SHA256_ABC, outcome, stagingPath);
        assertTrue(Files.exists(stagingPath));
    }

    /**
     * Check that a mismatching outcome deletes the staging file
     */
    @Test
    public void validateStagingFile_mismatchDeletesStagingFile() throws Exception {
        Files.write(stagingPath, "abc".getBytes(StandardCharsets.UTF_8));
        DownloadOutcome outcome = new DownloadOutcome(TestDataHarness.SHA256_ABC, 3);

        assertThrows(
            NonMatchingChecksumException.class,
            () -> fileArtifactCache.validateStagingFile(
                TestDataHarness.SHA256_EMPTY, outcome, stagingPath));
        assertFalse(Files.exists(stagingPath));
    }

    /**
     * Check that move replaces an existing target
     */
    @Test
    public void move_replacesTarget() throws Exception {
        Path target = tempFolder.resolve("prebuild.tar.gz");
        Files.write(target, "old".getBytes(StandardCharsets.UTF_8));
        Files.write(stagingPath, "new".getBytes(StandardCharsets.UTF_8));

        fileArtifactCache.move(stagingPath, target);

        assertFalse(Files.exists(stagingPath));
        assertEquals("new", Files.readString(target));
    }

    /**
     * Check that move fails when the source is missing
     */
    @Test
    public void move_missingSource() {
        Path target = tempFolder.resolve("prebuild.tar.gz");
        assertThrows(
            CacheFilesystemException.class, () -> fileArtifactCache.move(stagingPath, target));
        assertFalse(Files.exists(target));
    }

    /**
     * Check that checkExpectedDigest trims and lower-cases the digest
     */
    @Test
    public void checkExpectedDigest_normalizes() {
        String normalized = fileArtifactCache.checkExpectedDigest(
            " " + TestDataHarness.SHA256_ABC.toUpperCase() + "\n");
        assertEquals(TestDataHarness.SHA256_ABC, normalized);
    }

    /**
     * Check finalPathMatches for a missing, a matching and a stale file
     */
    @Test
    public void finalPathMatches() throws Exception {
        Path finalPath = tempFolder.resolve("prebuild.tar.gz");
        assertFalse(fileArtifactCache.finalPathMatches(TestDataHarness.SHA256_ABC, finalPath));

        Files.write(finalPath, "abc".getBytes(StandardCharsets.UTF_8));
        assertTrue(fileArtifactCache.finalPathMatches(TestDataHarness.SHA256_ABC, finalPath));
        assertFalse(fileArtifactCache.finalPathMatches(TestDataHarness.SHA256_EMPTY, finalPath));
    }
}
