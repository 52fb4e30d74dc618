package org.dataone.artifactcache;

import java.nio.file.Path;

/**
 * CachePaths is a record that holds the two files owned by the pipeline: the final path of the
 * verified artifact and the staging path an in-flight download is written to. A file at the
 * staging path is never treated as valid.
 */
public record CachePaths(Path finalPath, Path stagingPath) {
    public static final String DEFAULT_FINAL_FILE_NAME = "prebuild.tar.gz";
    public static final String DEFAULT_STAGING_FILE_NAME = "unverified-prebuild.tmp";

    public CachePaths {
        if (finalPath == null || stagingPath == null) {
            throw new IllegalArgumentException(
                "Calling Method: CachePaths(): finalPath and stagingPath cannot be null.");
        }
        if (finalPath.toAbsolutePath().normalize().equals(
            stagingPath.toAbsolutePath().normalize())) {
            throw new IllegalArgumentException(
                "Calling Method: CachePaths(): stagingPath must differ from finalPath: "
                    + finalPath);
        }
    }

    /**
     * Get the default layout inside an install root: 'prebuild.tar.gz' for the verified
     * artifact and 'unverified-prebuild.tmp' for downloads in progress.
     *
     * @param installRoot Directory holding both files
     * @return CachePaths inside the given directory
     */
    public static CachePaths inDirectory(Path installRoot) {
        return new CachePaths(
            installRoot.resolve(DEFAULT_FINAL_FILE_NAME),
            installRoot.resolve(DEFAULT_STAGING_FILE_NAME)
        );
    }
}
