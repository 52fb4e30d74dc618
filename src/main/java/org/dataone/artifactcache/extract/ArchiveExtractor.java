package org.dataone.artifactcache.extract;

import java.nio.file.Path;
import java.util.List;

import org.dataone.artifactcache.exceptions.ExtractException;

/**
 * ArchiveExtractor unpacks an archive whose integrity has already been verified. Problems with
 * individual entries that do not prevent the rest of the archive from being used are returned
 * as warnings instead of failing the extraction.
 */
public interface ArchiveExtractor {
    /**
     * Extract the given archive into a directory.
     *
     * @param archivePath          Verified archive file
     * @param destinationDirectory Directory to unpack into, created if missing
     * @return Warnings raised while extracting, empty if there were none
     * @throws ExtractException If the archive cannot be read or an entry cannot be written
     */
    List<String> extract(Path archivePath, Path destinationDirectory) throws ExtractException;
}
