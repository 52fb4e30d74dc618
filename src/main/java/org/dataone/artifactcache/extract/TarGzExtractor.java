package org.dataone.artifactcache.extract;

import java.io.BufferedInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.LinkOption;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.attribute.PosixFilePermission;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;

import org.apache.commons.compress.archivers.tar.TarArchiveEntry;
import org.apache.commons.compress.archivers.tar.TarArchiveInputStream;
import org.apache.commons.compress.compressors.gzip.GzipCompressorInputStream;
import org.apache.commons.logging.Log;
import org.apache.commons.logging.LogFactory;
import org.dataone.artifactcache.exceptions.ExtractException;

/**
 * TarGzExtractor unpacks gzip-compressed tar archives (ex. 'prebuild.tar.gz'). Entries are
 * never written outside the destination directory: leading '/' characters are stripped from
 * absolute names, while entries and symbolic links that would escape the destination are
 * skipped with a warning. Paths are checked both by name and on disk, so a symbolic link
 * created by an earlier entry cannot carry a later entry out of the destination.
 */
public class TarGzExtractor implements ArchiveExtractor {
    private static final Log logTarGzExtractor = LogFactory.getLog(TarGzExtractor.class);
    private static final int OWNER_EXECUTE_MODE = 0100;

    @Override
    public List<String> extract(Path archivePath, Path destinationDirectory)
        throws ExtractException {
        List<String> warnings = new ArrayList<>();
        if (archivePath == null || destinationDirectory == null) {
            throw new ExtractException(
                "Calling Method: extract(): archivePath and destinationDirectory cannot be null.",
                null, warnings);
        }
        logTarGzExtractor.debug("Extracting: " + archivePath + " into: " + destinationDirectory);

        Path destination = destinationDirectory.toAbsolutePath().normalize();
        int entryCount = 0;
        try (InputStream fis = Files.newInputStream(archivePath);
             BufferedInputStream bis = new BufferedInputStream(fis);
             GzipCompressorInputStream gis = new GzipCompressorInputStream(bis);
             TarArchiveInputStream tis = new TarArchiveInputStream(gis)) {
            Files.createDirectories(destination);
            Path realDestination = destination.toRealPath();

            TarArchiveEntry entry;
            while ((entry = tis.getNextEntry()) != null) {
                Path outPath = resolveEntryPath(destination, entry.getName(), warnings);
                if (outPath == null) {
                    continue;
                }
                Path checkedPath = entry.isDirectory() ? outPath : outPath.getParent();
                if (!isInsideOnDisk(realDestination, checkedPath)) {
                    warn(warnings, "Skipping entry reached through a symbolic link outside of "
                        + "the target dir: " + entry.getName());
                    continue;
                }

                if (entry.isDirectory()) {
                    Files.createDirectories(outPath);
                } else if (entry.isSymbolicLink()) {
                    extractSymbolicLink(realDestination, outPath, entry, warnings);
                } else if (entry.isLink() || entry.isCharacterDevice() || entry.isBlockDevice()
                    || entry.isFIFO()) {
                    warn(warnings, "Skipping unsupported entry type for: " + entry.getName());
                    continue;
                } else if (entry.isFile()) {
                    Files.createDirectories(outPath.getParent());
                    Files.copy(tis, outPath, StandardCopyOption.REPLACE_EXISTING);
                    if ((entry.getMode() & OWNER_EXECUTE_MODE) != 0) {
                        markExecutable(outPath, warnings);
                    }
                } else {
                    warn(warnings, "Skipping unsupported entry type for: " + entry.getName());
                    continue;
                }
                entryCount++;
            }

        } catch (IOException ioe) {
            String errMsg = "Unable to extract archive: " + archivePath + " into: " + destination
                + ". " + ioe.getMessage();
            logTarGzExtractor.error(errMsg);
            throw new ExtractException(errMsg, ioe, warnings);
        }

        logTarGzExtractor.debug(
            "Extracted " + entryCount + " entries from: " + archivePath + " with " + warnings
                .size() + " warning(s).");
        return warnings;
    }

    /**
     * Maps an entry name onto a path inside the destination directory.
     *
     * @return The path to write to, or null if the entry must be skipped
     */
    protected static Path resolveEntryPath(Path destination, String entryName, List<String> warnings) {
        String name = entryName;
        if (name.startsWith("/")) {
            while (name.startsWith("/")) {
                name = name.substring(1);
            }
            warn(warnings, "Stripping leading '/' from absolute entry: " + entryName);
        }
        if (name.isEmpty()) {
            return null;
        }

        Path outPath = destination.resolve(name).normalize();
        if (!outPath.startsWith(destination)) {
            warn(warnings, "Skipping entry outside of the target dir: " + entryName);
            return null;
        }
        if (outPath.equals(destination)) {
            return null;
        }
        return outPath;
    }

    /**
     * Determines whether a path lands inside the destination once the symbolic links already
     * on disk are followed. The nearest existing ancestor of the path is resolved to its real
     * location; components below it do not exist yet and are created under that location.
     *
     * @param realDestination Real path of the destination directory
     * @param path            Path about to be created or written to
     * @return True if the path stays inside the destination
     * @throws IOException If the real path of an existing ancestor cannot be determined
     */
    protected static boolean isInsideOnDisk(Path realDestination, Path path)
        throws IOException {
        Path existing = path;
        while (existing != null && !Files.exists(existing, LinkOption.NOFOLLOW_LINKS)) {
            existing = existing.getParent();
        }
        if (existing == null) {
            return false;
        }
        if (Files.isSymbolicLink(existing) && !Files.exists(existing)) {
            // Dangling link, its target is unknown
            return false;
        }
        return existing.toRealPath().startsWith(realDestination);
    }

    private static void extractSymbolicLink(
        Path realDestination, Path outPath, TarArchiveEntry entry, List<String> warnings)
        throws IOException {
        Path linkTarget = outPath.getFileSystem().getPath(entry.getLinkName());
        Files.createDirectories(outPath.getParent());
        Path resolvedTarget = linkTarget.isAbsolute() ? null : resolveLinkTarget(
            outPath.getParent().toRealPath(), linkTarget);
        if (resolvedTarget == null || !resolvedTarget.startsWith(realDestination)) {
            warn(warnings, "Skipping symbolic link pointing outside of the target dir: "
                + entry.getName() + " -> " + entry.getLinkName());
            return;
        }
        Files.deleteIfExists(outPath);
        try {
            Files.createSymbolicLink(outPath, linkTarget);
        } catch (UnsupportedOperationException uoe) {
            warn(warnings, "Symbolic links are not supported here, skipping: " + entry.getName());
        }
    }

    /**
     * Walks a relative link target from the real directory holding the link, following the
     * symbolic links met on the way the same way the filesystem would.
     *
     * @return Where the link would point, or null if that cannot be determined
     */
    private static Path resolveLinkTarget(Path realParent, Path linkTarget) {
        Path current = realParent;
        for (Path part : linkTarget) {
            String name = part.toString();
            if (name.isEmpty() || name.equals(".")) {
                continue;
            }
            if (name.equals("..")) {
                current = current.getParent();
                if (current == null) {
                    return null;
                }
                continue;
            }
            current = current.resolve(name);
            if (Files.isSymbolicLink(current)) {
                try {
                    current = current.toRealPath();
                } catch (IOException ioe) {
                    logTarGzExtractor.debug(
                        "Unable to follow symbolic link: " + current + ". " + ioe.getMessage());
                    return null;
                }
            }
        }
        return current;
    }

    private static void markExecutable(Path path, List<String> warnings) throws IOException {
        if (!Files.getFileStore(path).supportsFileAttributeView("posix")) {
            return;
        }
        Set<PosixFilePermission> permissions = Files.getPosixFilePermissions(path);
        permissions.add(PosixFilePermission.OWNER_EXECUTE);
        try {
            Files.setPosixFilePermissions(path, permissions);
        } catch (SecurityException se) {
            warn(warnings, "Unable to mark as executable: " + path + ". " + se.getMessage());
        }
    }

    private static void warn(List<String> warnings, String warnMsg) {
        logTarGzExtractor.warn(warnMsg);
        warnings.add(warnMsg);
    }
}
