package org.dataone.artifactcache.filecache;

import org.apache.commons.logging.Log;
import org.apache.commons.logging.LogFactory;
import org.dataone.artifactcache.exceptions.CacheFilesystemException;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Properties;

/**
 * FileArtifactCacheUtility is a utility class that encapsulates generic or shared functionality
 * in FileArtifactCache and/or related classes.
 */
public class FileArtifactCacheUtility {

    private static final Log log = LogFactory.getLog(FileArtifactCacheUtility.class);

    /**
     * Checks whether a given object is null and throws an exception if so
     *
     * @param object   Object to check
     * @param argument Value that is being checked
     * @param method   Calling method or class
     * @throws IllegalArgumentException If the object is null
     */
    public static void ensureNotNull(Object object, String argument, String method)
        throws IllegalArgumentException {
        if (object == null) {
            String errMsg = "Calling Method: " + method + "(): " + argument + " cannot be null.";
            throw new IllegalArgumentException(errMsg);
        }
    }

    /**
     * Checks whether a given string is empty or contains illegal characters, and throws an
     * exception if so
     *
     * @param string   String to check
     * @param argument Value that is being checked
     * @param method   Calling method
     * @throws IllegalArgumentException If the string is empty or contains illegal characters
     */
    public static void checkForEmptyAndValidString(String string, String argument, String method)
        throws IllegalArgumentException {
        ensureNotNull(string, argument, method);
        if (string.trim().isEmpty()) {
            String errMsg = "Calling Method: " + method + "(): " + argument + " cannot be empty.";
            throw new IllegalArgumentException(errMsg);
        }
        if (!isValidString(string)) {
            String errMsg = "Calling Method: " + method + "(): " + argument
                + " contains empty white spaces, tabs or newlines.";
            throw new IllegalArgumentException(errMsg);
        }
    }

    /**
     * Iterates over a given string and checks each character to make sure that there are no
     * whitespaces, tabs, new lines or other illegal characters.
     * @param string String to check
     * @return True if valid, False if illegal characters found.
     */
    public static boolean isValidString(String string) {
        boolean valid = true;
        for (int i = 0; i < string.length(); i++) {
            char ch = string.charAt(i);
            if (Character.isWhitespace(ch)) {
                valid = false;
                break;
            }
        }
        return valid;
    }

    /**
     * Reads an integer property, falling back to a default when the key is absent.
     *
     * @param properties   Properties to read from
     * @param key          Property name
     * @param defaultValue Value used when the property is absent or blank
     * @param minimum      Smallest accepted value
     * @return The parsed value
     * @throws IllegalArgumentException If the value is not an integer or is below the minimum
     */
    public static int getIntProperty(
        Properties properties, String key, int defaultValue, int minimum)
        throws IllegalArgumentException {
        String value = properties.getProperty(key);
        if (value == null || value.trim().isEmpty()) {
            return defaultValue;
        }
        int parsed;
        try {
            parsed = Integer.parseInt(value.trim());
        } catch (NumberFormatException nfe) {
            String errMsg = "Property " + key + " must be an integer. Found: " + value;
            throw new IllegalArgumentException(errMsg, nfe);
        }
        if (parsed < minimum) {
            String errMsg = "Property " + key + " must be >= " + minimum + ". Found: " + parsed;
            throw new IllegalArgumentException(errMsg);
        }
        return parsed;
    }

    /**
     * Creates the parent directory of the given file if it does not exist yet.
     *
     * @param file File whose parent directory is required
     * @throws CacheFilesystemException If the directory cannot be created
     */
    public static void createParentDirectories(Path file) throws CacheFilesystemException {
        Path parent = file.toAbsolutePath().getParent();
        if (parent == null || Files.isDirectory(parent)) {
            return;
        }
        try {
            Files.createDirectories(parent);
            log.debug("Created directory: " + parent);

        } catch (IOException ioe) {
            String errMsg = "Unable to create directory: " + parent + ". " + ioe.getMessage();
            log.error(errMsg);
            throw new CacheFilesystemException(errMsg, ioe);
        }
    }

    /**
     * Delete a file if it exists. A failure is logged and reported through the return value
     * rather than thrown, so that the exception which triggered the cleanup is not masked.
     *
     * @param path File to delete
     * @return True if the file no longer exists
     */
    public static boolean deleteIfPresent(Path path) {
        ensureNotNull(path, "path", "deleteIfPresent");
        try {
            Files.deleteIfExists(path);
            return true;

        } catch (IOException ioe) {
            String warnMsg = "Attempted to delete file: " + path + " but failed."
                + " Additional Details: " + ioe.getMessage();
            log.warn(warnMsg);
            return false;
        }
    }
}
