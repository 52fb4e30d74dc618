package org.dataone.artifactcache.exceptions;

import java.io.IOException;
import java.util.Collections;
import java.util.List;

/**
 * An exception thrown when a verified archive cannot be extracted. Warnings raised before the
 * failure are kept so they can be reported alongside the error.
 */
public class ExtractException extends IOException {

    private final List<String> warnings;

    public ExtractException(String message, Throwable cause, List<String> warnings) {
        super(message, cause);
        this.warnings = warnings == null ? Collections.emptyList() : List.copyOf(warnings);
    }

    public List<String> getWarnings() {
        return warnings;
    }
}
