package com.raditha.cyclone.model;

import java.util.Locale;

/**
 * A file that could not be parsed and was excluded from analysis.
 *
 * @param repositoryId Repository containing the file
 * @param fileId       File identifier
 * @param offset       Character offset of the first problem (0 if unknown)
 * @param line         Line of the first problem (0 if unknown)
 * @param message      Parser message
 */
public record ParseError(
        String repositoryId,
        String fileId,
        int offset,
        int line,
        String message) {

    public String toDisplayString() {
        return String.format(Locale.ROOT, "%s/%s @%d (line %d): %s", repositoryId, fileId, offset, line, message);
    }
}
