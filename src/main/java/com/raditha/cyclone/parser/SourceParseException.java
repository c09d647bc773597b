package com.raditha.cyclone.parser;

/**
 * Thrown when a source file cannot be turned into a syntax tree.
 */
public class SourceParseException extends Exception {

    private final String fileId;
    private final int offset;
    private final int line;

    public SourceParseException(String fileId, int offset, int line, String message) {
        super(message);
        this.fileId = fileId;
        this.offset = offset;
        this.line = line;
    }

    public SourceParseException(String fileId, int offset, int line, String message, Throwable cause) {
        super(message, cause);
        this.fileId = fileId;
        this.offset = offset;
        this.line = line;
    }

    public String getFileId() {
        return fileId;
    }

    public int getOffset() {
        return offset;
    }

    public int getLine() {
        return line;
    }
}
