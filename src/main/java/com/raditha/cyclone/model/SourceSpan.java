package com.raditha.cyclone.model;

/**
 * A region of one source file, in character offsets and line numbers.
 *
 * @param fileId      Identifier of the file within its repository
 * @param startOffset Offset of the first character (0-indexed, inclusive)
 * @param endOffset   Offset after the last character (exclusive)
 * @param startLine   Starting line number (1-indexed)
 * @param endLine     Ending line number (1-indexed, inclusive)
 */
public record SourceSpan(
        String fileId,
        int startOffset,
        int endOffset,
        int startLine,
        int endLine) {

    /**
     * Number of characters covered by this span.
     */
    public int length() {
        return endOffset - startOffset;
    }

    /**
     * Get total number of lines in this span.
     */
    public int getLineCount() {
        return endLine - startLine + 1;
    }

    /**
     * True if both spans are in the same file and share at least one character.
     * Nested spans overlap.
     */
    public boolean overlaps(SourceSpan other) {
        return fileId.equals(other.fileId)
                && startOffset < other.endOffset
                && other.startOffset < endOffset;
    }

    /**
     * True if {@code other} lies completely inside this span.
     */
    public boolean contains(SourceSpan other) {
        return fileId.equals(other.fileId)
                && startOffset <= other.startOffset
                && other.endOffset <= endOffset;
    }

    /**
     * Smallest span covering both spans. Both must be in the same file.
     */
    public SourceSpan union(SourceSpan other) {
        if (!fileId.equals(other.fileId)) {
            throw new IllegalArgumentException(
                    "Cannot merge spans of different files: " + fileId + " and " + other.fileId);
        }
        return new SourceSpan(
                fileId,
                Math.min(startOffset, other.startOffset),
                Math.max(endOffset, other.endOffset),
                Math.min(startLine, other.startLine),
                Math.max(endLine, other.endLine));
    }

    /**
     * Format as "L45-52" for display.
     */
    public String toDisplayString() {
        if (startLine == endLine) {
            return "L" + startLine;
        }
        return "L" + startLine + "-" + endLine;
    }

    @Override
    public String toString() {
        return fileId + ":" + toDisplayString();
    }
}
