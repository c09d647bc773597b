package com.raditha.cyclone.parser;

import java.util.Arrays;

/**
 * Converts 1-indexed (line, column) positions into character offsets.
 * Recognises \n, \r\n and \r as line terminators, like JavaParser does.
 */
final class LineOffsets {

    private final int[] lineStarts;
    private final int length;

    LineOffsets(String text) {
        int[] starts = new int[16];
        int count = 0;
        starts[count++] = 0;
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            boolean terminator = c == '\n' || (c == '\r' && (i + 1 >= text.length() || text.charAt(i + 1) != '\n'));
            if (terminator) {
                if (count == starts.length) {
                    starts = Arrays.copyOf(starts, count * 2);
                }
                starts[count++] = i + 1;
            }
        }
        this.lineStarts = Arrays.copyOf(starts, count);
        this.length = text.length();
    }

    /**
     * Offset of the character at the given position, clamped to the text.
     */
    int offsetOf(int line, int column) {
        if (line < 1) {
            return 0;
        }
        if (line > lineStarts.length) {
            return length;
        }
        int offset = lineStarts[line - 1] + Math.max(column, 1) - 1;
        return Math.min(offset, length);
    }
}
