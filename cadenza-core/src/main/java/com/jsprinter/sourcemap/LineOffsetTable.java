package com.jsprinter.sourcemap;

import java.util.Arrays;

/**
 * Converts offsets in a source text to zero-based line and column numbers.
 */
public final class LineOffsetTable {
    private final int[] lineStarts;
    private final int length;

    public LineOffsetTable(CharSequence source) {
        int[] starts = new int[16];
        int count = 1;
        for (int i = 0; i < source.length(); i++) {
            char c = source.charAt(i);
            boolean lineBreak = c == '\n'
                || (c == '\r' && (i + 1 >= source.length() || source.charAt(i + 1) != '\n'));
            if (lineBreak) {
                if (count == starts.length) {
                    starts = Arrays.copyOf(starts, count * 2);
                }
                starts[count++] = i + 1;
            }
        }
        this.lineStarts = Arrays.copyOf(starts, count);
        this.length = source.length();
    }

    public int lineCount() {
        return lineStarts.length;
    }

    public int line(int offset) {
        int clamped = Math.min(Math.max(offset, 0), length);
        int index = Arrays.binarySearch(lineStarts, clamped);
        // binarySearch returns (-(insertion point) - 1) when the offset is inside a line
        return index >= 0 ? index : -index - 2;
    }

    public int column(int offset) {
        int clamped = Math.min(Math.max(offset, 0), length);
        return clamped - lineStarts[line(clamped)];
    }
}
