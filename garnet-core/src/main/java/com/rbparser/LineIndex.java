package com.rbparser;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Translates the lexer's (line, byte column) positions into character offsets.
 * Lines made only of single-byte characters answer with arithmetic; any other
 * line keeps a per-byte lookup table.
 */
public final class LineIndex {

    private sealed interface Line permits SingleByteLine, MultiByteLine {
        int start();

        int charOffset(int byteColumn);
    }

    private record SingleByteLine(int start) implements Line {
        @Override
        public int charOffset(int byteColumn) {
            return start + byteColumn;
        }
    }

    private record MultiByteLine(int start, int[] offsets) implements Line {
        @Override
        public int charOffset(int byteColumn) {
            if (byteColumn >= offsets.length) {
                return start + offsets[offsets.length - 1] + (byteColumn - offsets.length + 1);
            }
            return start + offsets[byteColumn];
        }
    }

    private final String source;
    private final List<Line> lines = new ArrayList<>();
    private final int[] lineStarts;

    public LineIndex(String source) {
        this.source = source;
        int start = 0;
        while (true) {
            int newline = source.indexOf('\n', start);
            int end = newline < 0 ? source.length() : newline + 1;
            lines.add(index(start, end));
            if (newline < 0) {
                break;
            }
            start = end;
        }
        this.lineStarts = lines.stream().mapToInt(Line::start).toArray();
    }

    private Line index(int start, int end) {
        boolean ascii = true;
        for (int i = start; i < end; i++) {
            if (source.charAt(i) >= 0x80) {
                ascii = false;
                break;
            }
        }
        if (ascii) {
            return new SingleByteLine(start);
        }

        int[] offsets = new int[Utf8.byteLength(source, start, end) + 1];
        int position = 0;
        int i = start;
        while (i < end) {
            char c = source.charAt(i);
            int chars = Character.isHighSurrogate(c) && i + 1 < end ? 2 : 1;
            int bytes = Utf8.byteLength(source, i, i + chars);
            for (int b = 0; b < bytes; b++) {
                offsets[position++] = i - start;
            }
            i += chars;
        }
        offsets[position] = end - start;
        return new MultiByteLine(start, offsets);
    }

    /**
     * Character offset of a byte column on a 1-based line. A negative column
     * (from a byte-order mark) clamps to the start of the line.
     */
    public int charOffset(int line, int byteColumn) {
        Line entry = lines.get(Math.min(Math.max(line, 1), lines.size()) - 1);
        return entry.charOffset(Math.max(byteColumn, 0));
    }

    public int lineOf(int charOffset) {
        int found = Arrays.binarySearch(lineStarts, charOffset);
        if (found >= 0) {
            return found + 1;
        }
        return Math.max(-found - 1, 1);
    }

    public int lineStart(int line) {
        return lineStarts[line - 1];
    }

    public int lineCount() {
        return lines.size();
    }

    /**
     * Character column of an offset within its line.
     */
    public int column(int charOffset) {
        return charOffset - lineStart(lineOf(charOffset));
    }
}
