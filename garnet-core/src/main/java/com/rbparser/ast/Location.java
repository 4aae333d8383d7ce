package com.rbparser.ast;

/**
 * A source range. Lines are 1-based, character offsets count UTF-16 code units
 * of the decoded source from its beginning.
 */
public record Location(int startLine, int startChar, int endLine, int endChar) {

    public static Location token(int line, int startChar, int size) {
        return new Location(line, startChar, line, startChar + size);
    }

    /**
     * A zero-width marker for a node whose bounds are only known to its parent.
     */
    public static Location fixed(int line, int charOffset) {
        return new Location(line, charOffset, line, charOffset);
    }

    public Location to(Location other) {
        return new Location(startLine, startChar, Math.max(endLine, other.endLine), other.endChar);
    }

    public boolean contains(Location other) {
        return startChar <= other.startChar && other.endChar <= endChar;
    }

    public boolean isBefore(Location other) {
        return endChar <= other.startChar;
    }

    public int length() {
        return endChar - startChar;
    }
}
