package com.rbparser.ast;

import java.util.List;

/**
 * What the finalize operations ({@link Statements#bind}, {@link BodyStmt#bind},
 * {@link Rescue#bindEnd}) need from the parse in progress.
 */
public interface SourceContext {

    String source();

    int lineOf(int charOffset);

    /**
     * Comments collected so far that no statement list has claimed.
     */
    List<Comment> pendingComments();

    /**
     * Where the statements after {@code charOffset} start. When the rest of the
     * line holds only a comment, statements start at the end of that line so the
     * comment stays with whatever precedes it.
     */
    default int nextStatementStart(int charOffset) {
        String source = source();
        int position = charOffset;
        while (position < source.length() && source.charAt(position) == ' ') {
            position++;
        }
        if (position < source.length() && source.charAt(position) == '#') {
            int newline = source.indexOf('\n', position);
            return newline < 0 ? source.length() : newline;
        }
        return charOffset;
    }

    default Location range(int startChar, int endChar) {
        return new Location(lineOf(startChar), startChar, lineOf(endChar), endChar);
    }
}
