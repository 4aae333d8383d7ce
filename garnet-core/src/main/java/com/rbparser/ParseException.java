package com.rbparser;

/**
 * The only error reported by parsing: lexer errors, unexpected tokens and
 * missing expected tokens. Line is 1-based, column counts characters.
 */
public class ParseException extends RuntimeException {

    private final int line;
    private final int column;

    public ParseException(String message, int line, int column) {
        super(message + " at line " + line + ", column " + column);
        this.line = line;
        this.column = column;
    }

    public int getLine() {
        return line;
    }

    public int getColumn() {
        return column;
    }
}
