package com.rbparser;

/**
 * A raw token as reported by the {@link Lexer}. The column counts bytes of the
 * UTF-8 encoded line.
 */
public record Token(TokenType type, String value, int line, int column, boolean spaceBefore) {

    public boolean is(TokenType type, String value) {
        return this.type == type && this.value.equals(value);
    }

    public boolean isKeyword(String keyword) {
        return type == TokenType.KEYWORD && value.equals(keyword);
    }

    public boolean isOp(String op) {
        return type == TokenType.OP && value.equals(op);
    }

    @Override
    public String toString() {
        return type + "(" + value.replace("\n", "\\n") + ")@" + line + ":" + column;
    }
}
