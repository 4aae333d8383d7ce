package com.rbparser;

public class ExpectedTokenException extends ParseException {

    private final Token token;

    public ExpectedTokenException(String message, Token token, int column) {
        super(message + ", found '" + (token.type() == TokenType.EOF ? "end-of-input" : token.value()) + "'",
            token.line(), column);
        this.token = token;
    }

    public Token getToken() {
        return token;
    }
}
