package com.rbparser;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class LexerTest {

    @Test
    void simpleAssignment() {
        List<Token> tokens = Lexer.tokenize("x = 1");
        assertEquals(TokenType.IDENTIFIER, tokens.get(0).type());
        assertEquals("x", tokens.get(0).value());
        assertTrue(tokens.get(1).isOp("="));
        assertEquals(TokenType.INTEGER, tokens.get(2).type());
        assertEquals("1", tokens.get(2).value());
        assertEquals(TokenType.EOF, tokens.get(tokens.size() - 1).type());
    }

    @Test
    void keywordsAreRecognised() {
        List<Token> tokens = Lexer.tokenize("if a then b end");
        assertTrue(tokens.get(0).isKeyword("if"));
        assertTrue(tokens.get(2).isKeyword("then"));
        assertTrue(tokens.get(4).isKeyword("end"));
    }

    @Test
    void columnsAreBytes() {
        List<Token> tokens = Lexer.tokenize("\"é\" + y");
        Token y = tokens.get(tokens.size() - 2);
        assertEquals("y", y.value());
        assertEquals(7, y.column());
    }

    @Test
    void unterminatedStringFails() {
        assertThrows(ParseException.class, () -> Lexer.tokenize("'abc"));
    }
}
