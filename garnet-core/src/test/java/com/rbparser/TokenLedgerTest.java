package com.rbparser;

import com.rbparser.ast.Location;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class TokenLedgerTest {

    private TokenLedger ledger;

    @BeforeEach
    void setUp() {
        ledger = new TokenLedger(new LineIndex("if a then if b then c end end"), () -> Location.fixed(1, 0));
    }

    private Lexeme keyword(String value, int start) {
        return new Lexeme(TokenType.KEYWORD, value, Location.token(1, start, value.length()));
    }

    @Test
    void consumesTheRightmostMatch() {
        ledger.record(keyword("if", 0));
        ledger.record(keyword("if", 10));

        assertEquals(10, ledger.consumeKeyword("if").location().startChar());
        assertEquals(0, ledger.consumeKeyword("if").location().startChar());
        assertTrue(ledger.isEmpty());
    }

    @Test
    void nullValueMatchesAnyValueOfTheType() {
        ledger.record(keyword("then", 5));
        ledger.record(new Lexeme(TokenType.OP, "+", Location.token(1, 8, 1)));

        assertEquals("then", ledger.consume(TokenType.KEYWORD, null).value());
        assertEquals(1, ledger.size());
    }

    @Test
    void findDoesNotRemove() {
        ledger.record(keyword("end", 21));
        assertNotNull(ledger.find(TokenType.KEYWORD, "end"));
        assertNull(ledger.find(TokenType.KEYWORD, "then"));
        assertEquals(1, ledger.size());
    }

    @Test
    void consumeBetweenOnlyLooksInsideTheRange() {
        ledger.record(keyword("then", 5));
        ledger.record(keyword("then", 15));

        assertNull(ledger.consumeBetween(TokenType.KEYWORD, "then", 20, 25));
        Lexeme found = ledger.consumeBetween(TokenType.KEYWORD, "then", 12, 20);
        assertEquals(15, found.location().startChar());
        assertEquals(1, ledger.size());
    }

    @Test
    void consumeAtMatchesStartOffset() {
        ledger.record(keyword("end", 21));
        ledger.record(keyword("end", 25));
        assertEquals(21, ledger.consumeAt(TokenType.KEYWORD, 21).location().startChar());
    }

    @Test
    void missingTokenIsAParseError() {
        ParseException error = assertThrows(ParseException.class, () -> ledger.consumeKeyword("end"));
        assertTrue(error.getMessage().contains("end"));
        assertEquals(1, error.getLine());
    }
}
