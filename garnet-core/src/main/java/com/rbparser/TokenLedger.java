package com.rbparser;

import com.rbparser.ast.Location;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Supplier;

/**
 * Keywords, operators and delimiters seen by the lexer that no production has
 * claimed yet. Productions reduce bottom-up, so the token a production owns is
 * the most recently recorded match and searches run from the end.
 */
public final class TokenLedger {

    private final List<Lexeme> entries = new ArrayList<>();
    private final LineIndex lineIndex;
    private final Supplier<Location> position;

    public TokenLedger(LineIndex lineIndex, Supplier<Location> position) {
        this.lineIndex = lineIndex;
        this.position = position;
    }

    public void record(Lexeme lexeme) {
        entries.add(lexeme);
    }

    /**
     * Removes and returns the rightmost entry of the given type whose value
     * equals {@code value}, or any value when {@code value} is null.
     *
     * @throws ParseException when there is no such entry
     */
    public Lexeme consume(TokenType type, String value) {
        int index = indexOf(type, value);
        if (index < 0) {
            throw missing(type, value, null);
        }
        return entries.remove(index);
    }

    public Lexeme consume(TokenType type, String value, Location hint) {
        int index = indexOf(type, value);
        if (index < 0) {
            throw missing(type, value, hint);
        }
        return entries.remove(index);
    }

    /**
     * Returns the rightmost matching entry without removing it, or null.
     */
    public Lexeme find(TokenType type, String value) {
        int index = indexOf(type, value);
        return index < 0 ? null : entries.get(index);
    }

    /**
     * Removes the entry of the given type that starts at {@code startChar}. Used
     * when the grammar already holds the token itself.
     */
    public Lexeme consumeAt(TokenType type, int startChar) {
        for (int i = entries.size() - 1; i >= 0; i--) {
            Lexeme lexeme = entries.get(i);
            if (lexeme.type() == type && lexeme.location().startChar() == startChar) {
                return entries.remove(i);
            }
        }
        throw missing(type, null, null);
    }

    public Lexeme consumeKeyword(String keyword) {
        return consume(TokenType.KEYWORD, keyword);
    }

    public Lexeme consumeOperator(String operator) {
        return consume(TokenType.OP, operator);
    }

    /**
     * Removes an optional token that lies between two offsets, such as the
     * {@code then} of an {@code if} or the {@code do} of a {@code while}. Returns
     * null when there is none.
     */
    public Lexeme consumeBetween(TokenType type, String value, int afterChar, int beforeChar) {
        for (int i = entries.size() - 1; i >= 0; i--) {
            Lexeme lexeme = entries.get(i);
            Location location = lexeme.location();
            if (location.startChar() < afterChar) {
                break;
            }
            if (lexeme.type() == type && lexeme.value().equals(value) && location.endChar() <= beforeChar) {
                return entries.remove(i);
            }
        }
        return null;
    }

    public boolean isEmpty() {
        return entries.isEmpty();
    }

    public int size() {
        return entries.size();
    }

    private int indexOf(TokenType type, String value) {
        for (int i = entries.size() - 1; i >= 0; i--) {
            Lexeme lexeme = entries.get(i);
            if (lexeme.type() == type && (value == null || lexeme.value().equals(value))) {
                return i;
            }
        }
        return -1;
    }

    private ParseException missing(TokenType type, String value, Location hint) {
        String kind = value != null ? value : type.name().toLowerCase();
        Location location = hint != null ? hint : position.get();
        return new ParseException(
            "Cannot find expected " + kind, location.startLine(), lineIndex.column(location.startChar()));
    }
}
