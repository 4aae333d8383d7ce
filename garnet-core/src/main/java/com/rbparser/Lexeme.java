package com.rbparser;

import com.rbparser.ast.Location;

/**
 * A ledger entry: a keyword, operator or delimiter together with its resolved
 * location.
 */
public record Lexeme(TokenType type, String value, Location location) {
}
