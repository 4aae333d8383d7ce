package com.rbparser.ast;

import java.util.ArrayList;
import java.util.List;

/**
 * A character literal such as {@code ?a}.
 */
public record CharLiteral(
    String value,
    Location location,
    List<Comment> comments
) implements Node {

    public CharLiteral(String value, Location location) {
        this(value, location, new ArrayList<>());
    }

    @Override
    public NodeType type() {
        return NodeType.CHAR_LITERAL;
    }

    @Override
    public List<Node> childNodes() {
        return List.of();
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
        return visitor.visitCharLiteral(this);
    }
}
