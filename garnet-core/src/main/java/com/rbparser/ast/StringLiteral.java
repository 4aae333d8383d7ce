package com.rbparser.ast;

import java.util.ArrayList;
import java.util.List;

/**
 * A string literal; {@code quote} is the opening delimiter as written.
 */
public record StringLiteral(
    List<Node> parts,
    String quote,
    Location location,
    List<Comment> comments
) implements Node {

    public StringLiteral(List<Node> parts, String quote, Location location) {
        this(parts, quote, location, new ArrayList<>());
    }

    @Override
    public NodeType type() {
        return NodeType.STRING_LITERAL;
    }

    @Override
    public List<Node> childNodes() {
        return Nodes.of(parts);
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
        return visitor.visitStringLiteral(this);
    }
}
