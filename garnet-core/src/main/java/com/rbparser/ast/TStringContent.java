package com.rbparser.ast;

import java.util.ArrayList;
import java.util.List;

/**
 * Raw source text inside a string-like literal, escapes untouched.
 */
public record TStringContent(
    String value,
    Location location,
    List<Comment> comments
) implements Node {

    public TStringContent(String value, Location location) {
        this(value, location, new ArrayList<>());
    }

    @Override
    public NodeType type() {
        return NodeType.TSTRING_CONTENT;
    }

    @Override
    public List<Node> childNodes() {
        return List.of();
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
        return visitor.visitTStringContent(this);
    }
}
