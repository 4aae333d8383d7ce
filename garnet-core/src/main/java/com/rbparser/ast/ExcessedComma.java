package com.rbparser.ast;

import java.util.ArrayList;
import java.util.List;

/**
 * The trailing comma in block parameters such as {@code |a,|}.
 */
public record ExcessedComma(
    String value,
    Location location,
    List<Comment> comments
) implements Node {

    public ExcessedComma(String value, Location location) {
        this(value, location, new ArrayList<>());
    }

    @Override
    public NodeType type() {
        return NodeType.EXCESSED_COMMA;
    }

    @Override
    public List<Node> childNodes() {
        return List.of();
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
        return visitor.visitExcessedComma(this);
    }
}
