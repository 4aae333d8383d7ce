package com.rbparser.ast;

import java.util.ArrayList;
import java.util.List;

public record Paren(
    LParen lparen,
    Node contents,
    Location location,
    List<Comment> comments
) implements Node {

    public Paren(LParen lparen, Node contents, Location location) {
        this(lparen, contents, location, new ArrayList<>());
    }

    @Override
    public NodeType type() {
        return NodeType.PAREN;
    }

    @Override
    public List<Node> childNodes() {
        return Nodes.of(lparen, contents);
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
        return visitor.visitParen(this);
    }
}
