package com.rbparser.ast;

import java.util.ArrayList;
import java.util.List;

public record MLHSParen(
    Node contents,
    boolean comma,
    Location location,
    List<Comment> comments
) implements Node {

    public MLHSParen(Node contents, boolean comma, Location location) {
        this(contents, comma, location, new ArrayList<>());
    }

    @Override
    public NodeType type() {
        return NodeType.MLHS_PAREN;
    }

    @Override
    public List<Node> childNodes() {
        return Nodes.of(contents);
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
        return visitor.visitMLHSParen(this);
    }
}
