package com.rbparser.ast;

import java.util.ArrayList;
import java.util.List;

public record ENDBlock(
    LBrace lbrace,
    Statements statements,
    Location location,
    List<Comment> comments
) implements Node {

    public ENDBlock(LBrace lbrace, Statements statements, Location location) {
        this(lbrace, statements, location, new ArrayList<>());
    }

    @Override
    public NodeType type() {
        return NodeType.END_BLOCK;
    }

    @Override
    public List<Node> childNodes() {
        return Nodes.of(lbrace, statements);
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
        return visitor.visitENDBlock(this);
    }
}
