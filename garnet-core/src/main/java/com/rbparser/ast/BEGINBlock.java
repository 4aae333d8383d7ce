package com.rbparser.ast;

import java.util.ArrayList;
import java.util.List;

public record BEGINBlock(
    LBrace lbrace,
    Statements statements,
    Location location,
    List<Comment> comments
) implements Node {

    public BEGINBlock(LBrace lbrace, Statements statements, Location location) {
        this(lbrace, statements, location, new ArrayList<>());
    }

    @Override
    public NodeType type() {
        return NodeType.BEGIN_BLOCK;
    }

    @Override
    public List<Node> childNodes() {
        return Nodes.of(lbrace, statements);
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
        return visitor.visitBEGINBlock(this);
    }
}
