package com.rbparser.ast;

import java.util.ArrayList;
import java.util.List;

public record HashLiteral(
    LBrace lbrace,
    List<Node> assocs,
    Location location,
    List<Comment> comments
) implements Node {

    public HashLiteral(LBrace lbrace, List<Node> assocs, Location location) {
        this(lbrace, assocs, location, new ArrayList<>());
    }

    @Override
    public NodeType type() {
        return NodeType.HASH_LITERAL;
    }

    @Override
    public List<Node> childNodes() {
        return Nodes.of(lbrace, assocs);
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
        return visitor.visitHashLiteral(this);
    }
}
