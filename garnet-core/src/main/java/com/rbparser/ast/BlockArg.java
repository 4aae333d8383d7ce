package com.rbparser.ast;

import java.util.ArrayList;
import java.util.List;

public record BlockArg(
    Ident name,
    Location location,
    List<Comment> comments
) implements Node {

    public BlockArg(Ident name, Location location) {
        this(name, location, new ArrayList<>());
    }

    @Override
    public NodeType type() {
        return NodeType.BLOCK_ARG;
    }

    @Override
    public List<Node> childNodes() {
        return Nodes.of(name);
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
        return visitor.visitBlockArg(this);
    }
}
