package com.rbparser.ast;

import java.util.ArrayList;
import java.util.List;

public record Word(
    List<Node> parts,
    Location location,
    List<Comment> comments
) implements Node {

    public Word(List<Node> parts, Location location) {
        this(parts, location, new ArrayList<>());
    }

    @Override
    public NodeType type() {
        return NodeType.WORD;
    }

    @Override
    public List<Node> childNodes() {
        return Nodes.of(parts);
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
        return visitor.visitWord(this);
    }
}
