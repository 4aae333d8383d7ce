package com.rbparser.ast;

import java.util.ArrayList;
import java.util.List;

public record MRHS(
    List<Node> parts,
    Location location,
    List<Comment> comments
) implements Node {

    public MRHS(List<Node> parts, Location location) {
        this(parts, location, new ArrayList<>());
    }

    @Override
    public NodeType type() {
        return NodeType.MRHS;
    }

    @Override
    public List<Node> childNodes() {
        return Nodes.of(parts);
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
        return visitor.visitMRHS(this);
    }
}
