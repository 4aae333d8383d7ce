package com.rbparser.ast;

import java.util.ArrayList;
import java.util.List;

/**
 * The left side of a multiple assignment. {@code comma} records a trailing comma.
 */
public record MLHS(
    List<Node> parts,
    boolean comma,
    Location location,
    List<Comment> comments
) implements Node {

    public MLHS(List<Node> parts, boolean comma, Location location) {
        this(parts, comma, location, new ArrayList<>());
    }

    @Override
    public NodeType type() {
        return NodeType.MLHS;
    }

    @Override
    public List<Node> childNodes() {
        return Nodes.of(parts);
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
        return visitor.visitMLHS(this);
    }
}
