package com.rbparser.ast;

import java.util.ArrayList;
import java.util.List;

/**
 * An array pattern, with or without brackets or a constant.
 */
public record AryPtn(
    Node constant,
    List<Node> requireds,
    VarField rest,
    List<Node> posts,
    Location location,
    List<Comment> comments
) implements Node {

    public AryPtn(Node constant, List<Node> requireds, VarField rest, List<Node> posts, Location location) {
        this(constant, requireds, rest, posts, location, new ArrayList<>());
    }

    @Override
    public NodeType type() {
        return NodeType.ARY_PTN;
    }

    @Override
    public List<Node> childNodes() {
        return Nodes.of(constant, requireds, rest, posts);
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
        return visitor.visitAryPtn(this);
    }
}
