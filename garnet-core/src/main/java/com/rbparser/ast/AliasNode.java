package com.rbparser.ast;

import java.util.ArrayList;
import java.util.List;

public record AliasNode(
    Node left,
    Node right,
    Location location,
    List<Comment> comments
) implements Node {

    public AliasNode(Node left, Node right, Location location) {
        this(left, right, location, new ArrayList<>());
    }

    @Override
    public NodeType type() {
        return NodeType.ALIAS_NODE;
    }

    @Override
    public List<Node> childNodes() {
        return Nodes.of(left, right);
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
        return visitor.visitAliasNode(this);
    }
}
