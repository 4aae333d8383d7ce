package com.rbparser.ast;

import java.util.ArrayList;
import java.util.List;

public record MethodAddBlock(
    Node call,
    BlockNode block,
    Location location,
    List<Comment> comments
) implements Node {

    public MethodAddBlock(Node call, BlockNode block, Location location) {
        this(call, block, location, new ArrayList<>());
    }

    @Override
    public NodeType type() {
        return NodeType.METHOD_ADD_BLOCK;
    }

    @Override
    public List<Node> childNodes() {
        return Nodes.of(call, block);
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
        return visitor.visitMethodAddBlock(this);
    }
}
