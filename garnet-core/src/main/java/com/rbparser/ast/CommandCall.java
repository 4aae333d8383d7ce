package com.rbparser.ast;

import java.util.ArrayList;
import java.util.List;

public record CommandCall(
    Node receiver,
    Node operator,
    Node message,
    Args arguments,
    BlockNode block,
    Location location,
    List<Comment> comments
) implements Node {

    public CommandCall(Node receiver, Node operator, Node message, Args arguments, BlockNode block, Location location) {
        this(receiver, operator, message, arguments, block, location, new ArrayList<>());
    }

    @Override
    public NodeType type() {
        return NodeType.COMMAND_CALL;
    }

    @Override
    public List<Node> childNodes() {
        return Nodes.of(receiver, operator, message, arguments, block);
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
        return visitor.visitCommandCall(this);
    }
}
