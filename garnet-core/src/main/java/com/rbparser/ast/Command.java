package com.rbparser.ast;

import java.util.ArrayList;
import java.util.List;

/**
 * A method call without receiver whose arguments are not parenthesized.
 */
public record Command(
    Node message,
    Args arguments,
    BlockNode block,
    Location location,
    List<Comment> comments
) implements Node {

    public Command(Node message, Args arguments, BlockNode block, Location location) {
        this(message, arguments, block, location, new ArrayList<>());
    }

    @Override
    public NodeType type() {
        return NodeType.COMMAND;
    }

    @Override
    public List<Node> childNodes() {
        return Nodes.of(message, arguments, block);
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
        return visitor.visitCommand(this);
    }
}
