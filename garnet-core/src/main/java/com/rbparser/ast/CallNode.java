package com.rbparser.ast;

import java.util.ArrayList;
import java.util.List;

/**
 * A method call. The message is null for {@code foo.()}; the arguments are an {@link ArgParen} or null.
 */
public record CallNode(
    Node receiver,
    Node operator,
    Node message,
    Node arguments,
    Location location,
    List<Comment> comments
) implements Node {

    public CallNode(Node receiver, Node operator, Node message, Node arguments, Location location) {
        this(receiver, operator, message, arguments, location, new ArrayList<>());
    }

    @Override
    public NodeType type() {
        return NodeType.CALL_NODE;
    }

    @Override
    public List<Node> childNodes() {
        return Nodes.of(receiver, operator, message, arguments);
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
        return visitor.visitCallNode(this);
    }
}
