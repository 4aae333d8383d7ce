package com.rbparser.ast;

import java.util.ArrayList;
import java.util.List;

/**
 * A variable in an assignment or binding position. The value is null for an anonymous splat.
 */
public record VarField(
    Node value,
    Location location,
    List<Comment> comments
) implements Node {

    public VarField(Node value, Location location) {
        this(value, location, new ArrayList<>());
    }

    @Override
    public NodeType type() {
        return NodeType.VAR_FIELD;
    }

    @Override
    public List<Node> childNodes() {
        return Nodes.of(value);
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
        return visitor.visitVarField(this);
    }
}
