package com.rbparser.ast;

import java.util.ArrayList;
import java.util.List;

/**
 * A find pattern: {@code [*, value, *]}.
 */
public record FndPtn(
    Node constant,
    VarField left,
    List<Node> values,
    VarField right,
    Location location,
    List<Comment> comments
) implements Node {

    public FndPtn(Node constant, VarField left, List<Node> values, VarField right, Location location) {
        this(constant, left, values, right, location, new ArrayList<>());
    }

    @Override
    public NodeType type() {
        return NodeType.FND_PTN;
    }

    @Override
    public List<Node> childNodes() {
        return Nodes.of(constant, left, values, right);
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
        return visitor.visitFndPtn(this);
    }
}
