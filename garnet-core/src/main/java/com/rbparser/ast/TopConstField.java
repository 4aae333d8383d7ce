package com.rbparser.ast;

import java.util.ArrayList;
import java.util.List;

public record TopConstField(
    Const constant,
    Location location,
    List<Comment> comments
) implements Node {

    public TopConstField(Const constant, Location location) {
        this(constant, location, new ArrayList<>());
    }

    @Override
    public NodeType type() {
        return NodeType.TOP_CONST_FIELD;
    }

    @Override
    public List<Node> childNodes() {
        return Nodes.of(constant);
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
        return visitor.visitTopConstField(this);
    }
}
