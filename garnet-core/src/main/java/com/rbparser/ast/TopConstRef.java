package com.rbparser.ast;

import java.util.ArrayList;
import java.util.List;

public record TopConstRef(
    Const constant,
    Location location,
    List<Comment> comments
) implements Node {

    public TopConstRef(Const constant, Location location) {
        this(constant, location, new ArrayList<>());
    }

    @Override
    public NodeType type() {
        return NodeType.TOP_CONST_REF;
    }

    @Override
    public List<Node> childNodes() {
        return Nodes.of(constant);
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
        return visitor.visitTopConstRef(this);
    }
}
