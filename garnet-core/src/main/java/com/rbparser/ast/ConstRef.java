package com.rbparser.ast;

import java.util.ArrayList;
import java.util.List;

/**
 * The name of a class or module being declared.
 */
public record ConstRef(
    Const constant,
    Location location,
    List<Comment> comments
) implements Node {

    public ConstRef(Const constant, Location location) {
        this(constant, location, new ArrayList<>());
    }

    @Override
    public NodeType type() {
        return NodeType.CONST_REF;
    }

    @Override
    public List<Node> childNodes() {
        return Nodes.of(constant);
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
        return visitor.visitConstRef(this);
    }
}
