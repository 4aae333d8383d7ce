package com.rbparser.ast;

import java.util.ArrayList;
import java.util.List;

/**
 * An empty statement; placeholder body of empty statement lists.
 */
public record VoidStmt(
    Location location,
    List<Comment> comments
) implements Node {

    public VoidStmt(Location location) {
        this(location, new ArrayList<>());
    }

    @Override
    public NodeType type() {
        return NodeType.VOID_STMT;
    }

    @Override
    public List<Node> childNodes() {
        return List.of();
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
        return visitor.visitVoidStmt(this);
    }
}
