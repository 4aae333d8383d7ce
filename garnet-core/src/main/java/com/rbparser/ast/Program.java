package com.rbparser.ast;

import java.util.ArrayList;
import java.util.List;

public record Program(
    Statements statements,
    Location location,
    List<Comment> comments
) implements Node {

    public Program(Statements statements, Location location) {
        this(statements, location, new ArrayList<>());
    }

    @Override
    public NodeType type() {
        return NodeType.PROGRAM;
    }

    @Override
    public List<Node> childNodes() {
        return List.of(statements);
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
        return visitor.visitProgram(this);
    }
}
