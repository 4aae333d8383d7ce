package com.rbparser.ast;

import java.util.ArrayList;
import java.util.List;

public record ModuleDeclaration(
    Node constant,
    BodyStmt bodystmt,
    Location location,
    List<Comment> comments
) implements Node {

    public ModuleDeclaration(Node constant, BodyStmt bodystmt, Location location) {
        this(constant, bodystmt, location, new ArrayList<>());
    }

    @Override
    public NodeType type() {
        return NodeType.MODULE_DECLARATION;
    }

    @Override
    public List<Node> childNodes() {
        return Nodes.of(constant, bodystmt);
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
        return visitor.visitModuleDeclaration(this);
    }
}
