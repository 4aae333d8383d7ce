package com.rbparser.ast;

import java.util.ArrayList;
import java.util.List;

public record ClassDeclaration(
    Node constant,
    Node superclass,
    BodyStmt bodystmt,
    Location location,
    List<Comment> comments
) implements Node {

    public ClassDeclaration(Node constant, Node superclass, BodyStmt bodystmt, Location location) {
        this(constant, superclass, bodystmt, location, new ArrayList<>());
    }

    @Override
    public NodeType type() {
        return NodeType.CLASS_DECLARATION;
    }

    @Override
    public List<Node> childNodes() {
        return Nodes.of(constant, superclass, bodystmt);
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
        return visitor.visitClassDeclaration(this);
    }
}
