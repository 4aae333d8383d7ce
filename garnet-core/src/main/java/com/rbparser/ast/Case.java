package com.rbparser.ast;

import java.util.ArrayList;
import java.util.List;

public record Case(
    Kw keyword,
    Node value,
    Node consequent,
    Location location,
    List<Comment> comments
) implements Node {

    public Case(Kw keyword, Node value, Node consequent, Location location) {
        this(keyword, value, consequent, location, new ArrayList<>());
    }

    @Override
    public NodeType type() {
        return NodeType.CASE;
    }

    @Override
    public List<Node> childNodes() {
        return Nodes.of(keyword, value, consequent);
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
        return visitor.visitCase(this);
    }
}
