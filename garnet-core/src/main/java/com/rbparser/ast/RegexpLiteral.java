package com.rbparser.ast;

import java.util.ArrayList;
import java.util.List;

public record RegexpLiteral(
    String beginning,
    String ending,
    List<Node> parts,
    Location location,
    List<Comment> comments
) implements Node {

    public RegexpLiteral(String beginning, String ending, List<Node> parts, Location location) {
        this(beginning, ending, parts, location, new ArrayList<>());
    }

    @Override
    public NodeType type() {
        return NodeType.REGEXP_LITERAL;
    }

    @Override
    public List<Node> childNodes() {
        return Nodes.of(parts);
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
        return visitor.visitRegexpLiteral(this);
    }
}
