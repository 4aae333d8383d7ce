package com.rbparser.ast;

import java.util.ArrayList;
import java.util.List;

public record ArrayLiteral(
    LBracket lbracket,
    Args contents,
    Location location,
    List<Comment> comments
) implements Node {

    public ArrayLiteral(LBracket lbracket, Args contents, Location location) {
        this(lbracket, contents, location, new ArrayList<>());
    }

    @Override
    public NodeType type() {
        return NodeType.ARRAY_LITERAL;
    }

    @Override
    public List<Node> childNodes() {
        return Nodes.of(lbracket, contents);
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
        return visitor.visitArrayLiteral(this);
    }
}
