package com.rbparser.ast;

import java.util.ArrayList;
import java.util.List;

public record BlockVar(
    Params params,
    List<Ident> locals,
    Location location,
    List<Comment> comments
) implements Node {

    public BlockVar(Params params, List<Ident> locals, Location location) {
        this(params, locals, location, new ArrayList<>());
    }

    @Override
    public NodeType type() {
        return NodeType.BLOCK_VAR;
    }

    @Override
    public List<Node> childNodes() {
        return Nodes.of(params, locals);
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
        return visitor.visitBlockVar(this);
    }
}
