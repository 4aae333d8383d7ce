package com.rbparser.ast;

import java.util.ArrayList;
import java.util.List;

/**
 * Keyword arguments passed without braces.
 */
public record BareAssocHash(
    List<Node> assocs,
    Location location,
    List<Comment> comments
) implements Node {

    public BareAssocHash(List<Node> assocs, Location location) {
        this(assocs, location, new ArrayList<>());
    }

    @Override
    public NodeType type() {
        return NodeType.BARE_ASSOC_HASH;
    }

    @Override
    public List<Node> childNodes() {
        return Nodes.of(assocs);
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
        return visitor.visitBareAssocHash(this);
    }
}
