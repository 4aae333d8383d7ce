package com.rbparser.ast;

import java.util.ArrayList;
import java.util.List;

/**
 * Everything after the {@code __END__} marker.
 */
public record EndContent(
    String value,
    Location location,
    List<Comment> comments
) implements Node {

    public EndContent(String value, Location location) {
        this(value, location, new ArrayList<>());
    }

    @Override
    public NodeType type() {
        return NodeType.END_CONTENT;
    }

    @Override
    public List<Node> childNodes() {
        return List.of();
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
        return visitor.visitEndContent(this);
    }
}
