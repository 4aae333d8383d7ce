package com.rbparser.ast;

import java.util.ArrayList;
import java.util.List;

/**
 * A hash pattern such as {@code {name: String, **rest}} or {@code Point(x:, y:)}.
 */
public record HshPtn(
    Node constant,
    List<Entry> keys,
    Node keywordRest,       // VarField holding an Ident, a Kw for **nil, or nothing for **
    Location location,
    List<Comment> comments
) implements Node {

    /**
     * A key with its value pattern; the value is null for {@code key:} shorthand.
     */
    public record Entry(Node key, Node value) {
    }

    public HshPtn(Node constant, List<Entry> keys, Node keywordRest, Location location) {
        this(constant, keys, keywordRest, location, new ArrayList<>());
    }

    @Override
    public NodeType type() {
        return NodeType.HSHPTN;
    }

    @Override
    public List<Node> childNodes() {
        return Nodes.of(constant, keys, keywordRest);
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
        return visitor.visitHshPtn(this);
    }
}
