package com.rbparser.ast;

import java.util.ArrayList;
import java.util.List;

/**
 * A brace block ({@code bodystmt} is a {@link Statements}) or a do block ({@code bodystmt} is a {@link BodyStmt}).
 */
public record BlockNode(
    Node opening,
    BlockVar blockVar,
    Node bodystmt,
    Location location,
    List<Comment> comments
) implements Node {

    public BlockNode(Node opening, BlockVar blockVar, Node bodystmt, Location location) {
        this(opening, blockVar, bodystmt, location, new ArrayList<>());
    }

    @Override
    public NodeType type() {
        return NodeType.BLOCK_NODE;
    }

    @Override
    public List<Node> childNodes() {
        return Nodes.of(opening, blockVar, bodystmt);
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
        return visitor.visitBlockNode(this);
    }
}
