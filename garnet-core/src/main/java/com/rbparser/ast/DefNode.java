package com.rbparser.ast;

import java.util.ArrayList;
import java.util.List;

/**
 * A method definition: {@code def name}, {@code def target.name} or the endless
 * {@code def name = expression}. For the endless form {@code bodystmt} is the
 * expression itself rather than a {@link BodyStmt}.
 */
public record DefNode(
    Node target,
    Node operator,
    Node name,
    Node params,
    Node bodystmt,
    Location location,
    List<Comment> comments
) implements Node {

    public DefNode(Node target, Node operator, Node name, Node params, Node bodystmt, Location location) {
        this(target, operator, name, params, bodystmt, location, new ArrayList<>());
    }

    public boolean endless() {
        return !(bodystmt instanceof BodyStmt);
    }

    @Override
    public NodeType type() {
        return NodeType.DEF_NODE;
    }

    @Override
    public List<Node> childNodes() {
        return Nodes.of(target, operator, name, params, bodystmt);
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
        return visitor.visitDefNode(this);
    }
}
