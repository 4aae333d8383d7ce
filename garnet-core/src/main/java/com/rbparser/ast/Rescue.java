package com.rbparser.ast;

import java.util.ArrayList;
import java.util.List;

/**
 * One {@code rescue} clause; later clauses hang off {@code consequent}. The
 * location of the last clause ends at its statements until the enclosing body
 * binds it to the start of the following clause or {@code end}.
 */
public record Rescue(
    Kw keyword,
    RescueEx exception,
    Statements statements,
    Rescue consequent,
    Location location,
    List<Comment> comments
) implements Node {

    public Rescue(Kw keyword, RescueEx exception, Statements statements, Rescue consequent, Location location) {
        this(keyword, exception, statements, consequent, location, new ArrayList<>());
    }

    public Rescue bindEnd(SourceContext context, int endChar) {
        Location bound = new Location(location.startLine(), location.startChar(), context.lineOf(endChar), endChar);
        if (consequent != null) {
            return new Rescue(keyword, exception, statements, consequent.bindEnd(context, endChar), bound, comments);
        }
        Statements rebound = statements.bind(context, statements.location().startChar(), endChar);
        return new Rescue(keyword, exception, rebound, null, bound, comments);
    }

    @Override
    public NodeType type() {
        return NodeType.RESCUE;
    }

    @Override
    public List<Node> childNodes() {
        return Nodes.of(keyword, exception, statements, consequent);
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
        return visitor.visitRescue(this);
    }
}
