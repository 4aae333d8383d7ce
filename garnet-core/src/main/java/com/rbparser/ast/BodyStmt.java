package com.rbparser.ast;

import java.util.ArrayList;
import java.util.List;

/**
 * The body of a {@code def}, {@code class}, {@code module}, {@code begin} or
 * {@code do} block with its optional rescue, else and ensure clauses.
 */
public record BodyStmt(
    Statements statements,
    Rescue rescueClause,
    Kw elseKeyword,
    Statements elseClause,
    Ensure ensureClause,
    Location location,
    List<Comment> comments
) implements Node {

    public BodyStmt(
        Statements statements,
        Rescue rescueClause,
        Kw elseKeyword,
        Statements elseClause,
        Ensure ensureClause,
        Location location
    ) {
        this(statements, rescueClause, elseKeyword, elseClause, ensureClause, location, new ArrayList<>());
    }

    public boolean isEmpty() {
        return statements.isEmpty() && rescueClause == null && elseClause == null && ensureClause == null;
    }

    public BodyStmt bind(SourceContext context, int startChar, int endChar) {
        Node consequent = rescueClause != null ? rescueClause
            : elseKeyword != null ? elseKeyword
            : ensureClause;
        Statements boundStatements = statements.bind(
            context, startChar, consequent != null ? consequent.location().startChar() : endChar);

        Node afterRescue = elseKeyword != null ? elseKeyword : ensureClause;
        Rescue boundRescue = rescueClause == null ? null
            : rescueClause.bindEnd(context, afterRescue != null ? afterRescue.location().startChar() : endChar);

        Statements boundElse = elseClause == null ? null
            : elseClause.bind(
                context,
                context.nextStatementStart(elseKeyword.location().endChar()),
                ensureClause != null ? ensureClause.location().startChar() : endChar);

        return new BodyStmt(
            boundStatements,
            boundRescue,
            elseKeyword,
            boundElse,
            ensureClause,
            context.range(startChar, endChar),
            comments);
    }

    @Override
    public NodeType type() {
        return NodeType.BODYSTMT;
    }

    @Override
    public List<Node> childNodes() {
        return Nodes.of(statements, rescueClause, elseKeyword, elseClause, ensureClause);
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
        return visitor.visitBodyStmt(this);
    }
}
