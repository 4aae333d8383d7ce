package com.rbparser.ast;

import java.util.ArrayList;
import java.util.List;

/**
 * A heredoc. Its location covers only the opener; the body parts and the
 * terminator live on later lines and are not reported by {@link #childNodes()}
 * so that sibling ranges on the opener line stay ordered.
 */
public record Heredoc(
    HeredocBeg beginning,
    HeredocEnd ending,
    int dedent,
    List<Node> parts,
    Location location,
    List<Comment> comments
) implements Node {

    public Heredoc(HeredocBeg beginning, HeredocEnd ending, int dedent, List<Node> parts, Location location) {
        this(beginning, ending, dedent, parts, location, new ArrayList<>());
    }

    public boolean squiggly() {
        return beginning.value().startsWith("<<~");
    }

    @Override
    public NodeType type() {
        return NodeType.HEREDOC;
    }

    @Override
    public List<Node> childNodes() {
        return List.of(beginning);
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
        return visitor.visitHeredoc(this);
    }
}
