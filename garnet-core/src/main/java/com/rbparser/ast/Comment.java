package com.rbparser.ast;

import java.util.List;

/**
 * A {@code #} comment or an {@code =begin}/{@code =end} block. Comments are
 * collected during the parse and later either spliced into a statement list or
 * attached to the nearest node as leading or trailing.
 */
public final class Comment implements Node {

    private final String value;
    private final boolean inline;
    private final Location location;
    private boolean leading;
    private boolean trailing;

    public Comment(String value, boolean inline, Location location) {
        this.value = value.stripTrailing();
        this.inline = inline;
        this.location = location;
    }

    public String value() {
        return value;
    }

    /**
     * True when code precedes the comment on its line.
     */
    public boolean inline() {
        return inline;
    }

    public boolean leading() {
        return leading;
    }

    public boolean trailing() {
        return trailing;
    }

    public boolean isEmbDoc() {
        return value.startsWith("=begin");
    }

    public boolean ignore() {
        return !isEmbDoc() && value.substring(1).strip().equals("stree-ignore");
    }

    void markLeading() {
        this.leading = true;
    }

    void markTrailing() {
        this.trailing = true;
    }

    @Override
    public Location location() {
        return location;
    }

    @Override
    public List<Comment> comments() {
        return List.of();
    }

    @Override
    public NodeType type() {
        return isEmbDoc() ? NodeType.EMB_DOC : NodeType.COMMENT;
    }

    @Override
    public List<Node> childNodes() {
        return List.of();
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
        return visitor.visitComment(this);
    }

    @Override
    public String toString() {
        return "Comment[" + value + ", " + location + "]";
    }
}
