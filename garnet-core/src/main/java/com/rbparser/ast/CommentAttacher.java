package com.rbparser.ast;

import java.util.ArrayList;
import java.util.List;

/**
 * Attaches the comments that no statement list claimed to the nearest node of a
 * finished tree. The search descends through {@link Node#childNodes()} with a
 * binary search, relying on children being ordered and non-overlapping.
 */
public final class CommentAttacher {

    private final Program program;

    public CommentAttacher(Program program) {
        this.program = program;
    }

    public void attach(List<Comment> comments) {
        for (Comment comment : comments) {
            attach(comment);
        }
    }

    public void attach(Comment comment) {
        Location target = comment.location();
        Node enclosing = program;
        Node preceding;
        Node following;

        descend:
        while (true) {
            List<Node> children = candidates(enclosing);
            preceding = null;
            following = null;
            int left = 0;
            int right = children.size();
            while (left < right) {
                int middle = (left + right) / 2;
                Node child = children.get(middle);
                Location location = child.location();

                if (location.startChar() <= target.startChar() && target.endChar() <= location.endChar()) {
                    enclosing = child;
                    continue descend;
                }
                if (location.endChar() <= target.startChar()) {
                    preceding = child;
                    left = middle + 1;
                } else if (target.endChar() <= location.startChar()) {
                    following = child;
                    right = middle;
                } else {
                    throw new IllegalStateException(
                        "Comment at " + target + " overlaps " + child.type().tag() + " at " + location);
                }
            }
            break;
        }

        if (comment.inline()) {
            if (preceding != null) {
                trailing(preceding, comment);
            } else if (following != null) {
                leading(following, comment);
            } else {
                trailing(enclosing, comment);
            }
        } else if (following != null) {
            leading(following, comment);
        } else if (preceding != null) {
            trailing(preceding, comment);
        } else {
            trailing(enclosing, comment);
        }
    }

    private static List<Node> candidates(Node node) {
        List<Node> candidates = new ArrayList<>();
        for (Node child : node.childNodes()) {
            if (!(child instanceof Comment) && !(child instanceof VoidStmt)) {
                candidates.add(child);
            }
        }
        return candidates;
    }

    private static void leading(Node node, Comment comment) {
        comment.markLeading();
        node.comments().add(comment);
    }

    private static void trailing(Node node, Comment comment) {
        comment.markTrailing();
        node.comments().add(comment);
    }
}
