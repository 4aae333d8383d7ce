package com.rbparser.format;

import com.rbparser.ast.BasicVisitor;
import com.rbparser.ast.Comment;
import com.rbparser.ast.Heredoc;
import com.rbparser.ast.Location;
import com.rbparser.ast.Node;
import com.rbparser.ast.NodeType;
import com.rbparser.ast.Program;
import com.rbparser.doc.DocBuilder;
import com.rbparser.doc.LayoutPrinter;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 * Turns a syntax tree into a layout document. Keeps the stack of nodes being
 * formatted so that node rules can look at their surroundings, and prints the
 * comments attached to every node around it.
 */
public class Formatter extends DocBuilder {

    private final String source;
    private final FormatOptions options;
    private final Deque<Node> stack = new ArrayDeque<>();
    private final FormatVisitor visitor;

    public Formatter(String source, FormatOptions options) {
        this.source = source;
        this.options = options;
        this.visitor = new FormatVisitor(this);
    }

    /**
     * Formats a parsed program into source text.
     */
    public static String format(String source, Program program, FormatOptions options) {
        Formatter formatter = new Formatter(source, options);
        formatter.format(program);
        return new LayoutPrinter(options.printWidth()).print(formatter.root());
    }

    public String source() {
        return source;
    }

    public FormatOptions options() {
        return options;
    }

    public String quote() {
        return options.quote();
    }

    public String slice(Location location) {
        return source.substring(location.startChar(), location.endChar());
    }

    public void format(Node node) {
        if (node == null) {
            return;
        }
        formatWith(node, () -> {
            if (ignored(node)) {
                text(slice(node.location()));
            } else {
                node.accept(visitor);
            }
        });
    }

    /**
     * Prints the comments of {@code node} around a custom rendering of it. Used
     * where a parent lays out a child itself instead of through the visitor.
     */
    public void formatWith(Node node, Runnable body) {
        stack.push(node);
        List<Comment> trailing = new ArrayList<>();
        for (Comment comment : node.comments()) {
            if (comment.leading()) {
                formatComment(comment);
                breakableForce();
            } else {
                trailing.add(comment);
            }
        }

        body.run();

        for (Comment comment : trailing) {
            lineSuffix(COMMENT_PRIORITY, () -> {
                if (comment.inline()) {
                    text(" ");
                } else {
                    breakable();
                }
                formatComment(comment);
            });
            breakParent();
        }
        stack.pop();
    }

    void formatComment(Comment comment) {
        if (comment.isEmbDoc()) {
            trim();
        }
        text(comment.value());
    }

    private static boolean ignored(Node node) {
        for (Comment comment : node.comments()) {
            if (comment.leading() && comment.ignore()) {
                return true;
            }
        }
        return false;
    }

    /** The node being formatted. */
    public Node current() {
        return stack.peek();
    }

    public Node parent() {
        return ancestor(1);
    }

    public NodeType parentType() {
        Node parent = parent();
        return parent == null ? null : parent.type();
    }

    public Node grandparent() {
        return ancestor(2);
    }

    /**
     * The enclosing nodes, innermost first, without the current one.
     */
    public List<Node> ancestors() {
        List<Node> result = new ArrayList<>(stack);
        return result.isEmpty() ? result : result.subList(1, result.size());
    }

    private Node ancestor(int depth) {
        int index = 0;
        for (Node node : stack) {
            if (index == depth) {
                return node;
            }
            index++;
        }
        return null;
    }

    /**
     * The last source line a node occupies, counting the bodies of heredocs that
     * open inside it.
     */
    static int lastLine(Node node) {
        int[] last = {node.location().endLine()};
        node.accept(new BasicVisitor<Void>() {
            @Override
            public Void visitHeredoc(Heredoc heredoc) {
                last[0] = Math.max(last[0], heredoc.ending().location().endLine());
                return visitChildNodes(heredoc);
            }
        });
        return last[0];
    }
}
