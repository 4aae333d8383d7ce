package com.rbparser.doc;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.function.Consumer;

/**
 * Builds a {@link Doc} tree. Nested content is added through callbacks: every
 * container method switches the current target list for the duration of its
 * callback, so callers read like the output they describe.
 */
public class DocBuilder {

    /** Trailing comments flush before heredoc bodies that share their line. */
    public static final int COMMENT_PRIORITY = 1;
    public static final int HEREDOC_PRIORITY = 2;

    private final Doc.Group root = new Doc.Group();
    private final Deque<Doc.Group> groups = new ArrayDeque<>();
    private List<Doc> target = root.contents();

    public DocBuilder() {
        groups.push(root);
    }

    public Doc.Group root() {
        return root;
    }

    public void text(String value) {
        target.add(new Doc.Text(value));
    }

    public void breakable() {
        breakable(" ", true, false);
    }

    public void breakableSpace() {
        breakable(" ", true, false);
    }

    public void breakableEmpty() {
        breakable("", true, false);
    }

    /**
     * A breakable that always breaks, and breaks every enclosing group with it.
     */
    public void breakableForce() {
        breakable(" ", true, true);
    }

    /**
     * A forced newline back to column zero that leaves the enclosing groups alone.
     * Used for heredoc bodies, which never change the shape of the code around
     * their opener.
     */
    public void breakableReturn() {
        target.add(new Doc.Breakable(" ", 1, false, true));
    }

    public void breakable(String separator, boolean indent, boolean force) {
        target.add(new Doc.Breakable(separator, separator.length(), indent, force));
        if (force) {
            breakParent();
        }
    }

    public void breakParent() {
        target.add(new Doc.BreakParent());
        for (Doc.Group group : groups) {
            if (group.broken()) {
                break;
            }
            group.breakGroup();
        }
    }

    public void trim() {
        target.add(new Doc.Trim());
    }

    public Doc.Group group(Runnable contents) {
        Doc.Group group = new Doc.Group();
        target.add(group);
        groups.push(group);
        withTarget(group.contents(), contents);
        groups.pop();
        return group;
    }

    /**
     * A group wrapped in delimiters, with its contents indented by {@code indent}
     * columns when it breaks.
     */
    public Doc.Group group(int indent, String open, String close, Runnable contents) {
        text(open);
        Doc.Group group = group(() -> {
            if (indent > 0) {
                nest(indent, contents);
            } else {
                contents.run();
            }
        });
        text(close);
        return group;
    }

    /**
     * Adds contents that never break: their breakables print as separators and
     * if-break choices take the flat side. Forced breaks are kept.
     */
    public void flat(Runnable contents) {
        Doc.Group group = group(contents);
        removeBreaks(group.contents());
    }

    private static void removeBreaks(List<Doc> docs) {
        for (int i = 0; i < docs.size(); i++) {
            Doc doc = docs.get(i);
            if (doc instanceof Doc.Breakable breakable && !breakable.force()) {
                docs.set(i, new Doc.Text(breakable.separator()));
            } else if (doc instanceof Doc.IfBreak ifBreak) {
                removeBreaks(ifBreak.flatContents());
                docs.set(i, new Doc.Align(0, ifBreak.flatContents()));
            } else if (doc instanceof Doc.Group group) {
                removeBreaks(group.contents());
            } else if (doc instanceof Doc.Indent indent) {
                removeBreaks(indent.contents());
            } else if (doc instanceof Doc.Align align) {
                removeBreaks(align.contents());
            } else if (doc instanceof Doc.Fill fill) {
                removeBreaks(fill.parts());
            }
        }
    }

    public void indent(Runnable contents) {
        Doc.Indent indent = new Doc.Indent();
        target.add(indent);
        withTarget(indent.contents(), contents);
    }

    public void nest(int width, Runnable contents) {
        Doc.Align align = new Doc.Align(width);
        target.add(align);
        withTarget(align.contents(), contents);
    }

    public void ifBreak(Runnable breakContents, Runnable flatContents) {
        Doc.IfBreak ifBreak = new Doc.IfBreak();
        target.add(ifBreak);
        withTarget(ifBreak.breakContents(), breakContents);
        withTarget(ifBreak.flatContents(), flatContents);
    }

    public void ifBreak(Runnable breakContents) {
        ifBreak(breakContents, () -> { });
    }

    public void ifFlat(Runnable flatContents) {
        ifBreak(() -> { }, flatContents);
    }

    public void lineSuffix(int priority, Runnable contents) {
        Doc.LineSuffix suffix = new Doc.LineSuffix(priority);
        target.add(suffix);
        withTarget(suffix.contents(), contents);
    }

    /**
     * Contents must alternate between items and breakables, starting and ending
     * with an item.
     */
    public void fill(Runnable contents) {
        Doc.Fill fill = new Doc.Fill();
        target.add(fill);
        withTarget(fill.parts(), contents);
    }

    public <T> void seplist(List<T> items, Runnable separator, Consumer<T> each) {
        boolean first = true;
        for (T item : items) {
            if (!first) {
                separator.run();
            }
            first = false;
            each.accept(item);
        }
    }

    public void commaBreakable() {
        text(",");
        breakableSpace();
    }

    private void withTarget(List<Doc> contents, Runnable body) {
        List<Doc> previous = target;
        target = contents;
        try {
            body.run();
        } finally {
            target = previous;
        }
    }
}
