package com.rbparser.doc;

import java.util.ArrayList;
import java.util.List;

/**
 * Layout document. A tree of these is built by {@link DocBuilder} and consumed
 * once by {@link LayoutPrinter}.
 */
public sealed interface Doc permits
    Doc.Text,
    Doc.Breakable,
    Doc.Group,
    Doc.Indent,
    Doc.Align,
    Doc.IfBreak,
    Doc.LineSuffix,
    Doc.Fill,
    Doc.BreakParent,
    Doc.Trim {

    record Text(String value) implements Doc {
        public int width() {
            return value.codePointCount(0, value.length());
        }
    }

    /**
     * A place where the line may break. Printed as {@code separator} when the
     * enclosing group is flat, as a newline otherwise. A breakable that does not
     * indent starts the next line at column zero; a forced one always breaks.
     */
    record Breakable(String separator, int width, boolean indent, boolean force) implements Doc {
        public Breakable(String separator) {
            this(separator, separator.length(), true, false);
        }
    }

    final class Group implements Doc {
        private final List<Doc> contents = new ArrayList<>();
        private boolean broken;

        public List<Doc> contents() {
            return contents;
        }

        public boolean broken() {
            return broken;
        }

        public void breakGroup() {
            broken = true;
        }

        @Override
        public String toString() {
            return "Group" + (broken ? "!" : "") + contents;
        }
    }

    record Indent(List<Doc> contents) implements Doc {
        public Indent() {
            this(new ArrayList<>());
        }
    }

    /**
     * Indents its contents by a fixed number of columns instead of one level.
     */
    record Align(int width, List<Doc> contents) implements Doc {
        public Align(int width) {
            this(width, new ArrayList<>());
        }
    }

    record IfBreak(List<Doc> breakContents, List<Doc> flatContents) implements Doc {
        public IfBreak() {
            this(new ArrayList<>(), new ArrayList<>());
        }
    }

    /**
     * Contents printed just before the next newline rather than in place.
     */
    record LineSuffix(int priority, List<Doc> contents) implements Doc {
        public LineSuffix(int priority) {
            this(priority, new ArrayList<>());
        }
    }

    /**
     * Alternating content and separators. Each separator breaks only when the
     * content after it would not fit on the line.
     */
    record Fill(List<Doc> parts) implements Doc {
        public Fill() {
            this(new ArrayList<>());
        }
    }

    record BreakParent() implements Doc {}

    /**
     * Removes trailing spaces and tabs from the output written so far.
     */
    record Trim() implements Doc {}
}
