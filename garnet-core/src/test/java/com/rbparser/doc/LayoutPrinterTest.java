package com.rbparser.doc;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class LayoutPrinterTest {

    private static String print(DocBuilder builder, int width) {
        return new LayoutPrinter(width).print(builder.root());
    }

    private static DocBuilder call(String name, String... arguments) {
        DocBuilder b = new DocBuilder();
        b.group(() -> {
            b.text(name + "(");
            b.indent(() -> {
                b.breakableEmpty();
                b.seplist(java.util.List.of(arguments), b::commaBreakable, b::text);
            });
            b.breakableEmpty();
            b.text(")");
        });
        return b;
    }

    @Test
    void groupStaysFlatWhenItFits() {
        assertEquals("foo(a, b)", print(call("foo", "a", "b"), 80));
    }

    @Test
    void groupBreaksWhenItDoesNotFit() {
        assertEquals("foo(\n  alpha,\n  beta\n)", print(call("foo", "alpha", "beta"), 10));
    }

    @Test
    void widthIsExclusiveOfNothing() {
        // exactly at the limit still fits
        assertEquals("foo(a, b)", print(call("foo", "a", "b"), 9));
        assertEquals("foo(\n  a,\n  b\n)", print(call("foo", "a", "b"), 8));
    }

    @Test
    void forcedBreakBreaksEnclosingGroups() {
        DocBuilder b = new DocBuilder();
        b.group(() -> {
            b.text("a");
            b.breakableSpace();
            b.group(() -> {
                b.text("b");
                b.breakableForce();
                b.text("c");
            });
        });
        assertEquals("a\nb\nc", print(b, 80));
    }

    @Test
    void ifBreakChoosesByEnclosingGroup() {
        DocBuilder flat = new DocBuilder();
        flat.group(() -> {
            flat.text("x");
            flat.ifBreak(() -> flat.text("BROKEN"), () -> flat.text("FLAT"));
        });
        assertEquals("xFLAT", print(flat, 80));

        DocBuilder broken = new DocBuilder();
        broken.group(() -> {
            broken.text("x");
            broken.breakParent();
            broken.ifBreak(() -> broken.text("BROKEN"), () -> broken.text("FLAT"));
        });
        assertEquals("xBROKEN", print(broken, 80));
    }

    @Test
    void alignIndentsByColumns() {
        DocBuilder b = new DocBuilder();
        b.text("when ");
        b.nest(5, () -> {
            b.text("a,");
            b.breakableForce();
            b.text("b");
        });
        assertEquals("when a,\n     b", print(b, 80));
    }

    @Test
    void negativeAlignDedents() {
        DocBuilder b = new DocBuilder();
        b.text("begin");
        b.indent(() -> {
            b.breakableForce();
            b.text("x");
            b.nest(-2, () -> {
                b.breakableForce();
                b.text("rescue");
            });
        });
        assertEquals("begin\n  x\nrescue", print(b, 80));
    }

    @Test
    void lineSuffixesFlushBeforeNewlineByPriority() {
        DocBuilder b = new DocBuilder();
        b.text("foo(<<~EOS)");
        b.lineSuffix(DocBuilder.HEREDOC_PRIORITY, () -> {
            b.breakableReturn();
            b.text("body");
            b.breakableReturn();
            b.text("EOS");
        });
        b.lineSuffix(DocBuilder.COMMENT_PRIORITY, () -> b.text(" # c"));
        b.breakableForce();
        b.text("bar");
        assertEquals("foo(<<~EOS) # c\nbody\nEOS\nbar", print(b, 80));
    }

    @Test
    void lineSuffixesFlushAtEnd() {
        DocBuilder b = new DocBuilder();
        b.text("foo");
        b.lineSuffix(DocBuilder.COMMENT_PRIORITY, () -> b.text(" # note"));
        assertEquals("foo # note", print(b, 80));
    }

    @Test
    void breakableReturnGoesToColumnZero() {
        DocBuilder b = new DocBuilder();
        b.indent(() -> {
            b.text("x");
            b.breakableReturn();
            b.text("y");
        });
        assertEquals("x\ny", print(b, 80));
    }

    @Test
    void trailingWhitespaceIsRemovedBeforeNewlines() {
        DocBuilder b = new DocBuilder();
        b.text("a   ");
        b.breakableForce();
        b.text("b");
        assertEquals("a\nb", print(b, 80));
    }

    @Test
    void trimRemovesIndentation() {
        DocBuilder b = new DocBuilder();
        b.indent(() -> {
            b.breakableForce();
            b.trim();
            b.text("=begin");
        });
        assertEquals("\n=begin", print(b, 80));
    }

    @Test
    void fillBreaksOnlyWhereNeeded() {
        DocBuilder b = new DocBuilder();
        b.fill(() -> {
            String[] words = {"aaa", "bbb", "ccc", "ddd"};
            for (int i = 0; i < words.length; i++) {
                if (i > 0) {
                    b.breakableSpace();
                }
                b.text(words[i]);
            }
        });
        assertEquals("aaa bbb\nccc ddd", print(b, 7));
    }

    @Test
    void flatRemovesOptionalBreaks() {
        DocBuilder b = new DocBuilder();
        b.flat(() -> {
            b.text("a");
            b.breakableSpace();
            b.text("b");
            b.ifBreak(() -> b.text(","));
        });
        assertEquals("a b", print(b, 1));
    }

    @Test
    void widthCountsCodePoints() {
        DocBuilder b = new DocBuilder();
        b.group(() -> {
            b.text("😀😀");
            b.breakableSpace();
            b.text("x");
        });
        assertEquals("😀😀 x", print(b, 4));
    }
}
