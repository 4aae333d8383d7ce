package com.rbparser.format;

import com.rbparser.SyntaxTree;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.ValueSource;

import static org.junit.jupiter.api.Assertions.*;

public class FormatterTest {

    private static String format(String source) {
        return SyntaxTree.format(source);
    }

    private static String format(String source, FormatOptions options) {
        return SyntaxTree.format(source, options);
    }

    @Test
    void spacesAroundAssignment() {
        assertEquals("x = 1\n", format("x=1"));
    }

    @Test
    void thenIsDroppedFromBlockIf() {
        assertEquals("if a\n  b\nend\n", format("if a then b end"));
    }

    @Test
    void trailingCommentStaysOnItsLine() {
        assertEquals("foo # note\n", format("foo # note"));
    }

    @Test
    void stringArrayBecomesWordList() {
        assertEquals("%w[a b c d e f]\n", format("[\"a\",\"b\",\"c\",\"d\",\"e\",\"f\"]"));
    }

    @Test
    void symbolArrayBecomesSymbolList() {
        assertEquals("%i[a b c]\n", format("[:a, :b, :c]"));
    }

    @Test
    void stringsWithSpacesStayAnArray() {
        assertEquals("[\"a b\", \"c\"]\n", format("[\"a b\", \"c\"]"));
    }

    @Test
    void commentBeforeHeredocBody() {
        String source = "foo(<<~EOS) # c\n  body\nEOS\n";
        assertEquals(source, format(source));
    }

    @Test
    void heredocBodyIsKeptVerbatim() {
        String source = "x = <<-EOS\n  keep   this\n    spacing\n  EOS\n";
        assertEquals(source, format(source));
    }

    // ==================== Quotes ====================

    @Test
    void plainSingleQuotedStringSwitchesQuotes() {
        assertEquals("\"no special chars\"\n", format("'no special chars'"));
    }

    @Test
    void interpolationLookalikeKeepsSingleQuotes() {
        assertEquals("'has #{interpolation} looking text'\n", format("'has #{interpolation} looking text'"));
    }

    @Test
    void escapedQuoteKeepsDoubleQuotes() {
        assertEquals("\"has a \\\" escaped quote\"\n", format("\"has a \\\" escaped quote\""));
    }

    @Test
    void singleQuotePreference() {
        FormatOptions single = FormatOptions.DEFAULT.withQuote("'");
        assertEquals("'plain'\n", format("\"plain\"", single));
        assertEquals("\"it's\"\n", format("\"it's\"", single));
    }

    @Test
    void charLiteralBecomesString() {
        assertEquals("\"a\"\n", format("?a"));
    }

    // ==================== Numbers ====================

    @ParameterizedTest
    @CsvSource({
        "1234567, 1_234_567",
        "12345, 12_345",
        "123456, 123_456",
        "1234, 1234",
        "1_000, 1_000",
        "01234567, 01234567",
        "0x123456, 0x123456"
    })
    void integerGrouping(String written, String expected) {
        assertEquals(expected, FormatVisitor.groupDigits(written));
    }

    @Test
    void integerGroupingInSource() {
        assertEquals("x = 1_234_567\n", format("x = 1234567"));
    }

    // ==================== Statements and comments ====================

    @Test
    void blankLinesCollapseToOne() {
        assertEquals("a\n\nb\n", format("a\n\n\n\nb\n"));
    }

    @Test
    void adjacentStatementsStayAdjacent() {
        assertEquals("a\nb\n", format("a; b"));
    }

    @Test
    void leadingCommentIsKept() {
        assertEquals("# leading\nfoo\n", format("# leading\nfoo\n"));
    }

    @Test
    void ignoreCommentKeepsNodeVerbatim() {
        String source = "# stree-ignore\nfoo   =   1\n";
        assertEquals(source, format(source));
    }

    @Test
    void emptyProgramIsASingleNewline() {
        assertEquals("\n", format(""));
        assertEquals("\n", format("\n\n"));
    }

    // ==================== Calls ====================

    @Test
    void emptyParenthesesDroppedOnMethodCalls() {
        assertEquals("foo\n", format("foo()"));
    }

    @Test
    void emptyParenthesesKeptOnConstantCalls() {
        assertEquals("Foo()\n", format("Foo()"));
    }

    @Test
    void longArgumentListBreaks() {
        FormatOptions narrow = FormatOptions.DEFAULT.withPrintWidth(20);
        assertEquals("foo(\n  alpha,\n  beta,\n  gamma\n)\n", format("foo(alpha, beta, gamma)", narrow));
    }

    @Test
    void trailingCommaOnBrokenArguments() {
        FormatOptions options = FormatOptions.DEFAULT.withPrintWidth(20).withTrailingComma(true);
        assertEquals("foo(\n  alpha,\n  beta,\n  gamma,\n)\n", format("foo(alpha, beta, gamma)", options));
    }

    @Test
    void hashGetsSpacesInsideBraces() {
        assertEquals("{ a: 1, \"b\" => 2 }\n", format("{a: 1, \"b\" => 2}"));
        assertEquals("{}\n", format("{}"));
    }

    @Test
    void receiverCommentsKeepEachCallOnItsOwnLine() {
        String source = "foo(1) # a\n  .bar # b\n  .baz\n";
        assertEquals(source, format(source));
    }

    // ==================== Jumps ====================

    @Test
    void shortJumpArgumentsStayOnOneLine() {
        assertEquals("return 1, 2\n", format("return 1, 2"));
        assertEquals("next 1, 2\n", format("next 1,2"));
        assertEquals("break 1, 2\n", format("break 1, 2"));
    }

    @Test
    void shortYieldAndSuperArgumentsStayOnOneLine() {
        assertEquals("yield 1, 2\n", format("yield 1, 2"));
        assertEquals("super 1, 2\n", format("super 1, 2"));
    }

    @Test
    void longJumpArgumentsAlignAfterKeyword() {
        assertEquals("return aaaa,\n       bbbb\n", format("return aaaa, bbbb", FormatOptions.DEFAULT.withPrintWidth(12)));
    }

    // ==================== Conditionals ====================

    @Test
    void shortIfElseBecomesTernary() {
        assertEquals("a ? b : c\n", format("if a\n  b\nelse\n  c\nend\n"));
    }

    @Test
    void disableAutoTernaryKeepsBlock() {
        String source = "if a\n  b\nelse\n  c\nend\n";
        assertEquals(source, format(source, FormatOptions.DEFAULT.withDisableAutoTernary(true)));
    }

    @Test
    void shortModifierStaysModifier() {
        assertEquals("foo if bar\n", format("foo if bar"));
    }

    @Test
    void longModifierBecomesBlock() {
        FormatOptions narrow = FormatOptions.DEFAULT.withPrintWidth(20);
        assertEquals("if some_condition\n  do_something\nend\n", format("do_something if some_condition", narrow));
    }

    @Test
    void caseWithoutSubject() {
        assertEquals("case\nwhen a\n  b\nend\n", format("case\nwhen a\n  b\nend"));
        assertEquals("case\nwhen a\n  b\nend\n", format("case; when a then b; end"));
    }

    // ==================== Idempotence ====================

    @ParameterizedTest
    @ValueSource(strings = {
        "x = 1\n",
        "def foo(a, b)\n  a + b\nend\n",
        "class Foo < Bar\n  def baz\n    1\n  end\nend\n",
        "module Foo\n  X = 1\nend\n",
        "while x\n  y\nend\n",
        "case a\nwhen 1\n  b\nelse\n  c\nend\n",
        "begin\n  a\nrescue StandardError => e\n  b\nensure\n  c\nend\n",
        "foo.each { |x| puts x }\n",
        "a = [1, 2, 3]\n",
        "# comment\nfoo # trailing\n"
    })
    void formattedSourceIsAFixedPoint(String source) {
        String once = format(source);
        assertEquals(source, once);
        assertEquals(once, format(once));
    }
}
