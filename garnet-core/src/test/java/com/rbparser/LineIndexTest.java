package com.rbparser;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class LineIndexTest {

    @Test
    void asciiLinesUseArithmetic() {
        LineIndex index = new LineIndex("abc\ndef\n");
        assertEquals(3, index.lineCount());
        assertEquals(0, index.charOffset(1, 0));
        assertEquals(6, index.charOffset(2, 2));
        assertEquals(2, index.lineOf(6));
        assertEquals(2, index.column(6));
    }

    @Test
    void multiByteCharactersCountOnce() {
        // "é" is two bytes in UTF-8 but one character
        LineIndex index = new LineIndex("x = \"é\"\ny");
        assertEquals(5, index.charOffset(1, 5));
        assertEquals(6, index.charOffset(1, 7));
        assertEquals(8, index.charOffset(2, 0));
    }

    @Test
    void surrogatePairsCountAsTwoCharacters() {
        // U+1F600 is four bytes in UTF-8 and two UTF-16 code units
        LineIndex index = new LineIndex("😀a");
        assertEquals(2, index.charOffset(1, 4));
    }

    @Test
    void negativeColumnClampsToLineStart() {
        LineIndex index = new LineIndex("a\nb");
        assertEquals(2, index.charOffset(2, -3));
    }

    @Test
    void lineOfLineStart() {
        LineIndex index = new LineIndex("a\nb\nc");
        assertEquals(1, index.lineOf(0));
        assertEquals(1, index.lineOf(1));
        assertEquals(2, index.lineOf(2));
        assertEquals(3, index.lineOf(4));
    }
}
