package com.rbparser.ast;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class LocationTest {

    @Test
    void tokenSpansOneLine() {
        Location location = Location.token(3, 10, 4);
        assertEquals(new Location(3, 10, 3, 14), location);
        assertEquals(4, location.length());
    }

    @Test
    void fixedIsZeroWidth() {
        Location location = Location.fixed(2, 7);
        assertEquals(0, location.length());
        assertEquals(location.startChar(), location.endChar());
    }

    @Test
    void toKeepsStartAndTakesLaterEnd() {
        Location first = new Location(1, 0, 1, 3);
        Location second = new Location(4, 20, 5, 30);
        assertEquals(new Location(1, 0, 5, 30), first.to(second));
    }

    @Test
    void toNeverMovesEndLineBackwards() {
        Location multiLine = new Location(1, 0, 3, 20);
        Location sameLine = new Location(1, 2, 1, 25);
        assertEquals(3, multiLine.to(sameLine).endLine());
    }

    @Test
    void containsAndIsBefore() {
        Location outer = new Location(1, 0, 2, 20);
        Location inner = new Location(1, 4, 1, 8);
        Location later = new Location(2, 20, 2, 22);

        assertTrue(outer.contains(inner));
        assertTrue(outer.contains(outer));
        assertFalse(inner.contains(outer));
        assertTrue(inner.isBefore(later));
        assertTrue(outer.isBefore(later));
        assertFalse(later.isBefore(inner));
    }
}
