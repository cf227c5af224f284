package io.github.codegraph.model;

import static org.junit.jupiter.api.Assertions.*;

import org.junit.jupiter.api.Test;

public class SpanTest {

    @Test
    public void singleLineSpan() {
        var span = new Span(4, 4);
        assertEquals(1, span.lineCount());
        assertTrue(span.contains(4));
        assertFalse(span.contains(5));
    }

    @Test
    public void rejectsEndBeforeStart() {
        assertThrows(IllegalArgumentException.class, () -> new Span(3, 2));
        assertThrows(IllegalArgumentException.class, () -> new Span(-1, 2));
        assertFalse(Span.wellFormed(3, 2));
        assertTrue(Span.wellFormed(0, 0));
    }

    @Test
    public void sliceRejectsInvertedRange() {
        assertThrows(
                IllegalArgumentException.class,
                () -> new Slice("a.cpp", 0, 5, 4, java.util.List.of(), java.util.List.of(), ""));
    }
}
