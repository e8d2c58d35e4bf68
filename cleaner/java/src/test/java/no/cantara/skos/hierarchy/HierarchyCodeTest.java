package no.cantara.skos.hierarchy;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class HierarchyCodeTest {

    @Test
    void extractsDottedCodeFromBracketedIdentifier() {
        HierarchyCode code = HierarchyCode.of("<1.2.3>").orElseThrow();
        assertEquals("1.2.3", code.text());
        assertEquals(List.of("1", "2", "3"), code.segments());
        assertEquals(3, code.depth());
    }

    @Test
    void ancestorsAreNearestFirst() {
        assertEquals(List.of("1.2", "1"), HierarchyCode.of("<1.2.3>").orElseThrow().ancestors());
    }

    @Test
    void numericOnlyWhenEverySegmentIsDigits() {
        assertTrue(HierarchyCode.of("<12.34.5>").orElseThrow().isNumeric());
        assertTrue(HierarchyCode.of("<42-10>").orElseThrow().isNumeric());
        assertFalse(HierarchyCode.of("<3f2a-7b4d>").orElseThrow().isNumeric());
        assertFalse(HierarchyCode.of("<A.1>").orElseThrow().isNumeric());
    }

    @Test
    void usesLastPathSegmentOfAbsoluteIri() {
        HierarchyCode code = HierarchyCode.of("http://example.org/vocab/12-4").orElseThrow();
        assertEquals("12-4", code.text());
        assertEquals(List.of("12"), code.ancestors());
    }

    @Test
    void keepsMixedDelimitersAsWritten() {
        assertEquals(List.of("A1.B2", "A1"), HierarchyCode.of("http://example.org/A1.B2-C3").orElseThrow().ancestors());
    }

    @Test
    void usesFragmentAfterHash() {
        assertEquals("7.1", HierarchyCode.of("http://example.org/codes#7.1").orElseThrow().text());
    }

    @Test
    void singleSegmentHasNoAncestors() {
        assertTrue(HierarchyCode.of("http://example.org/animals").orElseThrow().ancestors().isEmpty());
    }

    @Test
    void rejectsNonCodeSegments() {
        assertTrue(HierarchyCode.of("http://example.org/foo_bar").isEmpty());
        assertTrue(HierarchyCode.of("http://example.org/1..2").isEmpty());
        assertTrue(HierarchyCode.of("http://example.org/").isEmpty());
        assertTrue(HierarchyCode.of(null).isEmpty());
    }
}
