package no.cantara.skos.graph;

import no.cantara.skos.model.ChangeCategory;
import no.cantara.skos.model.ChangeRecord;
import no.cantara.skos.model.ConceptGraph;
import no.cantara.skos.model.ConceptKind;
import no.cantara.skos.model.ConceptNode;
import no.cantara.skos.model.LabelKind;
import no.cantara.skos.model.NoteKind;
import no.cantara.skos.model.RelationKind;
import no.cantara.skos.model.SchemeLinkKind;
import no.cantara.skos.reader.StatementReader;
import no.cantara.skos.report.ChangeRecorder;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class ConceptGraphBuilderTest {

    private static final String HEADER = """
            @prefix skos: <http://www.w3.org/2004/02/skos/core#> .
            @prefix ex: <http://example.org/> .
            """;

    private static ConceptGraph build(String text, ChangeRecorder recorder) {
        return new ConceptGraphBuilder(recorder).build(StatementReader.of(text, recorder), false, 1000);
    }

    private static List<String> described(ChangeRecorder recorder, ChangeCategory category) {
        return recorder.changes().stream()
                .filter(c -> c.category() == category)
                .map(ChangeRecord::describe)
                .toList();
    }

    // -----------------------------------------------------------------------
    // Deduplication
    // -----------------------------------------------------------------------

    @Test
    void firstBlockWinsAndLaterDuplicatesAreDiscardedWhole() {
        ChangeRecorder recorder = new ChangeRecorder();
        ConceptGraph graph = build(HEADER + """
                <http://example.org/x1> a skos:Concept ; skos:prefLabel "First"@en .
                <http://example.org/x1> a skos:Concept ; skos:prefLabel "Second"@en ; skos:altLabel "Extra"@en .
                """, recorder);

        assertEquals(1, graph.size());
        ConceptNode node = graph.get("http://example.org/x1");
        assertEquals(Set.of("First"), node.labels(LabelKind.PREF, "en"));
        assertTrue(node.labels(LabelKind.ALT).isEmpty());
        assertEquals(List.of("duplicate removed: http://example.org/x1"), described(recorder, ChangeCategory.DUPLICATE_REMOVED));
        assertEquals(2, recorder.conceptsProcessed());
    }

    @Test
    void duplicatesAreDetectedAcrossSpellings() {
        ChangeRecorder recorder = new ChangeRecorder();
        ConceptGraph graph = build(HEADER + """
                ex:a a skos:Concept .
                <http://example.org/a> a skos:Concept .
                """, recorder);

        assertEquals(1, graph.size());
        assertEquals(1, recorder.count(ChangeCategory.DUPLICATE_REMOVED));
    }

    @Test
    void keepsFirstSeenOrder() {
        ConceptGraph graph = build(HEADER + """
                ex:c a skos:Concept .
                ex:a a skos:Concept .
                ex:b a skos:Concept .
                ex:a a skos:Concept .
                """, new ChangeRecorder());

        List<String> ids = graph.nodes().stream().map(ConceptNode::id).toList();
        assertEquals(List.of("http://example.org/c", "http://example.org/a", "http://example.org/b"), ids);
    }

    // -----------------------------------------------------------------------
    // Classification and property dispatch
    // -----------------------------------------------------------------------

    @Test
    void firstRecognizedTypeBecomesKind() {
        ConceptGraph graph = build(HEADER + """
                ex:a a ex:Thing, skos:ConceptScheme, skos:Concept .
                ex:b ex:p "untyped" .
                """, new ChangeRecorder());

        ConceptNode a = graph.get("http://example.org/a");
        assertEquals(ConceptKind.CONCEPT_SCHEME, a.kind());
        assertTrue(a.is(ConceptKind.CONCEPT));
        assertEquals(3, a.types().size());
        assertNull(graph.get("http://example.org/b").kind());
    }

    @Test
    void dispatchesPropertiesByPredicate() {
        ConceptGraph graph = build(HEADER + """
                ex:a a skos:Concept ;
                    skos:inScheme ex:s ;
                    skos:prefLabel "Alpha"@en ;
                    skos:altLabel "A"@en, "Alef"@he ;
                    skos:broader ex:b ;
                    skos:definition "First letter"@en ;
                    ex:code "A1" .
                """, new ChangeRecorder());

        ConceptNode a = graph.get("http://example.org/a");
        assertEquals(1, a.schemeLinks(SchemeLinkKind.IN_SCHEME).size());
        assertEquals(1, a.labels(LabelKind.PREF).size());
        assertEquals(2, a.labels(LabelKind.ALT).size());
        assertEquals("http://example.org/b", a.relations(RelationKind.BROADER).iterator().next().key());
        assertEquals("First letter", a.notes(NoteKind.DEFINITION).iterator().next().text());
        assertEquals(1, a.otherProperties().size());
        assertEquals("http://example.org/code", a.otherProperties().get(0).predicate().absolute());
    }

    @Test
    void datatypedLabelIsKeptAsOtherProperty() {
        ConceptGraph graph = build(HEADER + """
                ex:a skos:prefLabel "typed"^^<http://www.w3.org/2001/XMLSchema#string> .
                """, new ChangeRecorder());

        ConceptNode a = graph.get("http://example.org/a");
        assertTrue(a.labels(LabelKind.PREF).isEmpty());
        assertEquals(1, a.otherProperties().size());
    }

    // -----------------------------------------------------------------------
    // Label corrections
    // -----------------------------------------------------------------------

    @Test
    void fixesCommaSpacingAndWhitespaceInLabels() {
        ChangeRecorder recorder = new ChangeRecorder();
        ConceptGraph graph = build(HEADER + """
                ex:a skos:prefLabel "A,B"@en ; skos:altLabel "  Foo   bar "@en .
                """, recorder);

        ConceptNode a = graph.get("http://example.org/a");
        assertEquals(Set.of("A, B"), a.labels(LabelKind.PREF, "en"));
        assertEquals(Set.of("Foo bar"), a.labels(LabelKind.ALT, "en"));
        assertTrue(described(recorder, ChangeCategory.COMMA_SPACING_FIXED).contains("comma spacing fixed: 'A,B' → 'A, B'"));
        assertEquals(1, recorder.count(ChangeCategory.WHITESPACE_NORMALIZED));
        assertEquals(2, recorder.labelsProcessed());
    }

    @Test
    void repairsMojibakeInLabelsAndNotes() {
        ChangeRecorder recorder = new ChangeRecorder();
        ConceptGraph graph = build(HEADER + """
                ex:a skos:prefLabel "KÃ¤se"@de ; skos:note "GrÃ¶ÃŸe  unverändert"@de .
                """, recorder);

        ConceptNode a = graph.get("http://example.org/a");
        assertEquals(Set.of("Käse"), a.labels(LabelKind.PREF, "de"));
        assertEquals("Größe  unverändert", a.notes(NoteKind.NOTE).iterator().next().text());
        assertEquals(2, recorder.count(ChangeCategory.ENCODING_REPAIRED));
        assertEquals(0, recorder.count(ChangeCategory.WHITESPACE_NORMALIZED));
    }

    // -----------------------------------------------------------------------
    // Identifier repairs
    // -----------------------------------------------------------------------

    @Test
    void recordsNormalizationOfPrefixedSubjects() {
        ChangeRecorder recorder = new ChangeRecorder();
        build(HEADER + "ex:a skos:related ex:b .\n", recorder);

        assertEquals(List.of("identifier normalized: 'ex:a' → '<http://example.org/a>'"),
                described(recorder, ChangeCategory.IDENTIFIER_NORMALIZED));
    }

    @Test
    void recordsBracketingOfBareWords() {
        ChangeRecorder recorder = new ChangeRecorder();
        ConceptGraph graph = build(HEADER + "@base <http://example.org/vocab/> .\nc1 a skos:Concept ; skos:broader c0 .\n", recorder);

        assertTrue(graph.contains("http://example.org/vocab/c1"));
        List<String> fixed = described(recorder, ChangeCategory.IDENTIFIER_FIXED);
        assertEquals(List.of("malformed identifier fixed: 'c1' → '<c1>'", "malformed identifier fixed: 'c0' → '<c0>'"), fixed);
    }

    @Test
    void recordsLexerRepairs() {
        ChangeRecorder recorder = new ChangeRecorder();
        build(HEADER + "< http://example.org/a > skos:related http://example.org/b .\n", recorder);

        List<String> fixed = described(recorder, ChangeCategory.IDENTIFIER_FIXED);
        assertTrue(fixed.contains("malformed identifier fixed: '< http://example.org/a >' → '<http://example.org/a>'"));
        assertTrue(fixed.contains("malformed identifier fixed: 'http://example.org/b' → '<http://example.org/b>'"));
    }

    // -----------------------------------------------------------------------
    // Chunking
    // -----------------------------------------------------------------------

    @Test
    void chunkedBuildMatchesUnchunked() {
        String text = HEADER + """
                ex:a a skos:Concept ; skos:prefLabel "A"@en .
                ex:b a skos:Concept ; skos:prefLabel "B"@en ; skos:broader ex:a .
                ex:a a skos:Concept .
                ex:c a skos:Concept ; skos:prefLabel "C"@en .
                """;
        ChangeRecorder plain = new ChangeRecorder();
        ConceptGraph whole = build(text, plain);
        ChangeRecorder chunkedRecorder = new ChangeRecorder();
        ConceptGraph chunked = new ConceptGraphBuilder(chunkedRecorder)
                .build(StatementReader.of(text, chunkedRecorder), true, 2);

        assertEquals(whole.nodes().stream().map(ConceptNode::id).toList(),
                chunked.nodes().stream().map(ConceptNode::id).toList());
        assertEquals(plain.changes(), chunkedRecorder.changes());
    }

    @Test
    void rejectsNonPositiveChunkSize() {
        ChangeRecorder recorder = new ChangeRecorder();
        ConceptGraphBuilder builder = new ConceptGraphBuilder(recorder);
        assertThrows(IllegalArgumentException.class,
                () -> builder.build(StatementReader.of("", recorder), true, 0));
    }
}
