package no.cantara.skos.validation;

import no.cantara.skos.graph.ConceptGraphBuilder;
import no.cantara.skos.model.CheckId;
import no.cantara.skos.model.ConceptGraph;
import no.cantara.skos.model.Finding;
import no.cantara.skos.model.Severity;
import no.cantara.skos.reader.StatementReader;
import no.cantara.skos.report.ChangeRecorder;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class IntegrityValidatorTest {

    private static final String HEADER = """
            @prefix skos: <http://www.w3.org/2004/02/skos/core#> .
            @prefix skosxl: <http://www.w3.org/2008/05/skos-xl#> .
            """;

    private static ConceptGraph graph(String text) {
        ChangeRecorder recorder = new ChangeRecorder();
        return new ConceptGraphBuilder(recorder).build(StatementReader.of(HEADER + text, recorder), false, 1000);
    }

    private static List<Finding> validate(String text) {
        return IntegrityValidator.defaultRules(IntegrityValidator.DEFAULT_MAX_LABEL_LENGTH, false).run(graph(text));
    }

    private static List<Finding> of(List<Finding> findings, CheckId check) {
        return findings.stream().filter(f -> f.check() == check).toList();
    }

    @Test
    void wellFormedVocabularyHasNoFindings() {
        List<Finding> findings = validate("""
                <s> a skos:ConceptScheme ; skos:prefLabel "Scheme"@en ; skos:hasTopConcept <a> .
                <a> a skos:Concept ; skos:inScheme <s> ; skos:topConceptOf <s> ;
                    skos:prefLabel "Alpha"@en, "Alfa"@nb ; skos:altLabel "A"@en ; skos:related <b> .
                <b> a skos:Concept ; skos:inScheme <s> ; skos:prefLabel "Beta"@en .
                """);

        assertTrue(findings.isEmpty(), () -> "unexpected: " + findings);
    }

    // -----------------------------------------------------------------------
    // SKOS integrity conditions
    // -----------------------------------------------------------------------

    @Test
    void twoPrefLabelsInOneLanguageViolateS14() {
        List<Finding> s14 = of(validate("<x2> a skos:Concept ; skos:prefLabel \"One\"@en, \"Uno\"@en .\n"), CheckId.S14);

        assertEquals(1, s14.size());
        assertEquals(Severity.VIOLATION, s14.get(0).severity());
        assertEquals(List.of("<x2>"), s14.get(0).subjects());
        assertTrue(s14.get(0).toString().startsWith("[S14] <x2> has 2 prefLabels for language 'en'"));
    }

    @Test
    void prefLabelsWithoutLanguageTagCountAsOneLanguage() {
        List<Finding> s14 = of(validate("<a> a skos:Concept ; skos:prefLabel \"One\", \"Two\" .\n"), CheckId.S14);

        assertEquals(1, s14.size());
        assertTrue(s14.get(0).message().contains("no language tag"));
    }

    @Test
    void sameTextUnderTwoLabelKindsViolatesS13() {
        List<Finding> s13 = of(validate("""
                <a> a skos:Concept ; skos:prefLabel "Same"@en ; skos:altLabel "Same"@en, "Same"@de .
                """), CheckId.S13);

        assertEquals(1, s13.size());
        assertTrue(s13.get(0).message().contains("prefLabel and altLabel"));
    }

    @Test
    void relatedAndBroaderToSameTargetViolateS27() {
        List<Finding> s27 = of(validate("""
                <a> a skos:Concept ; skos:prefLabel "A" ; skos:broader <b> ; skos:related <b> .
                <c> a skos:Concept ; skos:prefLabel "C" ; skos:broaderTransitive <b> ; skos:related <b> .
                <b> a skos:Concept ; skos:prefLabel "B" .
                """), CheckId.S27);

        assertEquals(2, s27.size());
        assertEquals(List.of("<a>", "<b>"), s27.get(0).subjects());
        assertTrue(s27.get(1).message().contains("broaderTransitive"));
    }

    @Test
    void conceptThatIsAlsoSchemeOrCollectionViolatesS9AndS37() {
        List<Finding> findings = validate("""
                <a> a skos:Concept, skos:ConceptScheme ; skos:prefLabel "A" .
                <b> a skos:Collection, skos:Concept ; skos:prefLabel "B" .
                """);

        assertEquals(1, of(findings, CheckId.S9).size());
        assertEquals(1, of(findings, CheckId.S37).size());
        assertEquals(List.of("<b>"), of(findings, CheckId.S37).get(0).subjects());
    }

    // -----------------------------------------------------------------------
    // Identifier and label checks
    // -----------------------------------------------------------------------

    @Test
    void reportsUndeclaredPrefixAndMalformedTargets() {
        List<Finding> findings = of(validate("""
                ex:a a skos:Concept ; skos:prefLabel "A" .
                <b> a skos:Concept ; skos:prefLabel "B" ; skos:related <has space> .
                """), CheckId.IDENTIFIER_SYNTAX);

        assertEquals(2, findings.size());
        assertTrue(findings.get(0).message().contains("undeclared prefix 'ex'"));
        assertTrue(findings.get(1).message().contains("malformed identifier <has space>"));
    }

    @Test
    void bareWordAndBracketedRelativeIdentifiersAreTreatedAlike() {
        List<Finding> bare = of(validate("""
                x1 a skos:Concept ; skos:prefLabel "X"@en ; skos:broader x0 .
                """), CheckId.IDENTIFIER_SYNTAX);
        List<Finding> bracketed = of(validate("""
                <x1> a skos:Concept ; skos:prefLabel "X"@en ; skos:broader <x0> .
                """), CheckId.IDENTIFIER_SYNTAX);

        assertTrue(bare.isEmpty(), () -> "unexpected: " + bare);
        assertTrue(bracketed.isEmpty(), () -> "unexpected: " + bracketed);
    }

    @Test
    void flagsMalformedLanguageTags() {
        List<Finding> findings = of(validate("""
                <a> a skos:Concept ; skos:prefLabel "A"@e ; skos:altLabel "AA"@e, "B"@en-GB ;
                    skos:definition "Def"@toolonglanguage .
                """), CheckId.LANGUAGE_TAG);

        assertEquals(2, findings.size());
        assertEquals(Severity.WARNING, findings.get(0).severity());
        assertTrue(findings.get(0).message().contains("'e'"));
        assertTrue(findings.get(1).message().contains("'toolonglanguage'"));
    }

    @Test
    void acceptsCommonBcp47Tags() {
        for (String tag : List.of("en", "en-GB", "zh-Hant-TW", "de-CH-1996", "sr-Latn", "es-419", "x-private", "nb")) {
            assertTrue(LanguageTagRule.isWellFormed(tag), tag);
        }
        for (String tag : List.of("e", "english-", "en--GB", "123")) {
            assertFalse(LanguageTagRule.isWellFormed(tag), tag);
        }
    }

    @Test
    void flagsEmptyLongAndUriLikeLabels() {
        List<Finding> findings = IntegrityValidator.defaultRules(20, false).run(graph("""
                <a> a skos:Concept ;
                    skos:prefLabel "http://example.org/a"@en ;
                    skos:altLabel ""@en, "A label far longer than twenty characters"@en .
                """));

        assertEquals(1, of(findings, CheckId.LABEL_EMPTY).size());
        assertEquals(1, of(findings, CheckId.LABEL_LOOKS_LIKE_URI).size());
        List<Finding> tooLong = of(findings, CheckId.LABEL_TOO_LONG);
        assertEquals(1, tooLong.size());
        assertTrue(tooLong.get(0).message().contains("(41 chars)"));
    }

    @Test
    void longLabelSnippetIsCappedAtFiftyCharacters() {
        String label = "x".repeat(80);
        List<Finding> tooLong = of(IntegrityValidator.defaultRules(60, false).run(graph(
                "<a> a skos:Concept ; skos:prefLabel \"" + label + "\" .\n")), CheckId.LABEL_TOO_LONG);

        assertTrue(tooLong.get(0).message().endsWith(": '" + "x".repeat(50) + "...'"));
    }

    @Test
    void conceptWithoutPrefLabelIsWarned() {
        List<Finding> findings = validate("""
                <a> a skos:Concept ; skos:altLabel "A" .
                <s> a skos:ConceptScheme .
                """);

        List<Finding> missing = of(findings, CheckId.MISSING_PREF_LABEL);
        assertEquals(1, missing.size());
        assertEquals(List.of("<a>"), missing.get(0).subjects());
    }

    // -----------------------------------------------------------------------
    // Scheme consistency
    // -----------------------------------------------------------------------

    @Test
    void checksTopConceptLinksAgainstSchemeMembership() {
        List<Finding> findings = validate("""
                <s> a skos:ConceptScheme ; skos:hasTopConcept <a>, <b>, <nowhere> .
                <a> a skos:Concept ; skos:prefLabel "A" ; skos:topConceptOf <s> .
                <b> a skos:Concept ; skos:prefLabel "B" ; skos:inScheme <s> .
                """);

        assertEquals(1, of(findings, CheckId.SCHEME_TOP_CONCEPT_NOT_IN_SCHEME).size());
        assertEquals(1, of(findings, CheckId.SCHEME_TOP_CONCEPT_UNKNOWN).size());
        List<Finding> missing = of(findings, CheckId.SCHEME_TOP_CONCEPT_MISSING_IN_SCHEME);
        assertEquals(1, missing.size());
        assertEquals(List.of("<a>", "<s>"), missing.get(0).subjects());
    }

    // -----------------------------------------------------------------------
    // SKOS-XL
    // -----------------------------------------------------------------------

    @Test
    void extendedLabelRulesRunOnlyWhenEnabled() {
        String text = """
                <a> a skos:Concept ; skos:prefLabel "A" ; skosxl:prefLabel <b> .
                <b> a skos:Concept ; skos:prefLabel "B" .
                <l1> a skosxl:Label ; skosxl:literalForm "Orphan"@en .
                """;

        assertEquals(0, IntegrityValidator.defaultRules(500, false).rules().stream()
                .filter(r -> r instanceof ExtendedLabelRule).count());

        List<Finding> findings = IntegrityValidator.defaultRules(500, true).run(graph(text));
        List<Finding> conflicts = of(findings, CheckId.XL_LABEL_CONFLICT);
        assertEquals(1, conflicts.size());
        assertEquals(List.of("<a>", "<b>"), conflicts.get(0).subjects());
        List<Finding> orphans = of(findings, CheckId.XL_LABEL_ORPHANED);
        assertEquals(1, orphans.size());
        assertEquals(List.of("<l1>"), orphans.get(0).subjects());
    }

    @Test
    void findingsFollowRuleOrder() {
        List<Finding> findings = validate("""
                <a> a skos:Concept, skos:Collection ; skos:prefLabel "One"@en, "Two"@en ; skos:altLabel "One"@en .
                """);

        assertEquals(List.of(CheckId.S14, CheckId.S13, CheckId.S37),
                findings.stream().map(Finding::check).toList());
    }
}
