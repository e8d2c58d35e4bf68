package no.cantara.skos.model;

/**
 * Every check the cleaner can report, with its default severity.
 *
 * <p>Numbered checks carry the id of the corresponding SKOS integrity condition.
 */
public enum CheckId {
    S14("Not more than one prefLabel per language tag", Severity.VIOLATION),
    S13("Disjoint label properties", Severity.VIOLATION),
    S27("related disjoint with broaderTransitive", Severity.VIOLATION),
    S9("ConceptScheme disjoint with Concept", Severity.VIOLATION),
    S37("Collection disjoint with Concept", Severity.VIOLATION),
    IDENTIFIER_SYNTAX("Identifier syntax", Severity.VIOLATION),
    LANGUAGE_TAG("Language tag well-formed", Severity.WARNING),
    LABEL_TOO_LONG("Label length", Severity.WARNING),
    LABEL_EMPTY("Empty label", Severity.WARNING),
    LABEL_LOOKS_LIKE_URI("Label looks like a URI", Severity.WARNING),
    MISSING_PREF_LABEL("Concept without prefLabel", Severity.WARNING),
    SCHEME_TOP_CONCEPT_NOT_IN_SCHEME("topConceptOf implies inScheme", Severity.VIOLATION),
    SCHEME_TOP_CONCEPT_UNKNOWN("hasTopConcept refers to a known Concept", Severity.VIOLATION),
    SCHEME_TOP_CONCEPT_MISSING_IN_SCHEME("hasTopConcept target is inScheme", Severity.VIOLATION),
    XL_LABEL_CONFLICT("SKOS-XL label resource is also a Concept", Severity.WARNING),
    XL_LABEL_ORPHANED("SKOS-XL label not referenced by any concept", Severity.WARNING),
    HIERARCHY_MISSING_BROADER("Missing broader to inferred parent", Severity.WARNING),
    HIERARCHY_CYCLE("broader cycle", Severity.WARNING),
    HIERARCHY_MISSING_NARROWER("broader without mirrored narrower", Severity.INFO),
    HIERARCHY_GAP("Missing intermediate hierarchy level", Severity.INFO);

    private final String title;
    private final Severity severity;

    CheckId(String title, Severity severity) {
        this.title = title;
        this.severity = severity;
    }

    public String id() {
        return name();
    }

    public String title() {
        return title;
    }

    public Severity severity() {
        return severity;
    }
}
