package no.cantara.skos.model;

/**
 * Properties linking concepts and concept schemes.
 */
public enum SchemeLinkKind {
    IN_SCHEME("inScheme"),
    TOP_CONCEPT_OF("topConceptOf"),
    HAS_TOP_CONCEPT("hasTopConcept");

    private final String localName;

    SchemeLinkKind(String localName) {
        this.localName = localName;
    }

    public String localName() {
        return localName;
    }

    public String iri() {
        return Skos.NS + localName;
    }

    public static SchemeLinkKind fromIri(String iri) {
        for (SchemeLinkKind kind : values()) {
            if (kind.iri().equals(iri)) return kind;
        }
        return null;
    }
}
