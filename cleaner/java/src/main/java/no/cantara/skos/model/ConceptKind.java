package no.cantara.skos.model;

/**
 * The three mutually exclusive node classifications of a SKOS vocabulary.
 */
public enum ConceptKind {
    CONCEPT("Concept"),
    CONCEPT_SCHEME("ConceptScheme"),
    COLLECTION("Collection");

    private final String localName;

    ConceptKind(String localName) {
        this.localName = localName;
    }

    public String localName() {
        return localName;
    }

    public String iri() {
        return Skos.NS + localName;
    }

    /**
     * Maps a type IRI to its classification. {@code skos:OrderedCollection} is a Collection.
     *
     * @return the kind, or {@code null} when the type is not one of the SKOS classes
     */
    public static ConceptKind fromIri(String iri) {
        if (iri == null || !iri.startsWith(Skos.NS)) return null;
        String local = iri.substring(Skos.NS.length());
        if ("OrderedCollection".equals(local)) return COLLECTION;
        for (ConceptKind kind : values()) {
            if (kind.localName.equals(local)) return kind;
        }
        return null;
    }
}
