package no.cantara.skos.model;

/**
 * Semantic relations and mapping properties between concepts. Declaration order is the
 * emission order.
 */
public enum RelationKind {
    BROADER("broader"),
    NARROWER("narrower"),
    RELATED("related"),
    BROADER_TRANSITIVE("broaderTransitive"),
    NARROWER_TRANSITIVE("narrowerTransitive"),
    EXACT_MATCH("exactMatch"),
    CLOSE_MATCH("closeMatch"),
    BROAD_MATCH("broadMatch"),
    NARROW_MATCH("narrowMatch");

    private final String localName;

    RelationKind(String localName) {
        this.localName = localName;
    }

    public String localName() {
        return localName;
    }

    public String iri() {
        return Skos.NS + localName;
    }

    public static RelationKind fromIri(String iri) {
        for (RelationKind kind : values()) {
            if (kind.iri().equals(iri)) return kind;
        }
        return null;
    }
}
