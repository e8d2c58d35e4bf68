package no.cantara.skos.model;

/**
 * Lexical label properties. Declaration order is the emission order.
 */
public enum LabelKind {
    PREF("prefLabel"),
    ALT("altLabel"),
    HIDDEN("hiddenLabel");

    private final String localName;

    LabelKind(String localName) {
        this.localName = localName;
    }

    public String localName() {
        return localName;
    }

    public String iri() {
        return Skos.NS + localName;
    }

    public static LabelKind fromIri(String iri) {
        for (LabelKind kind : values()) {
            if (kind.iri().equals(iri)) return kind;
        }
        return null;
    }
}
