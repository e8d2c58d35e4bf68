package no.cantara.skos.model;

/**
 * Documentation properties.
 */
public enum NoteKind {
    DEFINITION("definition"),
    SCOPE_NOTE("scopeNote"),
    NOTE("note"),
    EXAMPLE("example"),
    EDITORIAL_NOTE("editorialNote"),
    HISTORY_NOTE("historyNote"),
    CHANGE_NOTE("changeNote");

    private final String localName;

    NoteKind(String localName) {
        this.localName = localName;
    }

    public String localName() {
        return localName;
    }

    public String iri() {
        return Skos.NS + localName;
    }

    public static NoteKind fromIri(String iri) {
        for (NoteKind kind : values()) {
            if (kind.iri().equals(iri)) return kind;
        }
        return null;
    }
}
