package no.cantara.skos.model;

/**
 * A syntactic RDF term as read from the document.
 *
 * @param kind         what the term was written as
 * @param lexical      IRI content without brackets, prefixed name or word as written,
 *                     unescaped literal text, or verbatim text of a raw term
 * @param absolute     resolved absolute IRI of an identifier term, or {@code null} when it
 *                     cannot be resolved (and always for literals, blank nodes and raw terms)
 * @param language     language tag of a literal, verbatim, or {@code null}
 * @param datatype     datatype of a literal, or {@code null}
 * @param repairedFrom original spelling when the reader repaired the term, else {@code null}
 */
public record Term(
        Kind kind,
        String lexical,
        String absolute,
        String language,
        Term datatype,
        String repairedFrom
) {

    public enum Kind { IRI, PREFIXED_NAME, BARE_WORD, BLANK_NODE, LITERAL, RAW }

    public static Term iri(String lexical, String absolute) {
        return new Term(Kind.IRI, lexical, absolute, null, null, null);
    }

    public static Term iri(String lexical, String absolute, String repairedFrom) {
        return new Term(Kind.IRI, lexical, absolute, null, null, repairedFrom);
    }

    public static Term prefixedName(String lexical, String absolute) {
        return new Term(Kind.PREFIXED_NAME, lexical, absolute, null, null, null);
    }

    public static Term bareWord(String lexical, String absolute) {
        return new Term(Kind.BARE_WORD, lexical, absolute, null, null, null);
    }

    public static Term blankNode(String lexical) {
        return new Term(Kind.BLANK_NODE, lexical, null, null, null, null);
    }

    public static Term literal(String text, String language, Term datatype) {
        return new Term(Kind.LITERAL, text, null, language, datatype, null);
    }

    /** Text kept verbatim: nested {@code [...]}/{@code (...)} constructs, numbers and booleans. */
    public static Term raw(String text) {
        return new Term(Kind.RAW, text, null, null, null, null);
    }

    public boolean isIdentifier() {
        return kind == Kind.IRI || kind == Kind.PREFIXED_NAME || kind == Kind.BARE_WORD || kind == Kind.BLANK_NODE;
    }

    public boolean isLiteral() {
        return kind == Kind.LITERAL;
    }

    /** The absolute IRI when resolved, otherwise the written form. Used as identity. */
    public String key() {
        return absolute != null ? absolute : written();
    }

    /** The term as it appears in Turtle source, after any lexer repair. */
    public String written() {
        return switch (kind) {
            case IRI -> "<" + lexical + ">";
            case LITERAL -> {
                String quoted = TurtleText.quote(lexical);
                if (language != null) yield quoted + "@" + language;
                if (datatype != null) yield quoted + "^^" + datatype.written();
                yield quoted;
            }
            default -> lexical;
        };
    }
}
