package no.cantara.skos.model;

/**
 * A documentation text value.
 *
 * @param text     the text
 * @param language language tag, verbatim, or {@code null} when untagged
 * @param datatype datatype term, or {@code null}
 */
public record Literal(String text, String language, Term datatype) {

    public Term toTerm() {
        return Term.literal(text, language, datatype);
    }
}
