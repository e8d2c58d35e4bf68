package no.cantara.skos.model;

import java.util.Objects;

/**
 * An identifier value of a relation or scheme link. Two references are equal when they
 * resolve to the same key, however they were written.
 */
public record Reference(Term term) {

    public Reference {
        Objects.requireNonNull(term, "term");
    }

    public static Reference of(Term term) {
        return new Reference(term);
    }

    public String key() {
        return term.key();
    }

    public String absolute() {
        return term.absolute();
    }

    public String written() {
        return term.written();
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof Reference other && key().equals(other.key());
    }

    @Override
    public int hashCode() {
        return key().hashCode();
    }

    @Override
    public String toString() {
        return written();
    }
}
