package no.cantara.skos.model;

import java.util.List;

/**
 * A property the cleaner does not interpret, kept verbatim for output.
 */
public record PropertyValues(Term predicate, List<Term> values) {
    public PropertyValues {
        values = values != null ? List.copyOf(values) : List.of();
    }
}
