package no.cantara.skos.reader;

import no.cantara.skos.model.Term;

import java.util.List;

/**
 * A predicate with every value given for it in one place, comma continuations included.
 */
public record PropertyEntry(Term predicate, List<Term> values) {
    public PropertyEntry {
        values = List.copyOf(values);
    }
}
