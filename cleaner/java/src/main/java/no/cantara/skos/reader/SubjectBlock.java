package no.cantara.skos.reader;

import no.cantara.skos.model.Term;

import java.util.List;

/**
 * A subject with its properties in source order.
 */
public record SubjectBlock(Term subject, List<PropertyEntry> properties, int line) implements Statement {
    public SubjectBlock {
        properties = List.copyOf(properties);
    }
}
