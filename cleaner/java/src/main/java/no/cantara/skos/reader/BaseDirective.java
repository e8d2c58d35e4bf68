package no.cantara.skos.reader;

public record BaseDirective(String iri, int line) implements Statement {
}
