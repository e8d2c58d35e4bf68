package no.cantara.skos.reader;

public record PrefixDirective(String prefix, String namespace, int line) implements Statement {
}
