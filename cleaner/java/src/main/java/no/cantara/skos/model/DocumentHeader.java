package no.cantara.skos.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Base IRI and prefix bindings of a document.
 *
 * @param base         the base IRI, or {@code null}
 * @param prefixes     prefix to namespace, in first-declaration order with last-declared values
 * @param basePosition number of distinct prefixes declared before the base directive
 */
public record DocumentHeader(String base, Map<String, String> prefixes, int basePosition) {

    private static final Pattern LOCAL_NAME = Pattern.compile("^([A-Za-z0-9_]([A-Za-z0-9_.\\-]*[A-Za-z0-9_\\-])?)?$");

    public DocumentHeader {
        prefixes = prefixes != null
                ? Collections.unmodifiableMap(new LinkedHashMap<>(prefixes))
                : Map.of();
    }

    public Optional<String> relativize(String absolute) {
        return IdentifierResolver.relativize(base, absolute);
    }

    /**
     * Compacts an IRI to {@code prefix:local} using the first binding whose namespace it starts
     * with and whose remainder is a plain local name.
     */
    public Optional<String> compact(String iri) {
        for (Map.Entry<String, String> e : prefixes.entrySet()) {
            String ns = e.getValue();
            if (iri.startsWith(ns) && LOCAL_NAME.matcher(iri.substring(ns.length())).matches()) {
                return Optional.of(e.getKey() + ":" + iri.substring(ns.length()));
            }
        }
        return Optional.empty();
    }

    /** Short form for messages and change records: base-relative when possible, else absolute. */
    public String shortForm(String iri) {
        return relativize(iri).orElse(iri);
    }

    /** {@link #shortForm} in angle brackets. */
    public String display(String iri) {
        return "<" + shortForm(iri) + ">";
    }

    /**
     * Collects directives while a document is read. Prefix redeclarations keep their first
     * position and take the latest namespace.
     */
    public static final class Builder {
        private String base;
        private int basePosition;
        private final Map<String, String> prefixes = new LinkedHashMap<>();

        public Builder base(String base) {
            if (this.base == null) {
                basePosition = prefixes.size();
            }
            this.base = base;
            return this;
        }

        public Builder prefix(String prefix, String namespace) {
            prefixes.put(prefix, namespace);
            return this;
        }

        public String base() {
            return base;
        }

        public String namespace(String prefix) {
            return prefixes.get(prefix);
        }

        public DocumentHeader build() {
            return new DocumentHeader(base, prefixes, basePosition);
        }
    }
}
