package no.cantara.skos.model;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * The deduplicated vocabulary: document header plus nodes in first-seen order.
 */
public final class ConceptGraph {

    private final DocumentHeader header;
    private final Map<String, ConceptNode> nodes;

    public ConceptGraph(DocumentHeader header, Map<String, ConceptNode> nodes) {
        this.header = header;
        this.nodes = Collections.unmodifiableMap(new LinkedHashMap<>(nodes));
    }

    public DocumentHeader header() {
        return header;
    }

    public Collection<ConceptNode> nodes() {
        return nodes.values();
    }

    public ConceptNode get(String id) {
        return nodes.get(id);
    }

    public boolean contains(String id) {
        return nodes.containsKey(id);
    }

    public int size() {
        return nodes.size();
    }

    /**
     * A node identifier for messages: {@code <short-form>} for absolute IRIs, otherwise the
     * identifier as written.
     */
    public String display(String id) {
        return IdentifierResolver.hasScheme(id) ? header.display(id) : id;
    }
}
