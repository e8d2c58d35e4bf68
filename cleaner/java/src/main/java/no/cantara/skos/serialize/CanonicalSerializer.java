package no.cantara.skos.serialize;

import no.cantara.skos.model.ConceptGraph;
import no.cantara.skos.model.ConceptNode;
import no.cantara.skos.model.DocumentHeader;
import no.cantara.skos.model.LabelKind;
import no.cantara.skos.model.Literal;
import no.cantara.skos.model.NoteKind;
import no.cantara.skos.model.PropertyValues;
import no.cantara.skos.model.Reference;
import no.cantara.skos.model.RelationKind;
import no.cantara.skos.model.SchemeLinkKind;
import no.cantara.skos.model.Skos;
import no.cantara.skos.model.Term;
import no.cantara.skos.model.TurtleText;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Writes a {@link ConceptGraph} as canonical Turtle.
 *
 * <p>Directives come first, in the order they were declared. Then one block per node in
 * first-seen order, with properties in a fixed order: types, scheme links, labels
 * (pref, alt, hidden), relations, documentation, everything else. All values of a property
 * go on one line.
 *
 * <p>Predicates and types are compacted with the prefix table where possible. Identifiers
 * under the base are written relative, other resolved identifiers in full, and unresolved
 * names as they were read.
 */
public final class CanonicalSerializer {

    private static final Logger log = LoggerFactory.getLogger(CanonicalSerializer.class);

    private static final String INDENT = "    ";

    private final DocumentHeader header;

    private CanonicalSerializer(DocumentHeader header) {
        this.header = header;
    }

    public static String serialize(ConceptGraph graph) {
        return new CanonicalSerializer(graph.header()).write(graph);
    }

    private String write(ConceptGraph graph) {
        StringBuilder out = new StringBuilder();
        writeDirectives(out);
        int written = 0;
        for (ConceptNode node : graph.nodes()) {
            List<String> lines = propertyLines(node);
            if (lines.isEmpty()) {
                log.debug("Node {} has no properties left; not written", node.id());
                continue;
            }
            if (out.length() > 0) out.append('\n');
            out.append(identifier(node.subject())).append(' ').append(lines.get(0));
            for (int i = 1; i < lines.size(); i++) {
                out.append(" ;\n").append(INDENT).append(lines.get(i));
            }
            out.append(" .\n");
            written++;
        }
        log.debug("Serialized {} blocks", written);
        return out.toString();
    }

    private void writeDirectives(StringBuilder out) {
        int position = 0;
        for (Map.Entry<String, String> e : header.prefixes().entrySet()) {
            if (position++ == header.basePosition()) writeBase(out);
            out.append("@prefix ").append(e.getKey()).append(": <").append(e.getValue()).append("> .\n");
        }
        if (header.basePosition() >= header.prefixes().size()) writeBase(out);
    }

    private void writeBase(StringBuilder out) {
        if (header.base() != null) {
            out.append("@base <").append(header.base()).append("> .\n");
        }
    }

    // ── properties ────────────────────────────────────────────────────────────────

    private List<String> propertyLines(ConceptNode node) {
        List<String> lines = new ArrayList<>();
        if (!node.types().isEmpty()) {
            lines.add("a " + node.types().stream().map(this::compacted).collect(Collectors.joining(", ")));
        }
        for (SchemeLinkKind link : SchemeLinkKind.values()) {
            addReferences(lines, link.iri(), node.schemeLinks(link));
        }
        for (LabelKind kind : LabelKind.values()) {
            List<Literal> labels = node.labels(kind);
            if (!labels.isEmpty()) {
                lines.add(predicate(kind.iri()) + " " + labels.stream().map(this::literal).collect(Collectors.joining(", ")));
            }
        }
        for (RelationKind relation : RelationKind.values()) {
            addReferences(lines, relation.iri(), node.relations(relation));
        }
        for (NoteKind note : NoteKind.values()) {
            if (!node.notes(note).isEmpty()) {
                lines.add(predicate(note.iri()) + " " + node.notes(note).stream().map(this::literal).collect(Collectors.joining(", ")));
            }
        }
        for (PropertyValues property : node.otherProperties()) {
            lines.add(predicate(property.predicate()) + " "
                    + property.values().stream().map(this::value).collect(Collectors.joining(", ")));
        }
        return lines;
    }

    private void addReferences(List<String> lines, String predicate, Collection<Reference> targets) {
        if (targets.isEmpty()) return;
        lines.add(predicate(predicate) + " " + targets.stream().map(r -> value(r.term())).collect(Collectors.joining(", ")));
    }

    // ── terms ─────────────────────────────────────────────────────────────────────

    private String predicate(Term predicate) {
        if (Skos.RDF_TYPE.equals(predicate.absolute())) return "a";
        return predicate.absolute() != null ? predicate(predicate.absolute()) : predicate.written();
    }

    private String predicate(String iri) {
        return header.compact(iri).orElse("<" + iri + ">");
    }

    /** Type objects: compacted where a prefix covers them, otherwise like any identifier. */
    private String compacted(Term type) {
        if (type.absolute() != null) {
            return header.compact(type.absolute()).orElseGet(() -> identifier(type));
        }
        return type.written();
    }

    private String value(Term term) {
        return term.isIdentifier() ? identifier(term) : term.written();
    }

    private String identifier(Term term) {
        if (term.kind() == Term.Kind.BLANK_NODE || term.absolute() == null) {
            return term.written();
        }
        return "<" + header.shortForm(term.absolute()) + ">";
    }

    private String literal(Literal literal) {
        if (literal.datatype() != null) {
            return literal.toTerm().written();
        }
        return TurtleText.quote(literal.text()) + (literal.language() == null ? "" : "@" + literal.language());
    }
}
