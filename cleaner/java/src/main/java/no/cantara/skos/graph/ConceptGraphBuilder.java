package no.cantara.skos.graph;

import no.cantara.skos.model.ChangeCategory;
import no.cantara.skos.model.ConceptGraph;
import no.cantara.skos.model.ConceptKind;
import no.cantara.skos.model.ConceptNode;
import no.cantara.skos.model.LabelKind;
import no.cantara.skos.model.Literal;
import no.cantara.skos.model.NoteKind;
import no.cantara.skos.model.PropertyValues;
import no.cantara.skos.model.Reference;
import no.cantara.skos.model.RelationKind;
import no.cantara.skos.model.SchemeLinkKind;
import no.cantara.skos.model.Skos;
import no.cantara.skos.model.Term;
import no.cantara.skos.reader.PropertyEntry;
import no.cantara.skos.reader.Statement;
import no.cantara.skos.reader.StatementReader;
import no.cantara.skos.reader.SubjectBlock;
import no.cantara.skos.report.ChangeRecorder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Turns a statement sequence into a {@link ConceptGraph}.
 *
 * <p>The first block for an identifier wins. Later blocks for the same identifier are
 * discarded whole, without merging any of their properties, and recorded as
 * {@link ChangeCategory#DUPLICATE_REMOVED}.
 */
public class ConceptGraphBuilder {

    private static final Logger log = LoggerFactory.getLogger(ConceptGraphBuilder.class);

    private final ChangeRecorder recorder;
    private final Map<String, ConceptNode> nodes = new LinkedHashMap<>();
    private int order;

    public ConceptGraphBuilder(ChangeRecorder recorder) {
        this.recorder = recorder;
    }

    /**
     * Consumes the reader and builds the graph.
     *
     * @param memoryEfficient when {@code true}, statements are pulled and processed
     *                        {@code chunkSize} at a time instead of being read up front
     * @param chunkSize       batch size in memory-efficient mode; must be positive
     */
    public ConceptGraph build(StatementReader statements, boolean memoryEfficient, int chunkSize) {
        if (chunkSize <= 0) {
            throw new IllegalArgumentException("chunkSize must be positive, was " + chunkSize);
        }
        if (memoryEfficient) {
            List<Statement> batch = new ArrayList<>(Math.min(chunkSize, 4096));
            int chunks = 0;
            while (statements.hasNext()) {
                batch.add(statements.next());
                if (batch.size() == chunkSize || !statements.hasNext()) {
                    chunks++;
                    log.debug("Processing chunk {} ({} statements)", chunks, batch.size());
                    batch.forEach(this::accept);
                    batch.clear();
                }
            }
        } else {
            List<Statement> all = new ArrayList<>();
            statements.forEachRemaining(all::add);
            log.debug("Read {} statements", all.size());
            all.forEach(this::accept);
        }
        ConceptGraph graph = new ConceptGraph(statements.header(), nodes);
        log.info("Built graph with {} nodes from {} blocks", graph.size(), recorder.conceptsProcessed());
        return graph;
    }

    void accept(Statement statement) {
        if (statement instanceof SubjectBlock block) {
            accept(block);
        }
    }

    private void accept(SubjectBlock block) {
        recorder.conceptProcessed();
        Term subject = block.subject();
        String id = subject.key();
        if (nodes.containsKey(id)) {
            log.debug("Duplicate block for {} at line {} discarded", id, block.line());
            recorder.record(ChangeCategory.DUPLICATE_REMOVED, sourceName(subject));
            return;
        }
        ConceptNode node = new ConceptNode(id, subject, order++);
        nodes.put(id, node);
        identifierRepairs(subject, true);
        for (PropertyEntry property : block.properties()) {
            property(node, property);
        }
    }

    private void property(ConceptNode node, PropertyEntry entry) {
        String predicate = entry.predicate().absolute();
        List<Term> leftovers = new ArrayList<>();

        LabelKind labelKind = LabelKind.fromIri(predicate);
        RelationKind relation = RelationKind.fromIri(predicate);
        SchemeLinkKind schemeLink = SchemeLinkKind.fromIri(predicate);
        NoteKind note = NoteKind.fromIri(predicate);

        if (Skos.RDF_TYPE.equals(predicate)) {
            for (Term value : entry.values()) {
                if (value.isIdentifier()) {
                    node.addType(value, ConceptKind.fromIri(value.absolute()));
                } else {
                    leftovers.add(value);
                }
            }
        } else if (labelKind != null) {
            for (Term value : entry.values()) {
                if (value.isLiteral() && value.datatype() == null) {
                    recorder.labelProcessed();
                    node.addLabel(labelKind, value.language(), LabelTextCorrector.correctLabel(value.lexical(), recorder));
                } else {
                    leftovers.add(value);
                }
            }
        } else if (relation != null) {
            for (Term value : entry.values()) {
                identifierRepairs(value, false);
                node.addRelation(relation, Reference.of(value));
            }
        } else if (schemeLink != null) {
            for (Term value : entry.values()) {
                identifierRepairs(value, false);
                node.addSchemeLink(schemeLink, Reference.of(value));
            }
        } else if (note != null) {
            for (Term value : entry.values()) {
                if (value.isLiteral()) {
                    String text = LabelTextCorrector.correctNote(value.lexical(), recorder);
                    node.addNote(note, new Literal(text, value.language(), value.datatype()));
                } else {
                    leftovers.add(value);
                }
            }
        } else {
            leftovers.addAll(entry.values());
        }

        if (!leftovers.isEmpty()) {
            node.addOtherProperty(new PropertyValues(entry.predicate(), leftovers));
        }
    }

    private void identifierRepairs(Term term, boolean subject) {
        if (term.repairedFrom() != null) {
            recorder.record(ChangeCategory.IDENTIFIER_FIXED, term.repairedFrom(), term.written());
        } else if (term.kind() == Term.Kind.BARE_WORD && term.absolute() != null) {
            recorder.record(ChangeCategory.IDENTIFIER_FIXED, term.lexical(), "<" + term.lexical() + ">");
        } else if (subject && term.kind() == Term.Kind.PREFIXED_NAME && term.absolute() != null) {
            recorder.record(ChangeCategory.IDENTIFIER_NORMALIZED, term.lexical(), "<" + term.absolute() + ">");
        }
    }

    /** The identifier as written, without angle brackets. */
    private static String sourceName(Term subject) {
        return subject.kind() == Term.Kind.IRI ? subject.lexical() : subject.written();
    }
}
