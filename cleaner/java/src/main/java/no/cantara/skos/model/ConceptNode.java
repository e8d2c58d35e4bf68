package no.cantara.skos.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * A subject of the vocabulary graph: a concept, concept scheme, collection, or an untyped
 * resource that is carried through unchanged.
 *
 * <p>Collections keep insertion order; that order is the output order.
 */
public final class ConceptNode {

    private final String id;
    private final Term subject;
    private final int order;

    private ConceptKind kind;
    private final Set<ConceptKind> kinds = EnumSet.noneOf(ConceptKind.class);
    private final List<Term> types = new ArrayList<>();
    private final Map<LabelKey, Set<String>> labels = new LinkedHashMap<>();
    private final Map<RelationKind, Set<Reference>> relations = new EnumMap<>(RelationKind.class);
    private final Map<SchemeLinkKind, Set<Reference>> schemeLinks = new EnumMap<>(SchemeLinkKind.class);
    private final Map<NoteKind, Set<Literal>> documentation = new EnumMap<>(NoteKind.class);
    private final Map<String, PropertyValues> otherProperties = new LinkedHashMap<>();

    public ConceptNode(String id, Term subject, int order) {
        this.id = id;
        this.subject = subject;
        this.order = order;
    }

    /** The dedup key: absolute IRI when resolvable, else the written form. */
    public String id() {
        return id;
    }

    public Term subject() {
        return subject;
    }

    /** First-seen position in the document. */
    public int order() {
        return order;
    }

    // ── types ─────────────────────────────────────────────────────────────────────

    /**
     * Records a type assertion. The first recognized SKOS class becomes the node's kind.
     */
    public void addType(Term type, ConceptKind recognized) {
        types.add(type);
        if (recognized != null) {
            kinds.add(recognized);
            if (kind == null) kind = recognized;
        }
    }

    /** @return the classification, or {@code null} for an untyped resource */
    public ConceptKind kind() {
        return kind;
    }

    public boolean is(ConceptKind k) {
        return kinds.contains(k);
    }

    public Set<ConceptKind> kinds() {
        return Collections.unmodifiableSet(kinds);
    }

    public List<Term> types() {
        return Collections.unmodifiableList(types);
    }

    // ── labels ────────────────────────────────────────────────────────────────────

    public void addLabel(LabelKind labelKind, String language, String text) {
        labels.computeIfAbsent(new LabelKey(labelKind, language), k -> new LinkedHashSet<>()).add(text);
    }

    public boolean removeLabel(LabelKind labelKind, String language, String text) {
        LabelKey key = new LabelKey(labelKind, language);
        Set<String> values = labels.get(key);
        if (values == null || !values.remove(text)) return false;
        if (values.isEmpty()) labels.remove(key);
        return true;
    }

    public Map<LabelKey, Set<String>> labels() {
        return Collections.unmodifiableMap(labels);
    }

    /** Labels of one kind as literals, in insertion order across languages. */
    public List<Literal> labels(LabelKind labelKind) {
        List<Literal> result = new ArrayList<>();
        for (Map.Entry<LabelKey, Set<String>> e : labels.entrySet()) {
            if (e.getKey().kind() != labelKind) continue;
            for (String text : e.getValue()) {
                result.add(new Literal(text, e.getKey().language(), null));
            }
        }
        return result;
    }

    public Set<String> labels(LabelKind labelKind, String language) {
        return Collections.unmodifiableSet(labels.getOrDefault(new LabelKey(labelKind, language), Set.of()));
    }

    // ── relations and scheme links ────────────────────────────────────────────────

    /** @return {@code true} if the target was not present yet */
    public boolean addRelation(RelationKind relation, Reference target) {
        return relations.computeIfAbsent(relation, k -> new LinkedHashSet<>()).add(target);
    }

    public Set<Reference> relations(RelationKind relation) {
        return Collections.unmodifiableSet(relations.getOrDefault(relation, Set.of()));
    }

    public void addSchemeLink(SchemeLinkKind link, Reference target) {
        schemeLinks.computeIfAbsent(link, k -> new LinkedHashSet<>()).add(target);
    }

    public Set<Reference> schemeLinks(SchemeLinkKind link) {
        return Collections.unmodifiableSet(schemeLinks.getOrDefault(link, Set.of()));
    }

    // ── documentation and everything else ─────────────────────────────────────────

    public void addNote(NoteKind note, Literal value) {
        documentation.computeIfAbsent(note, k -> new LinkedHashSet<>()).add(value);
    }

    public Set<Literal> notes(NoteKind note) {
        return Collections.unmodifiableSet(documentation.getOrDefault(note, Set.of()));
    }

    /**
     * Adds values of an uninterpreted predicate. Repeated declarations of one predicate merge
     * into the entry of its first occurrence; values equal by key are kept once.
     */
    public void addOtherProperty(PropertyValues property) {
        PropertyValues existing = otherProperties.get(property.predicate().key());
        Map<String, Term> merged = new LinkedHashMap<>();
        if (existing != null) {
            existing.values().forEach(v -> merged.putIfAbsent(v.key(), v));
        }
        property.values().forEach(v -> merged.putIfAbsent(v.key(), v));
        Term predicate = existing != null ? existing.predicate() : property.predicate();
        otherProperties.put(predicate.key(), new PropertyValues(predicate, new ArrayList<>(merged.values())));
    }

    public List<PropertyValues> otherProperties() {
        return List.copyOf(otherProperties.values());
    }

    @Override
    public String toString() {
        return "ConceptNode[" + id + ", " + kind + "]";
    }
}
