package no.cantara.skos.hierarchy;

import no.cantara.skos.model.ChangeCategory;
import no.cantara.skos.model.CheckId;
import no.cantara.skos.model.ConceptGraph;
import no.cantara.skos.model.ConceptKind;
import no.cantara.skos.model.ConceptNode;
import no.cantara.skos.model.Finding;
import no.cantara.skos.model.Reference;
import no.cantara.skos.model.RelationKind;
import no.cantara.skos.report.ChangeRecorder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Checks the {@code broader} hierarchy against the naming codes of the identifiers.
 *
 * <p>A node with code {@code 1.2.3} is expected to have a {@code broader} edge to one of
 * {@code 1.2} or {@code 1}. If it has none, the nearest of those that exists in the graph is
 * its inferred parent. Cycles are searched over asserted {@code broader} edges only.
 */
public class HierarchyAnalyzer {

    private static final Logger log = LoggerFactory.getLogger(HierarchyAnalyzer.class);

    private final ConceptGraph graph;
    private final Map<ConceptNode, HierarchyCode> codes = new LinkedHashMap<>();
    private final Map<String, ConceptNode> byCode = new HashMap<>();

    public HierarchyAnalyzer(ConceptGraph graph) {
        this.graph = graph;
        for (ConceptNode node : graph.nodes()) {
            if (node.is(ConceptKind.CONCEPT_SCHEME) || node.is(ConceptKind.COLLECTION)) continue;
            HierarchyCode.of(node.id()).ifPresent(code -> {
                codes.put(node, code);
                byCode.putIfAbsent(code.text(), node);
            });
        }
        log.debug("{} of {} nodes carry a hierarchy code", codes.size(), graph.size());
    }

    record MissingParent(ConceptNode child, HierarchyCode code, ConceptNode parent) {}

    /**
     * Inserts a {@code broader} edge from every node to its inferred parent. The mirrored
     * {@code narrower} edge is not inserted.
     *
     * @return number of edges added
     */
    public int autofix(ChangeRecorder recorder) {
        int added = 0;
        for (MissingParent missing : missingParents()) {
            missing.child().addRelation(RelationKind.BROADER, Reference.of(missing.parent().subject()));
            recorder.record(ChangeCategory.BROADER_ADDED,
                    graph.display(missing.child().id()) + " skos:broader " + graph.display(missing.parent().id()));
            added++;
        }
        log.info("Hierarchy autofix added {} broader links", added);
        return added;
    }

    /**
     * Reports missing parents, missing intermediate levels, {@code broader} cycles and,
     * optionally, parents that lack the mirrored {@code narrower} edge.
     */
    public List<Finding> inspect(boolean warnMissingNarrower) {
        List<Finding> findings = new ArrayList<>();
        for (MissingParent missing : missingParents()) {
            String child = graph.display(missing.child().id());
            String parent = graph.display(missing.parent().id());
            findings.add(new Finding(CheckId.HIERARCHY_MISSING_BROADER, CheckId.HIERARCHY_MISSING_BROADER.severity(),
                    List.of(child, parent),
                    "missing broader to " + parent + ": " + child + " (code " + missing.code()
                            + ") has no skos:broader to any of its code prefixes"));
        }
        findings.addAll(gaps());
        findings.addAll(cycles());
        if (warnMissingNarrower) {
            findings.addAll(missingNarrower());
        }
        log.debug("Hierarchy inspection produced {} findings", findings.size());
        return findings;
    }

    List<MissingParent> missingParents() {
        List<MissingParent> result = new ArrayList<>();
        for (Map.Entry<ConceptNode, HierarchyCode> e : codes.entrySet()) {
            ConceptNode node = e.getKey();
            List<String> candidates = e.getValue().ancestors();
            if (candidates.isEmpty() || hasBroaderAmong(node, candidates)) continue;
            for (String candidate : candidates) {
                ConceptNode parent = byCode.get(candidate);
                if (parent != null && parent != node) {
                    result.add(new MissingParent(node, e.getValue(), parent));
                    break;
                }
            }
        }
        return result;
    }

    private boolean hasBroaderAmong(ConceptNode node, List<String> candidates) {
        for (Reference target : node.relations(RelationKind.BROADER)) {
            ConceptNode targetNode = graph.get(target.key());
            HierarchyCode code = targetNode != null ? codes.get(targetNode) : null;
            if (code == null) {
                code = HierarchyCode.of(target.key()).orElse(null);
            }
            if (code != null && candidates.contains(code.text())) return true;
        }
        return false;
    }

    /** Gaps are reported for numeric codes only; alphanumeric ids such as UUIDs are not levels. */
    private List<Finding> gaps() {
        List<Finding> result = new ArrayList<>();
        for (Map.Entry<ConceptNode, HierarchyCode> e : codes.entrySet()) {
            if (!e.getValue().isNumeric()) continue;
            for (String candidate : e.getValue().ancestors()) {
                if (byCode.containsKey(candidate)) continue;
                String child = graph.display(e.getKey().id());
                result.add(Finding.of(CheckId.HIERARCHY_GAP, child,
                        "hierarchy gap: " + child + " (code " + e.getValue() + ") has no concept for intermediate level '"
                                + candidate + "'"));
            }
        }
        return result;
    }

    // ── cycles ────────────────────────────────────────────────────────────────────

    private enum Visit { ACTIVE, DONE }

    private List<Finding> cycles() {
        Map<String, Visit> state = new HashMap<>();
        List<List<String>> found = new ArrayList<>();
        Set<List<String>> seen = new HashSet<>();
        for (ConceptNode node : graph.nodes()) {
            if (!state.containsKey(node.id())) {
                visit(node.id(), new ArrayList<>(), state, found, seen);
            }
        }
        List<Finding> result = new ArrayList<>();
        for (List<String> cycle : found) {
            List<String> names = cycle.stream().map(graph::display).toList();
            result.add(new Finding(CheckId.HIERARCHY_CYCLE, CheckId.HIERARCHY_CYCLE.severity(), names,
                    "cycle detected: " + String.join(" → ", names) + " → " + names.get(0)));
        }
        return result;
    }

    private void visit(String id, List<String> path, Map<String, Visit> state,
                       List<List<String>> found, Set<List<String>> seen) {
        state.put(id, Visit.ACTIVE);
        path.add(id);
        ConceptNode node = graph.get(id);
        if (node != null) {
            for (Reference target : node.relations(RelationKind.BROADER)) {
                String next = target.key();
                Visit s = state.get(next);
                if (s == Visit.ACTIVE) {
                    List<String> cycle = new ArrayList<>(path.subList(path.indexOf(next), path.size()));
                    if (seen.add(canonical(cycle))) {
                        found.add(cycle);
                    }
                } else if (s == null) {
                    visit(next, path, state, found, seen);
                }
            }
        }
        path.remove(path.size() - 1);
        state.put(id, Visit.DONE);
    }

    /** Rotation of the cycle starting at its smallest member. */
    private static List<String> canonical(List<String> cycle) {
        int start = 0;
        for (int i = 1; i < cycle.size(); i++) {
            if (cycle.get(i).compareTo(cycle.get(start)) < 0) start = i;
        }
        List<String> rotated = new ArrayList<>(cycle.size());
        for (int i = 0; i < cycle.size(); i++) {
            rotated.add(cycle.get((start + i) % cycle.size()));
        }
        return rotated;
    }

    // ── narrower ──────────────────────────────────────────────────────────────────

    private List<Finding> missingNarrower() {
        List<Finding> result = new ArrayList<>();
        for (ConceptNode child : graph.nodes()) {
            for (Reference target : child.relations(RelationKind.BROADER)) {
                ConceptNode parent = graph.get(target.key());
                if (parent == null || parent == child) continue;
                if (!parent.relations(RelationKind.NARROWER).contains(Reference.of(child.subject()))) {
                    String p = graph.display(parent.id());
                    String c = graph.display(child.id());
                    result.add(new Finding(CheckId.HIERARCHY_MISSING_NARROWER, CheckId.HIERARCHY_MISSING_NARROWER.severity(),
                            List.of(p, c), "parent " + p + " lacks skos:narrower " + c));
                }
            }
        }
        return result;
    }
}
