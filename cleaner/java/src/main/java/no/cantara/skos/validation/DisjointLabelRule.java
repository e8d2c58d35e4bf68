package no.cantara.skos.validation;

import no.cantara.skos.model.CheckId;
import no.cantara.skos.model.ConceptGraph;
import no.cantara.skos.model.ConceptNode;
import no.cantara.skos.model.Finding;
import no.cantara.skos.model.LabelKey;
import no.cantara.skos.model.LabelKind;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/** The same text and language must not appear under more than one label property. */
class DisjointLabelRule implements ValidationRule {

    private record TextKey(String text, String language) {}

    @Override
    public List<Finding> validate(ConceptGraph graph) {
        List<Finding> findings = new ArrayList<>();
        for (ConceptNode node : graph.nodes()) {
            Map<TextKey, Set<LabelKind>> kinds = new LinkedHashMap<>();
            for (Map.Entry<LabelKey, Set<String>> e : node.labels().entrySet()) {
                for (String text : e.getValue()) {
                    kinds.computeIfAbsent(new TextKey(text, e.getKey().language()), k -> EnumSet.noneOf(LabelKind.class))
                            .add(e.getKey().kind());
                }
            }
            for (Map.Entry<TextKey, Set<LabelKind>> e : kinds.entrySet()) {
                if (e.getValue().size() < 2) continue;
                String subject = graph.display(node.id());
                String properties = e.getValue().stream().map(LabelKind::localName).collect(Collectors.joining(" and "));
                findings.add(Finding.of(CheckId.S13, subject,
                        subject + " uses " + Labels.literal(e.getKey().text(), e.getKey().language())
                                + " as both " + properties));
            }
        }
        return findings;
    }
}
