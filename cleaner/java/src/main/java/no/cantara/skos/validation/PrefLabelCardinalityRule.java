package no.cantara.skos.validation;

import no.cantara.skos.model.CheckId;
import no.cantara.skos.model.ConceptGraph;
import no.cantara.skos.model.ConceptNode;
import no.cantara.skos.model.Finding;
import no.cantara.skos.model.LabelKey;
import no.cantara.skos.model.LabelKind;
import no.cantara.skos.model.TurtleText;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/** At most one prefLabel per language tag. */
class PrefLabelCardinalityRule implements ValidationRule {

    @Override
    public List<Finding> validate(ConceptGraph graph) {
        List<Finding> findings = new ArrayList<>();
        for (ConceptNode node : graph.nodes()) {
            for (Map.Entry<LabelKey, Set<String>> e : node.labels().entrySet()) {
                if (e.getKey().kind() != LabelKind.PREF || e.getValue().size() < 2) continue;
                String subject = graph.display(node.id());
                String values = e.getValue().stream().map(TurtleText::quote).collect(Collectors.joining(", "));
                findings.add(Finding.of(CheckId.S14, subject,
                        subject + " has " + e.getValue().size() + " prefLabels for "
                                + Labels.language(e.getKey().language()) + ": " + values));
            }
        }
        return findings;
    }
}
