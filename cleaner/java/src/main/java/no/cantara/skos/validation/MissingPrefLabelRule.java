package no.cantara.skos.validation;

import no.cantara.skos.model.CheckId;
import no.cantara.skos.model.ConceptGraph;
import no.cantara.skos.model.ConceptKind;
import no.cantara.skos.model.ConceptNode;
import no.cantara.skos.model.Finding;
import no.cantara.skos.model.LabelKind;

import java.util.ArrayList;
import java.util.List;

class MissingPrefLabelRule implements ValidationRule {

    @Override
    public List<Finding> validate(ConceptGraph graph) {
        List<Finding> findings = new ArrayList<>();
        for (ConceptNode node : graph.nodes()) {
            if (node.is(ConceptKind.CONCEPT) && node.labels(LabelKind.PREF).isEmpty()) {
                String subject = graph.display(node.id());
                findings.add(Finding.of(CheckId.MISSING_PREF_LABEL, subject, "concept " + subject + " has no skos:prefLabel"));
            }
        }
        return findings;
    }
}
