package no.cantara.skos.validation;

import no.cantara.skos.model.CheckId;
import no.cantara.skos.model.ConceptGraph;
import no.cantara.skos.model.ConceptKind;
import no.cantara.skos.model.ConceptNode;
import no.cantara.skos.model.Finding;

import java.util.ArrayList;
import java.util.List;

/** Concept is disjoint with ConceptScheme and with Collection. */
class ClassDisjointnessRule implements ValidationRule {

    @Override
    public List<Finding> validate(ConceptGraph graph) {
        List<Finding> findings = new ArrayList<>();
        for (ConceptNode node : graph.nodes()) {
            if (!node.is(ConceptKind.CONCEPT)) continue;
            String subject = graph.display(node.id());
            if (node.is(ConceptKind.CONCEPT_SCHEME)) {
                findings.add(Finding.of(CheckId.S9, subject, subject + " is both skos:ConceptScheme and skos:Concept"));
            }
            if (node.is(ConceptKind.COLLECTION)) {
                findings.add(Finding.of(CheckId.S37, subject, subject + " is both skos:Collection and skos:Concept"));
            }
        }
        return findings;
    }
}
