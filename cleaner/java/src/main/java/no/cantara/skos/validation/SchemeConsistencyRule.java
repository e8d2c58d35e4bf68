package no.cantara.skos.validation;

import no.cantara.skos.model.CheckId;
import no.cantara.skos.model.ConceptGraph;
import no.cantara.skos.model.ConceptKind;
import no.cantara.skos.model.ConceptNode;
import no.cantara.skos.model.Finding;
import no.cantara.skos.model.Reference;
import no.cantara.skos.model.SchemeLinkKind;

import java.util.ArrayList;
import java.util.List;

/**
 * Scheme membership must agree with top-concept links: {@code topConceptOf S} implies
 * {@code inScheme S}, and every {@code hasTopConcept} target is a Concept of the graph that is
 * {@code inScheme} the scheme.
 */
class SchemeConsistencyRule implements ValidationRule {

    @Override
    public List<Finding> validate(ConceptGraph graph) {
        List<Finding> findings = new ArrayList<>();
        for (ConceptNode node : graph.nodes()) {
            String subject = graph.display(node.id());
            for (Reference scheme : node.schemeLinks(SchemeLinkKind.TOP_CONCEPT_OF)) {
                if (!node.schemeLinks(SchemeLinkKind.IN_SCHEME).contains(scheme)) {
                    String s = graph.display(scheme.key());
                    findings.add(new Finding(CheckId.SCHEME_TOP_CONCEPT_NOT_IN_SCHEME,
                            CheckId.SCHEME_TOP_CONCEPT_NOT_IN_SCHEME.severity(), List.of(subject, s),
                            "concept " + subject + " has topConceptOf " + s + " but is missing inScheme " + s));
                }
            }
            Reference self = Reference.of(node.subject());
            for (Reference top : node.schemeLinks(SchemeLinkKind.HAS_TOP_CONCEPT)) {
                String t = graph.display(top.key());
                ConceptNode target = graph.get(top.key());
                if (target == null || !target.is(ConceptKind.CONCEPT)) {
                    findings.add(new Finding(CheckId.SCHEME_TOP_CONCEPT_UNKNOWN,
                            CheckId.SCHEME_TOP_CONCEPT_UNKNOWN.severity(), List.of(subject, t),
                            "hasTopConcept of " + subject + " points to non-Concept " + t));
                } else if (!target.schemeLinks(SchemeLinkKind.IN_SCHEME).contains(self)) {
                    findings.add(new Finding(CheckId.SCHEME_TOP_CONCEPT_MISSING_IN_SCHEME,
                            CheckId.SCHEME_TOP_CONCEPT_MISSING_IN_SCHEME.severity(), List.of(t, subject),
                            "concept " + t + " is hasTopConcept of " + subject + " but missing inScheme " + subject));
                }
            }
        }
        return findings;
    }
}
