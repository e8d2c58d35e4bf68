package no.cantara.skos.validation;

import no.cantara.skos.model.CheckId;
import no.cantara.skos.model.ConceptGraph;
import no.cantara.skos.model.ConceptKind;
import no.cantara.skos.model.ConceptNode;
import no.cantara.skos.model.Finding;
import no.cantara.skos.model.PropertyValues;
import no.cantara.skos.model.Skos;
import no.cantara.skos.model.Term;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * SKOS-XL label resources: a label resource must not also be a Concept, and a resource with a
 * {@code skosxl:literalForm} should be referenced by some {@code skosxl} label property.
 */
class ExtendedLabelRule implements ValidationRule {

    private static final Set<String> XL_LABELS = Set.of(Skos.XL_PREF_LABEL, Skos.XL_ALT_LABEL, Skos.XL_HIDDEN_LABEL);

    @Override
    public List<Finding> validate(ConceptGraph graph) {
        List<Finding> findings = new ArrayList<>();
        Set<String> referenced = new HashSet<>();
        for (ConceptNode node : graph.nodes()) {
            for (PropertyValues property : node.otherProperties()) {
                if (!XL_LABELS.contains(property.predicate().absolute())) continue;
                for (Term value : property.values()) {
                    if (!value.isIdentifier()) continue;
                    referenced.add(value.key());
                    ConceptNode label = graph.get(value.key());
                    if (label != null && label.is(ConceptKind.CONCEPT)) {
                        String subject = graph.display(node.id());
                        String l = graph.display(value.key());
                        findings.add(new Finding(CheckId.XL_LABEL_CONFLICT, CheckId.XL_LABEL_CONFLICT.severity(),
                                List.of(subject, l),
                                "SKOS-XL label " + l + " of " + subject + " is also a skos:Concept"));
                    }
                }
            }
        }
        for (ConceptNode node : graph.nodes()) {
            boolean hasLiteralForm = node.otherProperties().stream()
                    .anyMatch(p -> Skos.XL_LITERAL_FORM.equals(p.predicate().absolute()));
            if (hasLiteralForm && !referenced.contains(node.id())) {
                String subject = graph.display(node.id());
                findings.add(Finding.of(CheckId.XL_LABEL_ORPHANED, subject,
                        "orphaned SKOS-XL label " + subject + " is not referenced by any concept"));
            }
        }
        return findings;
    }
}
