package no.cantara.skos.validation;

import no.cantara.skos.model.CheckId;
import no.cantara.skos.model.ConceptGraph;
import no.cantara.skos.model.ConceptNode;
import no.cantara.skos.model.Finding;
import no.cantara.skos.model.Reference;
import no.cantara.skos.model.RelationKind;

import java.util.ArrayList;
import java.util.List;

/**
 * {@code related} is disjoint with {@code broaderTransitive}. Asserted {@code broader} edges
 * count, {@code broader} being a sub-property of {@code broaderTransitive}.
 */
class RelatedHierarchyDisjointRule implements ValidationRule {

    @Override
    public List<Finding> validate(ConceptGraph graph) {
        List<Finding> findings = new ArrayList<>();
        for (ConceptNode node : graph.nodes()) {
            for (Reference target : node.relations(RelationKind.RELATED)) {
                RelationKind clash = node.relations(RelationKind.BROADER_TRANSITIVE).contains(target)
                        ? RelationKind.BROADER_TRANSITIVE
                        : node.relations(RelationKind.BROADER).contains(target) ? RelationKind.BROADER : null;
                if (clash == null) continue;
                String subject = graph.display(node.id());
                String object = graph.display(target.key());
                findings.add(new Finding(CheckId.S27, CheckId.S27.severity(), List.of(subject, object),
                        subject + " has both skos:related and skos:" + clash.localName() + " to " + object));
            }
        }
        return findings;
    }
}
