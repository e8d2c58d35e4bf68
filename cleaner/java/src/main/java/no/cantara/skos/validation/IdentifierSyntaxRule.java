package no.cantara.skos.validation;

import no.cantara.skos.model.CheckId;
import no.cantara.skos.model.ConceptGraph;
import no.cantara.skos.model.ConceptNode;
import no.cantara.skos.model.Finding;
import no.cantara.skos.model.Reference;
import no.cantara.skos.model.RelationKind;
import no.cantara.skos.model.SchemeLinkKind;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Node identifiers, relation targets and scheme-link targets must be well-formed identifiers.
 *
 * <p>Without a base, a relative reference is accepted whether written {@code <x1>} or as the
 * bare word {@code x1}: the output writes both as {@code <x1>}. Undeclared prefixes and
 * malformed relative forms are violations.
 */
class IdentifierSyntaxRule implements ValidationRule {

    @Override
    public List<Finding> validate(ConceptGraph graph) {
        List<Finding> findings = new ArrayList<>();
        for (ConceptNode node : graph.nodes()) {
            String subject = graph.display(node.id());
            IdentifierSyntax.problem(node.subject()).ifPresent(problem ->
                    findings.add(Finding.of(CheckId.IDENTIFIER_SYNTAX, subject,
                            "invalid identifier " + node.subject().written() + ": " + problem)));
            for (RelationKind relation : RelationKind.values()) {
                for (Reference target : node.relations(relation)) {
                    check(subject, "skos:" + relation.localName(), target, findings);
                }
            }
            for (SchemeLinkKind link : SchemeLinkKind.values()) {
                for (Reference target : node.schemeLinks(link)) {
                    check(subject, "skos:" + link.localName(), target, findings);
                }
            }
        }
        return findings;
    }

    private static void check(String subject, String property, Reference target, List<Finding> findings) {
        Optional<String> problem = IdentifierSyntax.problem(target.term());
        problem.ifPresent(p -> findings.add(Finding.of(CheckId.IDENTIFIER_SYNTAX, subject,
                "invalid " + property + " target " + target.written() + " in " + subject + ": " + p)));
    }
}
