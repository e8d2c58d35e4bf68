package no.cantara.skos.validation;

import no.cantara.skos.model.ConceptGraph;
import no.cantara.skos.model.Finding;

import java.util.List;

/**
 * A single integrity check over the concept graph. Rules are deterministic, report findings in
 * graph order and never mutate the graph.
 */
public interface ValidationRule {

    /**
     * @return findings, possibly empty, never {@code null}
     */
    List<Finding> validate(ConceptGraph graph);
}
