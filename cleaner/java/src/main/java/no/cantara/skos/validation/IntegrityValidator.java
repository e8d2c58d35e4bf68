package no.cantara.skos.validation;

import no.cantara.skos.model.ConceptGraph;
import no.cantara.skos.model.Finding;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Runs a fixed list of {@link ValidationRule}s and collects their findings in rule order.
 * Every rule runs regardless of what earlier rules found.
 */
public final class IntegrityValidator {

    private static final Logger log = LoggerFactory.getLogger(IntegrityValidator.class);

    public static final int DEFAULT_MAX_LABEL_LENGTH = 500;

    private final List<ValidationRule> rules;

    public IntegrityValidator(List<ValidationRule> rules) {
        this.rules = List.copyOf(Objects.requireNonNull(rules, "rules"));
    }

    /**
     * The standard rule set.
     *
     * @param maxLabelLength  labels longer than this are reported
     * @param extendedLabels  also check SKOS-XL label resources
     */
    public static IntegrityValidator defaultRules(int maxLabelLength, boolean extendedLabels) {
        List<ValidationRule> rules = new ArrayList<>(List.of(
                new PrefLabelCardinalityRule(),
                new DisjointLabelRule(),
                new RelatedHierarchyDisjointRule(),
                new ClassDisjointnessRule(),
                new IdentifierSyntaxRule(),
                new LanguageTagRule(),
                new LabelTextRule(maxLabelLength),
                new MissingPrefLabelRule(),
                new SchemeConsistencyRule()));
        if (extendedLabels) {
            rules.add(new ExtendedLabelRule());
        }
        return new IntegrityValidator(rules);
    }

    public List<Finding> run(ConceptGraph graph) {
        List<Finding> findings = new ArrayList<>();
        for (ValidationRule rule : rules) {
            List<Finding> found = rule.validate(graph);
            log.debug("{}: {} findings", rule.getClass().getSimpleName(), found.size());
            findings.addAll(found);
        }
        return findings;
    }

    public List<ValidationRule> rules() {
        return rules;
    }
}
