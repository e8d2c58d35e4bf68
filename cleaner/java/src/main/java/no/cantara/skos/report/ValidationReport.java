package no.cantara.skos.report;

import no.cantara.skos.model.CheckId;
import no.cantara.skos.model.Finding;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Findings of one run, partitioned by severity.
 *
 * @param performed  whether validation ran at all
 * @param violations conditions that make the vocabulary invalid
 * @param warnings   suspicious but permitted conditions
 * @param infos      advisory findings
 */
public record ValidationReport(boolean performed, List<Finding> violations, List<Finding> warnings, List<Finding> infos) {

    public ValidationReport {
        violations = List.copyOf(violations);
        warnings = List.copyOf(warnings);
        infos = List.copyOf(infos);
    }

    public static ValidationReport skipped() {
        return new ValidationReport(false, List.of(), List.of(), List.of());
    }

    /** Partitions findings, keeping their order within each severity. */
    public static ValidationReport of(List<Finding> findings) {
        List<Finding> violations = new ArrayList<>();
        List<Finding> warnings = new ArrayList<>();
        List<Finding> infos = new ArrayList<>();
        for (Finding f : findings) {
            switch (f.severity()) {
                case VIOLATION -> violations.add(f);
                case WARNING -> warnings.add(f);
                case INFO -> infos.add(f);
            }
        }
        return new ValidationReport(true, violations, warnings, infos);
    }

    public boolean isValid() { return violations.isEmpty(); }

    public boolean isClean() { return violations.isEmpty() && warnings.isEmpty() && infos.isEmpty(); }

    public List<Finding> all() {
        List<Finding> all = new ArrayList<>(violations);
        all.addAll(warnings);
        all.addAll(infos);
        return all;
    }

    /** Finding count per check, every check listed, zeros included, in declaration order. */
    public Map<CheckId, Integer> countsByCheck() {
        Map<CheckId, Integer> counts = new EnumMap<>(CheckId.class);
        for (CheckId check : CheckId.values()) {
            counts.put(check, 0);
        }
        for (Finding f : all()) {
            counts.merge(f.check(), 1, Integer::sum);
        }
        return Collections.unmodifiableMap(counts);
    }
}
