package no.cantara.skos.model;

import java.util.List;

/**
 * A single result of hierarchy analysis or validation. Findings never mutate the graph.
 *
 * @param check    the check that produced the finding
 * @param severity violation, warning or info
 * @param subjects identifiers of the nodes involved, as {@code <short-form>}
 * @param message  human-readable description
 */
public record Finding(CheckId check, Severity severity, List<String> subjects, String message) {

    public Finding {
        subjects = List.copyOf(subjects);
    }

    public static Finding of(CheckId check, String subject, String message) {
        return new Finding(check, check.severity(), List.of(subject), message);
    }

    public String ruleId() {
        return check.id();
    }

    @Override
    public String toString() {
        return "[" + ruleId() + "] " + message;
    }
}
