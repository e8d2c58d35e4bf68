package no.cantara.skos.report;

import no.cantara.skos.model.ChangeRecord;

import java.util.List;

/**
 * Everything a cleaning run produces.
 *
 * @param output     the canonical Turtle text
 * @param changes    repairs in the order they were applied
 * @param validation findings
 * @param summary    counters
 */
public record CleaningResult(String output, List<ChangeRecord> changes, ValidationReport validation, CleaningSummary summary) {
    public CleaningResult {
        changes = List.copyOf(changes);
    }
}
