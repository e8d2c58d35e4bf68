package no.cantara.skos.cli;

import no.cantara.skos.model.ChangeRecord;
import no.cantara.skos.model.CheckId;
import no.cantara.skos.model.Finding;
import no.cantara.skos.report.CleaningResult;
import no.cantara.skos.report.CleaningSummary;
import no.cantara.skos.report.ValidationReport;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.List;
import java.util.Map;

/**
 * Formats the human-readable reports: change log, validation report, combined full report,
 * and the console summary.
 */
public class ReportWriter {

    private static final DateTimeFormatter TIMESTAMP = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");
    private static final String RULE = "=".repeat(60);
    private static final String THIN_RULE = "-".repeat(40);

    private final Clock clock;

    public ReportWriter() {
        this(Clock.systemDefaultZone());
    }

    public ReportWriter(Clock clock) {
        this.clock = clock;
    }

    // ── files ─────────────────────────────────────────────────────────────────────

    public Path writeChangeLog(Path path, CleaningResult result) throws IOException {
        Files.writeString(path, changeLog(result), StandardCharsets.UTF_8);
        return path;
    }

    public Path writeValidationReport(Path path, ValidationReport validation) throws IOException {
        Files.writeString(path, validationReport(validation), StandardCharsets.UTF_8);
        return path;
    }

    public Path writeFullReport(Path path, Path input, Path output, CleaningResult result) throws IOException {
        Files.writeString(path, fullReport(input, output, result), StandardCharsets.UTF_8);
        return path;
    }

    // ── formats ───────────────────────────────────────────────────────────────────

    public String changeLog(CleaningResult result) {
        StringBuilder sb = header("SKOS CLEANER CHANGE LOG");
        CleaningSummary s = result.summary();
        sb.append("SUMMARY:\n");
        sb.append("- Total concepts processed: ").append(s.conceptsProcessed()).append('\n');
        sb.append("- Duplicates removed: ").append(s.duplicatesRemoved()).append('\n');
        sb.append("- Malformed identifiers fixed: ").append(s.identifiersFixed()).append('\n');
        sb.append("- Identifier normalizations: ").append(s.identifiersNormalized()).append('\n');
        sb.append("- Labels checked: ").append(s.labelsProcessed()).append('\n');
        sb.append("- Comma spacing fixes: ").append(s.commaSpacingFixes()).append('\n');
        sb.append('\n');
        sb.append("DETAILED CHANGES:\n").append(THIN_RULE).append('\n');
        appendChanges(sb, result.changes());
        return sb.toString();
    }

    public String validationReport(ValidationReport validation) {
        StringBuilder sb = header("SKOS VALIDATION REPORT");
        sb.append("SUMMARY:\n");
        sb.append("- Integrity violations: ").append(validation.violations().size()).append('\n');
        sb.append("- Warnings: ").append(validation.warnings().size()).append('\n');
        sb.append("- Infos: ").append(validation.infos().size()).append('\n');
        appendCountsByCheck(sb, validation);
        sb.append('\n');
        appendFindings(sb, "INTEGRITY VIOLATIONS", validation.violations());
        appendFindings(sb, "WARNINGS", validation.warnings());
        appendFindings(sb, "INFOS", validation.infos());
        if (validation.isClean()) {
            sb.append("SUCCESS: All SKOS integrity conditions satisfied!\n");
        }
        return sb.toString();
    }

    public String fullReport(Path input, Path output, CleaningResult result) {
        StringBuilder sb = header("SKOS CLEANER FULL REPORT");
        sb.append("FILES:\n");
        sb.append("- Input:  ").append(input).append('\n');
        sb.append("- Output: ").append(output).append("\n\n");
        sb.append("STATISTICS:\n");
        appendStatistics(sb, result.summary(), "- ");
        sb.append('\n');

        sb.append("CHANGE LOG (").append(result.changes().size()).append(" entries):\n").append(THIN_RULE).append('\n');
        appendChanges(sb, result.changes());
        sb.append('\n');

        ValidationReport validation = result.validation();
        sb.append("VALIDATION RESULTS:\n");
        if (!validation.performed()) {
            sb.append("- Validation disabled\n");
            return sb.toString();
        }
        sb.append("- Violations: ").append(validation.violations().size()).append('\n');
        sb.append("- Warnings:   ").append(validation.warnings().size()).append('\n');
        sb.append("- Infos:      ").append(validation.infos().size()).append('\n');
        appendCountsByCheck(sb, validation);
        sb.append('\n');
        appendFindings(sb, "VIOLATIONS", validation.violations());
        appendFindings(sb, "WARNINGS", validation.warnings());
        appendFindings(sb, "INFOS", validation.infos());
        if (validation.isClean()) {
            sb.append("SUCCESS: All SKOS integrity conditions satisfied!\n");
        }
        return sb.toString();
    }

    /** What the CLI prints to stdout after a run. */
    public String consoleSummary(Path input, Path output, CleaningResult result) {
        StringBuilder sb = new StringBuilder();
        sb.append(RULE).append('\n').append("SKOS CLEANING REPORT\n").append(RULE).append('\n');
        sb.append("Input file:  ").append(input).append('\n');
        sb.append("Output file: ").append(output).append("\n\n");
        sb.append("STATISTICS:\n");
        appendStatistics(sb, result.summary(), "   ");

        ValidationReport validation = result.validation();
        if (validation.performed()) {
            sb.append("\nVALIDATION RESULTS:\n");
            sb.append("   Violations: ").append(validation.violations().size()).append('\n');
            sb.append("   Warnings: ").append(validation.warnings().size()).append('\n');
            sb.append("   Infos: ").append(validation.infos().size()).append('\n');
            if (validation.isValid()) {
                sb.append("   All SKOS integrity conditions satisfied\n");
            } else {
                sb.append("   Found ").append(validation.violations().size()).append(" SKOS integrity violation(s)\n");
            }
        }
        return sb.toString();
    }

    // ── parts ─────────────────────────────────────────────────────────────────────

    private StringBuilder header(String title) {
        StringBuilder sb = new StringBuilder();
        sb.append(title).append('\n');
        sb.append("Generated: ").append(LocalDateTime.now(clock).format(TIMESTAMP)).append('\n');
        sb.append(RULE).append("\n\n");
        return sb;
    }

    private static void appendStatistics(StringBuilder sb, CleaningSummary s, String indent) {
        sb.append(indent).append("Total concepts processed: ").append(s.conceptsProcessed()).append('\n');
        sb.append(indent).append("Duplicates removed: ").append(s.duplicatesRemoved()).append('\n');
        sb.append(indent).append("Concepts without prefLabel: ").append(s.conceptsWithoutPrefLabel()).append('\n');
        sb.append(indent).append("Malformed identifiers fixed: ").append(s.identifiersFixed()).append('\n');
        sb.append(indent).append("Identifier normalizations: ").append(s.identifiersNormalized()).append('\n');
        sb.append(indent).append("Syntax fixes: ").append(s.syntaxFixes()).append('\n');
        sb.append(indent).append("Blocks skipped: ").append(s.blocksSkipped()).append('\n');
        sb.append(indent).append("Encoding issues fixed: ").append(s.encodingRepairs()).append('\n');
        sb.append(indent).append("Whitespace fixes: ").append(s.whitespaceFixes()).append('\n');
        sb.append(indent).append("Labels checked: ").append(s.labelsProcessed()).append('\n');
        sb.append(indent).append("Comma spacing fixes: ").append(s.commaSpacingFixes()).append('\n');
        sb.append(indent).append("Broader links added: ").append(s.broaderAdded()).append('\n');
        sb.append(indent).append("PrefLabels demoted: ").append(s.prefLabelsDemoted()).append('\n');
        sb.append(indent).append("Final concepts in output: ").append(s.finalConceptCount()).append('\n');
    }

    private static void appendChanges(StringBuilder sb, List<ChangeRecord> changes) {
        for (int i = 0; i < changes.size(); i++) {
            sb.append(String.format("%4d. %s%n", i + 1, changes.get(i).describe()));
        }
        if (changes.isEmpty()) {
            sb.append("(No detailed change entries)\n");
        }
    }

    private static void appendCountsByCheck(StringBuilder sb, ValidationReport validation) {
        sb.append("- By check (including zeros):\n");
        for (Map.Entry<CheckId, Integer> e : validation.countsByCheck().entrySet()) {
            sb.append("  - ").append(e.getKey().id()).append(" (").append(e.getKey().title()).append("): ")
                    .append(e.getValue()).append('\n');
        }
    }

    private static void appendFindings(StringBuilder sb, String title, List<Finding> findings) {
        if (findings.isEmpty()) return;
        sb.append(title).append(" (").append(findings.size()).append("):\n").append(THIN_RULE).append('\n');
        for (int i = 0; i < findings.size(); i++) {
            sb.append(String.format("%4d. %s%n", i + 1, findings.get(i)));
        }
        sb.append('\n');
    }
}
