package no.cantara.skos.cli;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import no.cantara.skos.model.ChangeRecord;
import no.cantara.skos.model.CheckId;
import no.cantara.skos.model.Finding;
import no.cantara.skos.report.CleaningResult;
import no.cantara.skos.report.CleaningSummary;
import no.cantara.skos.report.ValidationReport;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

/**
 * Machine-readable report: summary counters, change records and findings as one JSON document.
 */
public final class JsonReportWriter {

    private static final ObjectMapper MAPPER = new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);

    private JsonReportWriter() {}

    public static void write(Path path, Path input, Path output, CleaningResult result) throws IOException {
        MAPPER.writeValue(path.toFile(), toJson(input, output, result));
    }

    public static ObjectNode toJson(Path input, Path output, CleaningResult result) {
        ObjectNode root = MAPPER.createObjectNode();
        root.put("input", input.toString());
        root.put("output", output.toString());
        root.set("summary", summary(result.summary()));

        ArrayNode changes = root.putArray("changes");
        for (ChangeRecord c : result.changes()) {
            ObjectNode node = changes.addObject();
            node.put("category", c.category().name());
            node.put("before", c.before());
            if (c.after() != null) node.put("after", c.after());
        }

        root.set("validation", validation(result.validation()));
        return root;
    }

    // ── parts ─────────────────────────────────────────────────────────────────────

    private static ObjectNode summary(CleaningSummary s) {
        ObjectNode node = MAPPER.createObjectNode();
        node.put("conceptsProcessed", s.conceptsProcessed());
        node.put("duplicatesRemoved", s.duplicatesRemoved());
        node.put("labelsProcessed", s.labelsProcessed());
        node.put("commaSpacingFixes", s.commaSpacingFixes());
        node.put("identifiersFixed", s.identifiersFixed());
        node.put("identifiersNormalized", s.identifiersNormalized());
        node.put("syntaxFixes", s.syntaxFixes());
        node.put("blocksSkipped", s.blocksSkipped());
        node.put("encodingRepairs", s.encodingRepairs());
        node.put("whitespaceFixes", s.whitespaceFixes());
        node.put("broaderAdded", s.broaderAdded());
        node.put("prefLabelsDemoted", s.prefLabelsDemoted());
        node.put("conceptsWithoutPrefLabel", s.conceptsWithoutPrefLabel());
        node.put("finalConceptCount", s.finalConceptCount());
        return node;
    }

    private static ObjectNode validation(ValidationReport report) {
        ObjectNode node = MAPPER.createObjectNode();
        node.put("performed", report.performed());
        if (!report.performed()) return node;
        node.put("valid", report.isValid());

        ObjectNode counts = node.putObject("countsByCheck");
        for (Map.Entry<CheckId, Integer> e : report.countsByCheck().entrySet()) {
            counts.put(e.getKey().id(), e.getValue());
        }
        findings(node.putArray("violations"), report.violations());
        findings(node.putArray("warnings"), report.warnings());
        findings(node.putArray("infos"), report.infos());
        return node;
    }

    private static void findings(ArrayNode array, List<Finding> findings) {
        for (Finding f : findings) {
            ObjectNode node = array.addObject();
            node.put("check", f.ruleId());
            node.put("severity", f.severity().name());
            ArrayNode subjects = node.putArray("subjects");
            f.subjects().forEach(subjects::add);
            node.put("message", f.message());
        }
    }
}
