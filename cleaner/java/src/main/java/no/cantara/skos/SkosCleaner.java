package no.cantara.skos;

import no.cantara.skos.graph.ConceptGraphBuilder;
import no.cantara.skos.graph.LabelCardinalityRepair;
import no.cantara.skos.hierarchy.HierarchyAnalyzer;
import no.cantara.skos.model.ConceptGraph;
import no.cantara.skos.model.ConceptKind;
import no.cantara.skos.model.ConceptNode;
import no.cantara.skos.model.Finding;
import no.cantara.skos.model.LabelKind;
import no.cantara.skos.reader.StatementReader;
import no.cantara.skos.report.ChangeRecorder;
import no.cantara.skos.report.CleaningResult;
import no.cantara.skos.report.CleaningSummary;
import no.cantara.skos.report.ValidationReport;
import no.cantara.skos.serialize.CanonicalSerializer;
import no.cantara.skos.validation.IntegrityValidator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.Reader;
import java.io.StringReader;
import java.util.ArrayList;
import java.util.List;

/**
 * Cleans a SKOS vocabulary written in Turtle: read, build the graph, analyze the hierarchy,
 * validate, repair pref-label cardinality, and write canonical Turtle.
 *
 * <p>Each call owns its graph; nothing is shared between runs.
 */
public final class SkosCleaner {

    private static final Logger log = LoggerFactory.getLogger(SkosCleaner.class);

    private SkosCleaner() {}

    public static CleaningResult clean(String text) {
        return clean(text, CleanerOptions.defaults());
    }

    public static CleaningResult clean(String text, CleanerOptions options) {
        return clean(new StringReader(text), options);
    }

    public static CleaningResult clean(Reader in, CleanerOptions options) {
        ChangeRecorder recorder = new ChangeRecorder();
        StatementReader statements = new StatementReader(in, recorder);
        ConceptGraph graph = new ConceptGraphBuilder(recorder)
                .build(statements, options.memoryEfficient(), options.chunkSize());

        HierarchyAnalyzer hierarchy = new HierarchyAnalyzer(graph);
        if (options.autofixBroader()) {
            hierarchy.autofix(recorder);
        }

        ValidationReport validation;
        if (options.validate()) {
            List<Finding> findings = new ArrayList<>(
                    IntegrityValidator.defaultRules(options.maxLabelLength(), options.extendedLabelValidation()).run(graph));
            findings.addAll(hierarchy.inspect(options.warnMissingNarrower()));
            validation = ValidationReport.of(findings);
            log.info("Validation: {} violations, {} warnings, {} infos",
                    validation.violations().size(), validation.warnings().size(), validation.infos().size());
        } else {
            log.info("Validation disabled");
            validation = ValidationReport.skipped();
        }

        LabelCardinalityRepair.repair(graph, recorder);
        String output = CanonicalSerializer.serialize(graph);

        int withoutPrefLabel = 0;
        for (ConceptNode node : graph.nodes()) {
            if (node.is(ConceptKind.CONCEPT) && node.labels(LabelKind.PREF).isEmpty()) withoutPrefLabel++;
        }
        CleaningSummary summary = CleaningSummary.from(recorder, withoutPrefLabel, graph.size());
        log.info("Cleaned {} blocks into {} nodes, {} changes", summary.conceptsProcessed(), summary.finalConceptCount(),
                recorder.changes().size());
        return new CleaningResult(output, recorder.changes(), validation, summary);
    }
}
