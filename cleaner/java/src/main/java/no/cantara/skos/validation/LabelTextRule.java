package no.cantara.skos.validation;

import no.cantara.skos.model.CheckId;
import no.cantara.skos.model.ConceptGraph;
import no.cantara.skos.model.ConceptNode;
import no.cantara.skos.model.Finding;
import no.cantara.skos.model.LabelKey;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;

/** Label texts that are empty, too long, or look like a URI. */
class LabelTextRule implements ValidationRule {

    private final int maxLength;

    LabelTextRule(int maxLength) {
        if (maxLength <= 0) {
            throw new IllegalArgumentException("maxLength must be positive, was " + maxLength);
        }
        this.maxLength = maxLength;
    }

    @Override
    public List<Finding> validate(ConceptGraph graph) {
        List<Finding> findings = new ArrayList<>();
        for (ConceptNode node : graph.nodes()) {
            String subject = graph.display(node.id());
            for (Map.Entry<LabelKey, Set<String>> e : node.labels().entrySet()) {
                String property = "skos:" + e.getKey().kind().localName();
                for (String text : e.getValue()) {
                    if (text.strip().isEmpty()) {
                        findings.add(Finding.of(CheckId.LABEL_EMPTY, subject, "empty " + property + " in " + subject));
                        continue;
                    }
                    if (text.length() > maxLength) {
                        findings.add(Finding.of(CheckId.LABEL_TOO_LONG, subject,
                                "very long " + property + " (" + text.length() + " chars) in " + subject + ": '"
                                        + text.substring(0, Math.min(50, text.length())) + "...'"));
                    }
                    String lower = text.toLowerCase();
                    if (lower.startsWith("http://") || lower.startsWith("https://")) {
                        findings.add(Finding.of(CheckId.LABEL_LOOKS_LIKE_URI, subject,
                                property + " looks like a URI in " + subject + ": '" + text + "'"));
                    }
                }
            }
        }
        return findings;
    }
}
