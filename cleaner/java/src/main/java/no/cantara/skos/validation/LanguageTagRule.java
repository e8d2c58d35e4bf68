package no.cantara.skos.validation;

import no.cantara.skos.model.CheckId;
import no.cantara.skos.model.ConceptGraph;
import no.cantara.skos.model.ConceptNode;
import no.cantara.skos.model.Finding;
import no.cantara.skos.model.LabelKey;
import no.cantara.skos.model.Literal;
import no.cantara.skos.model.NoteKind;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Language tags of labels and documentation must be well-formed BCP 47 tags.
 */
class LanguageTagRule implements ValidationRule {

    // language(-extlang){0,3} | 4-8 letters, then script, region, variants, extensions, private use
    static final Pattern BCP47 = Pattern.compile(
            "^(?:(?:[A-Za-z]{2,3}(?:-[A-Za-z]{3}){0,3}|[A-Za-z]{4,8})"
                    + "(?:-[A-Za-z]{4})?"
                    + "(?:-(?:[A-Za-z]{2}|[0-9]{3}))?"
                    + "(?:-(?:[A-Za-z0-9]{5,8}|[0-9][A-Za-z0-9]{3}))*"
                    + "(?:-[0-9A-WY-Za-wy-z](?:-[A-Za-z0-9]{2,8})+)*"
                    + "(?:-[Xx](?:-[A-Za-z0-9]{1,8})+)?"
                    + "|[Xx](?:-[A-Za-z0-9]{1,8})+)$");

    static boolean isWellFormed(String tag) {
        return BCP47.matcher(tag).matches();
    }

    @Override
    public List<Finding> validate(ConceptGraph graph) {
        List<Finding> findings = new ArrayList<>();
        for (ConceptNode node : graph.nodes()) {
            Set<String> tags = new LinkedHashSet<>();
            for (LabelKey key : node.labels().keySet()) {
                if (key.language() != null) tags.add(key.language());
            }
            for (NoteKind note : NoteKind.values()) {
                for (Literal value : node.notes(note)) {
                    if (value.language() != null) tags.add(value.language());
                }
            }
            for (String tag : tags) {
                if (isWellFormed(tag)) continue;
                String subject = graph.display(node.id());
                findings.add(Finding.of(CheckId.LANGUAGE_TAG, subject,
                        "possibly invalid language tag '" + tag + "' in " + subject));
            }
        }
        return findings;
    }
}
