package no.cantara.skos.graph;

import no.cantara.skos.model.ChangeCategory;
import no.cantara.skos.model.ConceptGraph;
import no.cantara.skos.model.ConceptNode;
import no.cantara.skos.model.LabelKey;
import no.cantara.skos.model.LabelKind;
import no.cantara.skos.model.Term;
import no.cantara.skos.report.ChangeRecorder;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Keeps the first pref label per language and demotes the others to alt labels of the same
 * language, so the written vocabulary has at most one pref label per language.
 */
public final class LabelCardinalityRepair {

    private LabelCardinalityRepair() {}

    /** @return number of labels demoted */
    public static int repair(ConceptGraph graph, ChangeRecorder recorder) {
        int demoted = 0;
        for (ConceptNode node : graph.nodes()) {
            List<Map.Entry<LabelKey, List<String>>> surplus = new ArrayList<>();
            for (Map.Entry<LabelKey, Set<String>> e : node.labels().entrySet()) {
                if (e.getKey().kind() == LabelKind.PREF && e.getValue().size() > 1) {
                    List<String> extra = new ArrayList<>(e.getValue()).subList(1, e.getValue().size());
                    surplus.add(Map.entry(e.getKey(), extra));
                }
            }
            for (Map.Entry<LabelKey, List<String>> e : surplus) {
                String language = e.getKey().language();
                for (String text : e.getValue()) {
                    node.removeLabel(LabelKind.PREF, language, text);
                    node.addLabel(LabelKind.ALT, language, text);
                    recorder.record(ChangeCategory.PREF_LABEL_DEMOTED,
                            graph.display(node.id()) + " " + Term.literal(text, language, null).written());
                    demoted++;
                }
            }
        }
        return demoted;
    }
}
