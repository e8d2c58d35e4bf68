package no.cantara.skos.report;

import no.cantara.skos.model.ChangeCategory;
import no.cantara.skos.model.ChangeRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Collects change records and processing counters during one cleaning run.
 *
 * <p>Not thread-safe; one recorder belongs to one run.
 */
public class ChangeRecorder {

    private static final Logger log = LoggerFactory.getLogger(ChangeRecorder.class);

    private final List<ChangeRecord> changes = new ArrayList<>();
    private final Map<ChangeCategory, Integer> counts = new EnumMap<>(ChangeCategory.class);
    private int conceptsProcessed;
    private int labelsProcessed;

    public void record(ChangeRecord change) {
        changes.add(change);
        counts.merge(change.category(), 1, Integer::sum);
        log.debug("{}", change.describe());
    }

    public void record(ChangeCategory category, String subject) {
        record(ChangeRecord.of(category, subject));
    }

    public void record(ChangeCategory category, String before, String after) {
        record(ChangeRecord.of(category, before, after));
    }

    public void conceptProcessed() {
        conceptsProcessed++;
    }

    public void labelProcessed() {
        labelsProcessed++;
    }

    public List<ChangeRecord> changes() {
        return Collections.unmodifiableList(changes);
    }

    public int count(ChangeCategory category) {
        return counts.getOrDefault(category, 0);
    }

    public int conceptsProcessed() {
        return conceptsProcessed;
    }

    public int labelsProcessed() {
        return labelsProcessed;
    }
}
