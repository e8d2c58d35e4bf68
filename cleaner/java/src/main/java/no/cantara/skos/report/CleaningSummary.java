package no.cantara.skos.report;

import no.cantara.skos.model.ChangeCategory;

/**
 * Aggregate counters of one cleaning run.
 *
 * @param conceptsProcessed      subject blocks read, duplicates included
 * @param duplicatesRemoved      blocks discarded because their subject was already seen
 * @param labelsProcessed        label values read from kept blocks
 * @param commaSpacingFixes      labels whose comma spacing was corrected
 * @param identifiersFixed       malformed identifiers repaired
 * @param identifiersNormalized  prefixed-name subjects rewritten to full or relative form
 * @param syntaxFixes            separator repairs made by the reader
 * @param blocksSkipped          blocks dropped as unreadable
 * @param encodingRepairs        texts whose mis-decoded characters were repaired
 * @param whitespaceFixes        labels whose whitespace was collapsed
 * @param broaderAdded           edges inserted by hierarchy autofix
 * @param prefLabelsDemoted      surplus pref labels moved to alt labels
 * @param conceptsWithoutPrefLabel concepts in the output without any pref label
 * @param finalConceptCount      nodes in the output
 */
public record CleaningSummary(
        int conceptsProcessed,
        int duplicatesRemoved,
        int labelsProcessed,
        int commaSpacingFixes,
        int identifiersFixed,
        int identifiersNormalized,
        int syntaxFixes,
        int blocksSkipped,
        int encodingRepairs,
        int whitespaceFixes,
        int broaderAdded,
        int prefLabelsDemoted,
        int conceptsWithoutPrefLabel,
        int finalConceptCount
) {

    public static CleaningSummary from(ChangeRecorder recorder, int conceptsWithoutPrefLabel, int finalConceptCount) {
        return new CleaningSummary(
                recorder.conceptsProcessed(),
                recorder.count(ChangeCategory.DUPLICATE_REMOVED),
                recorder.labelsProcessed(),
                recorder.count(ChangeCategory.COMMA_SPACING_FIXED),
                recorder.count(ChangeCategory.IDENTIFIER_FIXED),
                recorder.count(ChangeCategory.IDENTIFIER_NORMALIZED),
                recorder.count(ChangeCategory.SYNTAX_FIXED),
                recorder.count(ChangeCategory.BLOCK_SKIPPED),
                recorder.count(ChangeCategory.ENCODING_REPAIRED),
                recorder.count(ChangeCategory.WHITESPACE_NORMALIZED),
                recorder.count(ChangeCategory.BROADER_ADDED),
                recorder.count(ChangeCategory.PREF_LABEL_DEMOTED),
                conceptsWithoutPrefLabel,
                finalConceptCount);
    }
}
