package no.cantara.skos.reader;

/**
 * A block the reader could not make sense of and dropped.
 *
 * @param text   snippet of the dropped source
 * @param reason what was wrong
 * @param line   line the block started on
 */
public record SkippedBlock(String text, String reason, int line) implements Statement {
}
