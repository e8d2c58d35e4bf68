package no.cantara.skos.model;

/**
 * Composite key of the label map: label kind and language tag ({@code null} when untagged).
 */
public record LabelKey(LabelKind kind, String language) {
}
