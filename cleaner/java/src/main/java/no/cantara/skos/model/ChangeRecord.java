package no.cantara.skos.model;

/**
 * One repair applied to the document.
 *
 * @param category what kind of repair
 * @param before   snippet before the repair, or the subject of the repair
 * @param after    snippet after the repair, or {@code null} when there is nothing to show
 */
public record ChangeRecord(ChangeCategory category, String before, String after) {

    public static ChangeRecord of(ChangeCategory category, String subject) {
        return new ChangeRecord(category, subject, null);
    }

    public static ChangeRecord of(ChangeCategory category, String before, String after) {
        return new ChangeRecord(category, before, after);
    }

    /** {@code "category: before"} or {@code "category: 'before' → 'after'"}. */
    public String describe() {
        if (after == null) {
            return category.label() + ": " + before;
        }
        return category.label() + ": '" + before + "' → '" + after + "'";
    }
}
