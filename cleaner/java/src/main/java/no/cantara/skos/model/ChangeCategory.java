package no.cantara.skos.model;

/**
 * Kinds of repair the cleaner applies. The label is the text used in change logs.
 */
public enum ChangeCategory {
    SYNTAX_FIXED("syntax fixed"),
    BLOCK_SKIPPED("block skipped"),
    DUPLICATE_REMOVED("duplicate removed"),
    COMMA_SPACING_FIXED("comma spacing fixed"),
    WHITESPACE_NORMALIZED("label whitespace normalized"),
    ENCODING_REPAIRED("encoding repaired"),
    IDENTIFIER_FIXED("malformed identifier fixed"),
    IDENTIFIER_NORMALIZED("identifier normalized"),
    BROADER_ADDED("broader added (autofix)"),
    PREF_LABEL_DEMOTED("prefLabel demoted to altLabel");

    private final String label;

    ChangeCategory(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }
}
