package no.cantara.skos.validation;

import no.cantara.skos.model.TurtleText;

final class Labels {

    private Labels() {}

    static String language(String tag) {
        return tag == null ? "no language tag" : "language '" + tag + "'";
    }

    static String literal(String text, String language) {
        return TurtleText.quote(text) + (language == null ? "" : "@" + language);
    }
}
