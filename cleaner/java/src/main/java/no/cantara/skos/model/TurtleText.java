package no.cantara.skos.model;

/**
 * String helpers shared by the reader, the serializer and the change log.
 */
public final class TurtleText {

    private TurtleText() {}

    private static final int SNIPPET_LENGTH = 120;

    /** Quotes and escapes a literal for a short-string Turtle literal. */
    public static String quote(String text) {
        StringBuilder sb = new StringBuilder(text.length() + 2);
        sb.append('"');
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            switch (c) {
                case '"' -> sb.append("\\\"");
                case '\\' -> sb.append("\\\\");
                case '\n' -> sb.append("\\n");
                case '\r' -> sb.append("\\r");
                case '\t' -> sb.append("\\t");
                default -> sb.append(c);
            }
        }
        return sb.append('"').toString();
    }

    /** Shortens a change-log snippet to 120 characters. */
    public static String snippet(String text) {
        if (text == null) return null;
        String s = text.strip();
        if (s.length() > SNIPPET_LENGTH) {
            return s.substring(0, SNIPPET_LENGTH - 3) + "...";
        }
        return s;
    }
}
