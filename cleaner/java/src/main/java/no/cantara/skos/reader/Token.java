package no.cantara.skos.reader;

import no.cantara.skos.model.TurtleText;

import java.util.List;

/**
 * A lexical token.
 *
 * @param type         token type
 * @param text         IRI content, unescaped string, language tag, name, or punctuation
 * @param line         1-based line the token starts on
 * @param repairedFrom original spelling of an IRI the lexer repaired, else {@code null}
 */
public record Token(TokenType type, String text, int line, String repairedFrom) {

    public Token(TokenType type, String text, int line) {
        this(type, text, line, null);
    }

    /** The token as Turtle source. */
    public String written() {
        return switch (type) {
            case IRI -> "<" + text + ">";
            case STRING -> TurtleText.quote(text);
            case LANGTAG -> "@" + text;
            case BASE_DIRECTIVE -> "@base";
            case PREFIX_DIRECTIVE -> "@prefix";
            case EOF -> "";
            default -> text;
        };
    }

    /** Re-assembles a token run into source text with conventional spacing. */
    static String join(List<Token> tokens) {
        StringBuilder sb = new StringBuilder();
        Token previous = null;
        for (Token t : tokens) {
            if (t.type() == TokenType.EOF) continue;
            if (previous != null && spaceBetween(previous, t)) sb.append(' ');
            sb.append(t.written());
            previous = t;
        }
        return sb.toString();
    }

    private static boolean spaceBetween(Token previous, Token t) {
        return switch (t.type()) {
            case LANGTAG, DATATYPE_MARKER, COMMA, SEMICOLON, DOT -> false;
            default -> previous.type() != TokenType.DATATYPE_MARKER;
        };
    }
}
