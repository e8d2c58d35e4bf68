package no.cantara.skos.reader;

import java.io.Reader;
import java.util.regex.Pattern;

/**
 * Splits Turtle text into tokens. Never throws on bad input: unreadable characters become
 * {@link TokenType#ERROR} tokens and the caller decides how to recover.
 *
 * <p>Two malformed spellings are repaired here and marked through {@link Token#repairedFrom()}:
 * whitespace directly inside {@code < >}, and an absolute IRI written without brackets.
 */
public class TurtleLexer {

    private static final Pattern SCHEME_ONLY = Pattern.compile("^[A-Za-z][A-Za-z0-9+.\\-]*:$");

    private final CharCursor cursor;

    public TurtleLexer(Reader in) {
        this.cursor = new CharCursor(in);
    }

    /** @return the next token; {@link TokenType#EOF} repeatedly once the input is exhausted */
    public Token next() {
        skipWhitespaceAndComments();
        int line = cursor.line();
        int c = cursor.peek();
        if (c < 0) return new Token(TokenType.EOF, "", line);
        return switch (c) {
            case '<' -> iri(line);
            case '"', '\'' -> string(line);
            case '@' -> atKeyword(line);
            case '^' -> datatypeMarker(line);
            case ';' -> punctuation(TokenType.SEMICOLON, line);
            case ',' -> punctuation(TokenType.COMMA, line);
            case '.' -> punctuation(TokenType.DOT, line);
            case '[' -> punctuation(TokenType.OPEN_BRACKET, line);
            case ']' -> punctuation(TokenType.CLOSE_BRACKET, line);
            case '(' -> punctuation(TokenType.OPEN_PAREN, line);
            case ')' -> punctuation(TokenType.CLOSE_PAREN, line);
            default -> {
                if (isNameStart(c)) yield word(line);
                cursor.next();
                yield new Token(TokenType.ERROR, "unexpected character '" + (char) c + "'", line);
            }
        };
    }

    private void skipWhitespaceAndComments() {
        while (true) {
            int c = cursor.peek();
            if (c == '#') {
                while (c >= 0 && c != '\n') {
                    cursor.next();
                    c = cursor.peek();
                }
            } else if (c >= 0 && Character.isWhitespace(c)) {
                cursor.next();
            } else {
                return;
            }
        }
    }

    private Token punctuation(TokenType type, int line) {
        return new Token(type, String.valueOf((char) cursor.next()), line);
    }

    private Token iri(int line) {
        cursor.next();
        StringBuilder sb = new StringBuilder();
        while (true) {
            int c = cursor.peek();
            if (c < 0 || c == '\n' || c == '<') {
                return new Token(TokenType.ERROR, "unterminated IRI '<" + sb + "'", line);
            }
            cursor.next();
            if (c == '>') break;
            sb.append((char) c);
        }
        String raw = sb.toString();
        String trimmed = raw.strip();
        if (!trimmed.equals(raw)) {
            return new Token(TokenType.IRI, trimmed, line, "<" + raw + ">");
        }
        return new Token(TokenType.IRI, raw, line);
    }

    private Token string(int line) {
        int quote = cursor.next();
        boolean longForm = cursor.peek() == quote && cursor.peek(1) == quote;
        if (longForm) {
            cursor.next();
            cursor.next();
        }
        StringBuilder sb = new StringBuilder();
        while (true) {
            int c = cursor.peek();
            if (c < 0 || (!longForm && c == '\n')) {
                return new Token(TokenType.ERROR, "unterminated string \"" + sb + "\"", line);
            }
            if (c == quote) {
                if (!longForm) {
                    cursor.next();
                    break;
                }
                if (cursor.peek(1) == quote && cursor.peek(2) == quote) {
                    cursor.next();
                    cursor.next();
                    cursor.next();
                    break;
                }
            }
            cursor.next();
            if (c == '\\') {
                escape(sb);
            } else {
                sb.append((char) c);
            }
        }
        return new Token(TokenType.STRING, sb.toString(), line);
    }

    private void escape(StringBuilder sb) {
        int c = cursor.next();
        switch (c) {
            case 't' -> sb.append('\t');
            case 'b' -> sb.append('\b');
            case 'n' -> sb.append('\n');
            case 'r' -> sb.append('\r');
            case 'f' -> sb.append('\f');
            case 'u' -> unicode(sb, 4);
            case 'U' -> unicode(sb, 8);
            case -1 -> sb.append('\\');
            default -> sb.append((char) c);
        }
    }

    private void unicode(StringBuilder sb, int digits) {
        StringBuilder hex = new StringBuilder(digits);
        for (int i = 0; i < digits && isHex(cursor.peek()); i++) {
            hex.append((char) cursor.next());
        }
        if (hex.length() == digits) {
            sb.appendCodePoint(Integer.parseInt(hex.toString(), 16));
        } else {
            sb.append(digits == 4 ? "\\u" : "\\U").append(hex);
        }
    }

    private Token atKeyword(int line) {
        cursor.next();
        StringBuilder sb = new StringBuilder();
        while (isLangChar(cursor.peek())) {
            sb.append((char) cursor.next());
        }
        String word = sb.toString();
        return switch (word) {
            case "prefix" -> new Token(TokenType.PREFIX_DIRECTIVE, word, line);
            case "base" -> new Token(TokenType.BASE_DIRECTIVE, word, line);
            case "" -> new Token(TokenType.ERROR, "stray '@'", line);
            default -> new Token(TokenType.LANGTAG, word, line);
        };
    }

    private Token datatypeMarker(int line) {
        cursor.next();
        if (cursor.peek() == '^') {
            cursor.next();
            return new Token(TokenType.DATATYPE_MARKER, "^^", line);
        }
        return new Token(TokenType.ERROR, "stray '^'", line);
    }

    private Token word(int line) {
        StringBuilder sb = new StringBuilder();
        while (true) {
            int c = cursor.peek();
            if (c == '\\' && cursor.peek(1) >= 0) {
                sb.append((char) cursor.next()).append((char) cursor.next());
            } else if (isNameChar(c) || (c == '.' && isNameChar(cursor.peek(1)))) {
                sb.append((char) cursor.next());
            } else {
                break;
            }
        }
        String word = sb.toString();
        if (SCHEME_ONLY.matcher(word).matches() && cursor.peek() == '/' && cursor.peek(1) == '/') {
            return bareIri(sb, line);
        }
        if (word.startsWith("_:")) return new Token(TokenType.BLANK_NODE, word, line);
        if (word.indexOf(':') >= 0) return new Token(TokenType.PREFIXED_NAME, word, line);
        return new Token(TokenType.WORD, word, line);
    }

    /** An absolute IRI written without angle brackets, such as {@code http://example.org/x}. */
    private Token bareIri(StringBuilder sb, int line) {
        while (true) {
            int c = cursor.peek();
            if (c < 0 || Character.isWhitespace(c) || "<>\"{}|^`;,".indexOf(c) >= 0) break;
            if (c == '.') {
                int after = cursor.peek(1);
                if (after < 0 || Character.isWhitespace(after)) break;
            }
            sb.append((char) cursor.next());
        }
        String iri = sb.toString();
        return new Token(TokenType.IRI, iri, line, iri);
    }

    private static boolean isNameStart(int c) {
        return c >= 0 && (Character.isLetterOrDigit(c) || c == '_' || c == ':' || c == '-' || c == '+');
    }

    private static boolean isNameChar(int c) {
        return isNameStart(c) || c == '%';
    }

    private static boolean isLangChar(int c) {
        return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z') || (c >= '0' && c <= '9') || c == '-';
    }

    private static boolean isHex(int c) {
        return (c >= '0' && c <= '9') || (c >= 'a' && c <= 'f') || (c >= 'A' && c <= 'F');
    }
}
