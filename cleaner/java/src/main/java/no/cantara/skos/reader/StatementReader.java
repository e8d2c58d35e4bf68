package no.cantara.skos.reader;

import no.cantara.skos.model.ChangeCategory;
import no.cantara.skos.model.DocumentHeader;
import no.cantara.skos.model.IdentifierResolver;
import no.cantara.skos.model.Skos;
import no.cantara.skos.model.Term;
import no.cantara.skos.model.TurtleText;
import no.cantara.skos.report.ChangeRecorder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.Reader;
import java.io.StringReader;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.regex.Pattern;

/**
 * Reads a Turtle document as a lazy sequence of {@link Statement}s.
 *
 * <p>The reader is tolerant: common separator mistakes are repaired and recorded as
 * {@link ChangeCategory#SYNTAX_FIXED}; anything it cannot repair is dropped up to the next
 * top-level {@code .} and returned as a {@link SkippedBlock}. It never throws on bad input.
 *
 * <p>Prefixed names and relative IRIs are resolved with the directives read so far, so a
 * redeclared prefix applies to the statements after it.
 */
public class StatementReader implements Iterator<Statement> {

    private static final Logger log = LoggerFactory.getLogger(StatementReader.class);

    private static final Pattern LITERAL_WORD = Pattern.compile(
            "^([+-]?(\\d+(\\.\\d*)?|\\.\\d+)([eE][+-]?\\d+)?|true|false)$");

    private final TurtleLexer lexer;
    private final ChangeRecorder recorder;
    private final DocumentHeader.Builder header = new DocumentHeader.Builder();
    private final List<Token> lookahead = new ArrayList<>();
    private final List<Token> consumed = new ArrayList<>();
    private Statement pending;
    private boolean exhausted;

    public StatementReader(Reader in, ChangeRecorder recorder) {
        this.lexer = new TurtleLexer(in);
        this.recorder = recorder;
    }

    public static StatementReader of(String text, ChangeRecorder recorder) {
        return new StatementReader(new StringReader(text), recorder);
    }

    /** Directives read so far. Complete once the iteration is exhausted. */
    public DocumentHeader header() {
        return header.build();
    }

    @Override
    public boolean hasNext() {
        if (pending == null && !exhausted) {
            pending = readStatement();
            exhausted = pending == null;
        }
        return pending != null;
    }

    @Override
    public Statement next() {
        if (!hasNext()) throw new NoSuchElementException();
        Statement s = pending;
        pending = null;
        return s;
    }

    // ── statements ────────────────────────────────────────────────────────────────

    private Statement readStatement() {
        while (true) {
            consumed.clear();
            Token t = peek(0);
            int line = t.line();
            try {
                switch (t.type()) {
                    case EOF:
                        return null;
                    case DOT:
                        consume();
                        syntaxFixed(line, "stray '.' removed");
                        continue;
                    case PREFIX_DIRECTIVE:
                        consume();
                        return prefixDirective(line, true);
                    case BASE_DIRECTIVE:
                        consume();
                        return baseDirective(line, true);
                    case WORD:
                        if (t.text().equalsIgnoreCase("PREFIX") && peek(1).type() == TokenType.PREFIXED_NAME) {
                            consume();
                            return prefixDirective(line, false);
                        }
                        if (t.text().equalsIgnoreCase("BASE") && peek(1).type() == TokenType.IRI) {
                            consume();
                            return baseDirective(line, false);
                        }
                        return subjectBlock(line);
                    default:
                        return subjectBlock(line);
                }
            } catch (MalformedBlock e) {
                return skip(e.getMessage(), line);
            }
        }
    }

    private Statement prefixDirective(int line, boolean atForm) {
        Token name = consume();
        if (name.type() != TokenType.PREFIXED_NAME || !name.text().endsWith(":")) {
            throw new MalformedBlock("malformed prefix directive");
        }
        Token iri = consume();
        if (iri.type() != TokenType.IRI) {
            throw new MalformedBlock("prefix directive without namespace IRI");
        }
        String prefix = name.text().substring(0, name.text().length() - 1);
        String namespace = resolve(iri.text());
        if (namespace == null) namespace = iri.text();
        directiveEnd(line, atForm, "@prefix " + name.text());
        header.prefix(prefix, namespace);
        return new PrefixDirective(prefix, namespace, line);
    }

    private Statement baseDirective(int line, boolean atForm) {
        Token iri = consume();
        if (iri.type() != TokenType.IRI) {
            throw new MalformedBlock("base directive without IRI");
        }
        String base = resolve(iri.text());
        if (base == null) base = iri.text();
        directiveEnd(line, atForm, "@base");
        header.base(base);
        return new BaseDirective(base, line);
    }

    private void directiveEnd(int line, boolean atForm, String directive) {
        if (peek(0).type() == TokenType.DOT) {
            consume();
        } else if (atForm) {
            syntaxFixed(line, "missing '.' after " + directive);
        }
    }

    private Statement subjectBlock(int line) {
        Token t = consume();
        Term subject = switch (t.type()) {
            case IRI, PREFIXED_NAME, WORD, BLANK_NODE -> identifier(t);
            case OPEN_BRACKET -> throw new MalformedBlock("anonymous blank node subject");
            case ERROR -> throw new MalformedBlock(t.text());
            default -> throw new MalformedBlock("unexpected '" + t.written() + "' at start of block");
        };
        return new SubjectBlock(subject, predicateObjectList(), line);
    }

    // ── properties ────────────────────────────────────────────────────────────────

    private enum Boundary { NEXT_PROPERTY, END }

    private List<PropertyEntry> predicateObjectList() {
        List<PropertyEntry> entries = new ArrayList<>();
        while (true) {
            Token p = peek(0);
            if (!isPredicateStart(p)) {
                if (p.type() == TokenType.ERROR) throw new MalformedBlock(p.text());
                if (entries.isEmpty() && (p.type() == TokenType.DOT || p.type() == TokenType.EOF)) {
                    throw new MalformedBlock("block without predicate");
                }
                throw new MalformedBlock("unexpected '" + p.written() + "' where a predicate was expected");
            }
            consume();
            Term predicate = predicate(p);
            List<Term> values = new ArrayList<>();
            values.add(object());
            Boundary boundary = objectListTail(values);
            entries.add(new PropertyEntry(predicate, values));
            if (boundary == Boundary.END) return entries;
        }
    }

    private Boundary objectListTail(List<Term> values) {
        while (true) {
            Token t = peek(0);
            switch (t.type()) {
                case COMMA -> {
                    Token after = peek(1);
                    if (after.type() == TokenType.SEMICOLON || after.type() == TokenType.DOT || after.type() == TokenType.EOF) {
                        consume();
                        syntaxFixed(t.line(), "dangling ',' removed");
                    } else if (commaStartsProperty(after)) {
                        consume();
                        syntaxFixed(t.line(), "',' before " + after.written() + " read as ';'");
                        return Boundary.NEXT_PROPERTY;
                    } else {
                        consume();
                        values.add(object());
                    }
                }
                case SEMICOLON -> {
                    consume();
                    while (peek(0).type() == TokenType.SEMICOLON) consume();
                    Token n = peek(0);
                    if (n.type() == TokenType.DOT) {
                        consume();
                        return Boundary.END;
                    }
                    if (n.type() == TokenType.EOF) {
                        syntaxFixed(n.line(), "missing '.' at end of input");
                        return Boundary.END;
                    }
                    return Boundary.NEXT_PROPERTY;
                }
                case DOT -> {
                    consume();
                    return Boundary.END;
                }
                case EOF -> {
                    syntaxFixed(t.line(), "missing '.' at end of input");
                    return Boundary.END;
                }
                default -> {
                    if (isPredicateStart(t) && isTypeKeyword(peek(1))) {
                        syntaxFixed(t.line(), "missing '.' inserted before " + t.written());
                        return Boundary.END;
                    }
                    if (isPredicateStart(t) && isObjectStart(peek(1))) {
                        syntaxFixed(t.line(), "missing ';' inserted before " + t.written());
                        return Boundary.NEXT_PROPERTY;
                    }
                    if (t.type() == TokenType.STRING) {
                        syntaxFixed(t.line(), "missing ',' inserted before " + TurtleText.snippet(t.written()));
                        values.add(object());
                    } else if (t.type() == TokenType.ERROR) {
                        throw new MalformedBlock(t.text());
                    } else {
                        throw new MalformedBlock("unexpected '" + t.written() + "' after a value");
                    }
                }
            }
        }
    }

    // ── terms ─────────────────────────────────────────────────────────────────────

    private Term predicate(Token t) {
        if (isTypeKeyword(t)) return Term.bareWord("a", Skos.RDF_TYPE);
        return identifier(t);
    }

    private Term object() {
        Token t = consume();
        return switch (t.type()) {
            case IRI, PREFIXED_NAME, BLANK_NODE -> identifier(t);
            case WORD -> LITERAL_WORD.matcher(t.text()).matches() ? Term.raw(t.text()) : identifier(t);
            case STRING -> literal(t);
            case OPEN_BRACKET, OPEN_PAREN -> nested(t);
            case ERROR -> throw new MalformedBlock(t.text());
            default -> throw new MalformedBlock("expected a value but found '" + t.written() + "'");
        };
    }

    private Term literal(Token string) {
        Token next = peek(0);
        if (next.type() == TokenType.LANGTAG) {
            consume();
            return Term.literal(string.text(), next.text(), null);
        }
        if (next.type() == TokenType.DATATYPE_MARKER) {
            consume();
            Token datatype = consume();
            if (datatype.type() != TokenType.IRI && datatype.type() != TokenType.PREFIXED_NAME) {
                throw new MalformedBlock("datatype marker without datatype");
            }
            return Term.literal(string.text(), null, identifier(datatype));
        }
        return Term.literal(string.text(), null, null);
    }

    /** Captures a {@code [...]} or {@code (...)} construct as raw text. */
    private Term nested(Token open) {
        List<Token> tokens = new ArrayList<>();
        tokens.add(open);
        Deque<TokenType> closers = new ArrayDeque<>();
        closers.push(closerOf(open.type()));
        while (!closers.isEmpty()) {
            Token t = peek(0);
            switch (t.type()) {
                case EOF, DOT, ERROR, PREFIX_DIRECTIVE, BASE_DIRECTIVE ->
                        throw new MalformedBlock("unbalanced '" + open.text() + "'");
                default -> { }
            }
            consume();
            tokens.add(t);
            if (t.type() == TokenType.OPEN_BRACKET || t.type() == TokenType.OPEN_PAREN) {
                closers.push(closerOf(t.type()));
            } else if (t.type() == TokenType.CLOSE_BRACKET || t.type() == TokenType.CLOSE_PAREN) {
                if (closers.pop() != t.type()) {
                    throw new MalformedBlock("unbalanced '" + open.text() + "'");
                }
            }
        }
        return Term.raw(Token.join(tokens));
    }

    private static TokenType closerOf(TokenType open) {
        return open == TokenType.OPEN_BRACKET ? TokenType.CLOSE_BRACKET : TokenType.CLOSE_PAREN;
    }

    private Term identifier(Token t) {
        return switch (t.type()) {
            case IRI -> Term.iri(t.text(), resolve(t.text()), t.repairedFrom());
            case PREFIXED_NAME -> {
                int colon = t.text().indexOf(':');
                String namespace = header.namespace(t.text().substring(0, colon));
                yield Term.prefixedName(t.text(), namespace == null
                        ? null
                        : namespace + IdentifierResolver.unescapeLocal(t.text().substring(colon + 1)));
            }
            case WORD -> Term.bareWord(t.text(), IdentifierResolver.absolutize(header.base(), t.text()));
            case BLANK_NODE -> Term.blankNode(t.text());
            default -> throw new MalformedBlock("expected an identifier but found '" + t.written() + "'");
        };
    }

    private String resolve(String iri) {
        return IdentifierResolver.absolutize(header.base(), iri);
    }

    private static boolean isPredicateStart(Token t) {
        return t.type() == TokenType.IRI || t.type() == TokenType.PREFIXED_NAME || t.type() == TokenType.WORD;
    }

    private static boolean isObjectStart(Token t) {
        return switch (t.type()) {
            case IRI, PREFIXED_NAME, WORD, BLANK_NODE, STRING, OPEN_BRACKET, OPEN_PAREN -> true;
            default -> false;
        };
    }

    /**
     * A comma followed by {@code prefix:name <object>} begins a new property, unless the
     * object is itself followed by {@code a}: that is a value list running into the next
     * subject with its '.' missing.
     */
    private boolean commaStartsProperty(Token after) {
        return after.type() == TokenType.PREFIXED_NAME
                && isObjectStart(peek(2))
                && !isTypeKeyword(peek(3));
    }

    private static boolean isTypeKeyword(Token t) {
        return t.type() == TokenType.WORD && t.text().equals("a");
    }

    // ── recovery ──────────────────────────────────────────────────────────────────

    private SkippedBlock skip(String reason, int line) {
        while (true) {
            Token t = peek(0);
            if (t.type() == TokenType.EOF
                    || t.type() == TokenType.PREFIX_DIRECTIVE
                    || t.type() == TokenType.BASE_DIRECTIVE) {
                break;
            }
            consume();
            if (t.type() == TokenType.DOT) break;
        }
        String text = TurtleText.snippet(Token.join(consumed));
        log.warn("Skipping block at line {}: {}", line, reason);
        recorder.record(ChangeCategory.BLOCK_SKIPPED, "line " + line + ": " + reason + ": " + text);
        return new SkippedBlock(text, reason, line);
    }

    private void syntaxFixed(int line, String what) {
        log.debug("Syntax fixed at line {}: {}", line, what);
        recorder.record(ChangeCategory.SYNTAX_FIXED, "line " + line + ": " + what);
    }

    private Token peek(int ahead) {
        while (lookahead.size() <= ahead) {
            lookahead.add(lexer.next());
        }
        return lookahead.get(ahead);
    }

    private Token consume() {
        Token t = peek(0);
        lookahead.remove(0);
        consumed.add(t);
        return t;
    }

    private static final class MalformedBlock extends RuntimeException {
        MalformedBlock(String reason) {
            super(reason, null, false, false);
        }
    }
}
