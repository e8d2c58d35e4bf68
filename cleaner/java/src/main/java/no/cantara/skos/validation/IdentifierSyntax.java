package no.cantara.skos.validation;

import no.cantara.skos.model.Term;

import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Syntax check for identifiers in subject and object position.
 *
 * <p>Accepted: an absolute IRI ({@code scheme:} followed by a non-empty body without
 * whitespace or any of {@code <>"{}|\^`}), a relative reference (same character set, and no
 * {@code :} before the first {@code /}, {@code ?} or {@code #}), a blank node label, or a
 * nested blank node.
 */
public final class IdentifierSyntax {

    private IdentifierSyntax() {}

    private static final Pattern ABSOLUTE = Pattern.compile("^[A-Za-z][A-Za-z0-9+.\\-]*:[^\\s<>\"{}|\\\\^`]+$");
    private static final Pattern RELATIVE = Pattern.compile("^[^\\s<>\"{}|\\\\^`:/?#]*([/?#][^\\s<>\"{}|\\\\^`]*)?$");

    public static boolean isAbsolute(String iri) {
        return ABSOLUTE.matcher(iri).matches();
    }

    public static boolean isRelative(String reference) {
        return RELATIVE.matcher(reference).matches();
    }

    /**
     * @return why the term is not a valid identifier, or empty when it is
     */
    public static Optional<String> problem(Term term) {
        return switch (term.kind()) {
            case BLANK_NODE -> Optional.empty();
            case RAW -> term.lexical().startsWith("[")
                    ? Optional.empty()
                    : Optional.of("value " + term.written() + " used where an identifier is expected");
            case LITERAL -> Optional.of("literal " + term.written() + " used where an identifier is expected");
            case PREFIXED_NAME -> term.absolute() == null
                    ? Optional.of("undeclared prefix '" + term.lexical().substring(0, term.lexical().indexOf(':')) + "'")
                    : absolute(term);
            case BARE_WORD, IRI -> {
                if (term.absolute() != null) yield absolute(term);
                yield isRelative(term.lexical())
                        ? Optional.empty()
                        : Optional.of("malformed identifier " + term.written());
            }
        };
    }

    private static Optional<String> absolute(Term term) {
        return isAbsolute(term.absolute())
                ? Optional.empty()
                : Optional.of("malformed IRI <" + term.absolute() + ">");
    }
}
