package no.cantara.skos.model;

import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Resolves relative references against a document base and back.
 *
 * <p>Resolution is plain concatenation rather than RFC 3986 merging, so that
 * {@code relativize(base, absolutize(base, r)) == r} holds for every base and every relative
 * reference {@code r}. A {@code /} is inserted when the base ends with neither {@code /} nor
 * {@code #} and the reference does not start with {@code #}.
 */
public final class IdentifierResolver {

    private IdentifierResolver() {}

    private static final Pattern SCHEME = Pattern.compile("^[A-Za-z][A-Za-z0-9+.\\-]*:");

    public static boolean hasScheme(String reference) {
        return reference != null && SCHEME.matcher(reference).find();
    }

    /**
     * @return the absolute form, or {@code null} when {@code reference} is relative and there
     *         is no base
     */
    public static String absolutize(String base, String reference) {
        if (hasScheme(reference)) return reference;
        if (base == null) return null;
        if (reference.isEmpty() || reference.startsWith("#") || endsWithDelimiter(base)) {
            return base + reference;
        }
        return base + "/" + reference;
    }

    /**
     * @return the reference relative to {@code base}, or empty when the IRI is not under it or
     *         when the remainder would read back as an absolute IRI ({@code a:b})
     */
    public static Optional<String> relativize(String base, String absolute) {
        if (base == null || absolute == null || !absolute.startsWith(base)) return Optional.empty();
        String rest = absolute.substring(base.length());
        if (rest.isEmpty() || endsWithDelimiter(base) || rest.startsWith("#")) {
            return safeRelative(rest);
        }
        if (rest.startsWith("/")) {
            return safeRelative(rest.substring(1));
        }
        return Optional.empty();
    }

    private static Optional<String> safeRelative(String reference) {
        int colon = reference.indexOf(':');
        if (colon >= 0) {
            int end = reference.length();
            for (char delimiter : new char[] {'/', '?', '#'}) {
                int at = reference.indexOf(delimiter);
                if (at >= 0 && at < end) end = at;
            }
            if (colon < end) return Optional.empty();
        }
        return Optional.of(reference);
    }

    /**
     * Removes backslash escapes from the local part of a prefixed name.
     */
    public static String unescapeLocal(String local) {
        if (local.indexOf('\\') < 0) return local;
        StringBuilder sb = new StringBuilder(local.length());
        for (int i = 0; i < local.length(); i++) {
            char c = local.charAt(i);
            if (c == '\\' && i + 1 < local.length()) {
                sb.append(local.charAt(++i));
            } else {
                sb.append(c);
            }
        }
        return sb.toString();
    }

    private static boolean endsWithDelimiter(String base) {
        return base.endsWith("/") || base.endsWith("#");
    }
}
