package no.cantara.skos.hierarchy;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * A segmented naming code taken from the last path segment of an identifier, such as
 * {@code 12.34.5} or {@code 42-10}.
 *
 * @param text     the code as written
 * @param segments the alphanumeric groups, in order
 */
public record HierarchyCode(String text, List<String> segments) {

    private static final Pattern CODE = Pattern.compile("^[A-Za-z0-9]+([.\\-][A-Za-z0-9]+)*$");

    public HierarchyCode {
        segments = List.copyOf(segments);
    }

    /**
     * Extracts the code of an identifier.
     *
     * @return the code, or empty when the final segment is not a code
     */
    public static Optional<HierarchyCode> of(String identifier) {
        if (identifier == null) return Optional.empty();
        String s = identifier;
        if (s.startsWith("<") && s.endsWith(">")) {
            s = s.substring(1, s.length() - 1);
        }
        int cut = Math.max(s.lastIndexOf('/'), s.lastIndexOf('#'));
        String last = s.substring(cut + 1);
        if (!CODE.matcher(last).matches()) return Optional.empty();
        return Optional.of(new HierarchyCode(last, List.of(last.split("[.\\-]"))));
    }

    /** {@code true} when every segment is made of digits only, as in {@code 12.34.5}. */
    public boolean isNumeric() {
        return segments.stream().allMatch(seg -> seg.chars().allMatch(c -> c >= '0' && c <= '9'));
    }

    public int depth() {
        return segments.size();
    }

    /**
     * Proper non-empty prefixes of this code, nearest first: {@code 1.2.3} gives
     * {@code [1.2, 1]}. Delimiters are kept as written.
     */
    public List<String> ancestors() {
        List<String> result = new ArrayList<>(segments.size());
        int end = text.length();
        for (int k = segments.size() - 1; k >= 1; k--) {
            end -= segments.get(k).length() + 1;
            result.add(text.substring(0, end));
        }
        return result;
    }

    @Override
    public String toString() {
        return text;
    }
}
