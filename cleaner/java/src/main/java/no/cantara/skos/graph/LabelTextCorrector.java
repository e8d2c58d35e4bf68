package no.cantara.skos.graph;

import no.cantara.skos.model.ChangeCategory;
import no.cantara.skos.model.TurtleText;
import no.cantara.skos.report.ChangeRecorder;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Text corrections applied to label and documentation values.
 *
 * <p>Labels get, in order: repair of UTF-8 text that was decoded as Latin-1, whitespace collapse,
 * and a space after every comma directly followed by a non-space. Documentation texts only
 * get the encoding repair.
 */
public final class LabelTextCorrector {

    private LabelTextCorrector() {}

    private static final Map<String, String> MOJIBAKE = new LinkedHashMap<>();
    static {
        MOJIBAKE.put("Ã¤", "ä");
        MOJIBAKE.put("Ã¶", "ö");
        MOJIBAKE.put("Ã¼", "ü");
        MOJIBAKE.put("Ã„", "Ä");
        MOJIBAKE.put("Ã–", "Ö");
        MOJIBAKE.put("Ãœ", "Ü");
        MOJIBAKE.put("ÃŸ", "ß");
        MOJIBAKE.put("Ã©", "é");
        MOJIBAKE.put("Ã¨", "è");
        MOJIBAKE.put("Ã¡", "á");
        MOJIBAKE.put("Ã ", "à");
        MOJIBAKE.put("Ã³", "ó");
        MOJIBAKE.put("Ã²", "ò");
        MOJIBAKE.put("Ãº", "ú");
        MOJIBAKE.put("Ã¹", "ù");
    }

    private static final Pattern WHITESPACE = Pattern.compile("\\s+");
    private static final Pattern COMMA_WITHOUT_SPACE = Pattern.compile(",(?=\\S)");

    public static String correctLabel(String text, ChangeRecorder recorder) {
        String repaired = repairEncoding(text, recorder);

        String collapsed = WHITESPACE.matcher(repaired).replaceAll(" ").strip();
        if (!collapsed.equals(repaired)) {
            recorder.record(ChangeCategory.WHITESPACE_NORMALIZED, repaired, collapsed);
        }

        String spaced = COMMA_WITHOUT_SPACE.matcher(collapsed).replaceAll(", ");
        if (!spaced.equals(collapsed)) {
            recorder.record(ChangeCategory.COMMA_SPACING_FIXED, TurtleText.snippet(collapsed), TurtleText.snippet(spaced));
        }
        return spaced;
    }

    public static String correctNote(String text, ChangeRecorder recorder) {
        return repairEncoding(text, recorder);
    }

    static String repairEncoding(String text, ChangeRecorder recorder) {
        if (text.indexOf('Ã') < 0) return text;
        String repaired = text;
        for (Map.Entry<String, String> e : MOJIBAKE.entrySet()) {
            repaired = repaired.replace(e.getKey(), e.getValue());
        }
        if (!repaired.equals(text)) {
            recorder.record(ChangeCategory.ENCODING_REPAIRED, TurtleText.snippet(text), TurtleText.snippet(repaired));
        }
        return repaired;
    }
}
