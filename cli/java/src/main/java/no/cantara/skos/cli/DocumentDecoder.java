package no.cantara.skos.cli;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.Charset;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * Decodes an input file, trying UTF-8 first (byte-order mark stripped), then windows-1252,
 * then ISO-8859-1.
 */
public final class DocumentDecoder {

    private static final Logger log = LoggerFactory.getLogger(DocumentDecoder.class);

    static final List<Charset> CHARSETS = List.of(
            StandardCharsets.UTF_8,
            Charset.forName("windows-1252"),
            StandardCharsets.ISO_8859_1);

    private DocumentDecoder() {}

    /**
     * @param text    decoded content
     * @param charset the charset that decoded it
     */
    public record Decoded(String text, Charset charset) {}

    public static Decoded decode(Path path) throws IOException {
        return decode(Files.readAllBytes(path), path.toString());
    }

    static Decoded decode(byte[] bytes, String source) throws CharacterCodingException {
        CharacterCodingException last = null;
        for (Charset charset : CHARSETS) {
            try {
                String text = charset.newDecoder()
                        .onMalformedInput(CodingErrorAction.REPORT)
                        .onUnmappableCharacter(CodingErrorAction.REPORT)
                        .decode(ByteBuffer.wrap(bytes))
                        .toString();
                if (charset.equals(StandardCharsets.UTF_8) && text.startsWith("\uFEFF")) {
                    text = text.substring(1);
                }
                if (!charset.equals(StandardCharsets.UTF_8)) {
                    log.warn("{} is not valid UTF-8; decoded as {}", source, charset.name());
                }
                return new Decoded(text, charset);
            } catch (CharacterCodingException e) {
                log.debug("{} does not decode as {}", source, charset.name());
                last = e;
            }
        }
        throw last;
    }
}
