package no.cantara.skos;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.HashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class CleanerOptionsTest {

    @Test
    void defaultsValidateWithoutAutofix() {
        CleanerOptions d = CleanerOptions.defaults();
        assertTrue(d.validate());
        assertFalse(d.autofixBroader());
        assertFalse(d.warnMissingNarrower());
        assertFalse(d.extendedLabelValidation());
        assertFalse(d.memoryEfficient());
        assertEquals(1000, d.chunkSize());
        assertEquals(500, d.maxLabelLength());
    }

    @Test
    void fromMapOverridesGivenKeysOnly() {
        CleanerOptions o = CleanerOptions.fromMap(Map.of("autofix_broader", true, "chunk_size", 50));
        assertTrue(o.autofixBroader());
        assertEquals(50, o.chunkSize());
        assertTrue(o.validate());
    }

    @Test
    void unknownKeysAreIgnored() {
        CleanerOptions o = CleanerOptions.fromMap(Map.of("colour", "blue", "validation", false));
        assertFalse(o.validate());
    }

    @Test
    void rejectsWrongValueTypes() {
        assertThrows(IllegalArgumentException.class, () -> CleanerOptions.fromMap(Map.of("validation", "yes")));
        assertThrows(IllegalArgumentException.class, () -> CleanerOptions.fromMap(Map.of("chunk_size", "many")));
    }

    @Test
    void rejectsNonPositiveSizes() {
        assertThrows(IllegalArgumentException.class, () -> CleanerOptions.fromMap(Map.of("chunk_size", 0)));
        assertThrows(IllegalArgumentException.class, () -> CleanerOptions.defaults().withChunkSize(-5));
        Map<String, Object> data = new HashMap<>();
        data.put("max_label_length", 0);
        assertThrows(IllegalArgumentException.class, () -> CleanerOptions.fromMap(data));
    }

    @Test
    void withMethodsChangeOneField() {
        CleanerOptions o = CleanerOptions.defaults()
                .withAutofixBroader(true)
                .withWarnMissingNarrower(true)
                .withExtendedLabelValidation(true)
                .withMemoryEfficient(true)
                .withValidate(false);
        assertTrue(o.autofixBroader());
        assertTrue(o.warnMissingNarrower());
        assertTrue(o.extendedLabelValidation());
        assertTrue(o.memoryEfficient());
        assertFalse(o.validate());
        assertEquals(1000, o.chunkSize());
    }

    // -----------------------------------------------------------------------
    // YAML file
    // -----------------------------------------------------------------------

    @Test
    void loadsYamlFile(@TempDir Path dir) throws IOException {
        Path file = dir.resolve("cleaner.yaml");
        Files.writeString(file, """
                autofix_broader: true
                warn_missing_narrower: true
                skos_xl: true
                memory_efficient: true
                chunk_size: 200
                max_label_length: 80
                """);

        CleanerOptions o = CleanerOptions.load(file);
        assertTrue(o.autofixBroader());
        assertTrue(o.warnMissingNarrower());
        assertTrue(o.extendedLabelValidation());
        assertTrue(o.memoryEfficient());
        assertEquals(200, o.chunkSize());
        assertEquals(80, o.maxLabelLength());
    }

    @Test
    void emptyYamlFileGivesDefaults(@TempDir Path dir) throws IOException {
        Path file = dir.resolve("empty.yaml");
        Files.writeString(file, "# nothing configured\n");
        assertEquals(CleanerOptions.defaults(), CleanerOptions.load(file));
    }

    @Test
    void rejectsYamlThatIsNotAMapping(@TempDir Path dir) throws IOException {
        Path file = dir.resolve("list.yaml");
        Files.writeString(file, "- autofix_broader\n- skos_xl\n");
        IllegalArgumentException e = assertThrows(IllegalArgumentException.class, () -> CleanerOptions.load(file));
        assertTrue(e.getMessage().contains("mapping"));
    }

    @Test
    void rejectsMalformedYaml(@TempDir Path dir) throws IOException {
        Path file = dir.resolve("broken.yaml");
        Files.writeString(file, "autofix_broader: [true\n");
        assertThrows(IllegalArgumentException.class, () -> CleanerOptions.load(file));
    }

    @Test
    void missingFileIsAnIoError(@TempDir Path dir) {
        assertThrows(IOException.class, () -> CleanerOptions.load(dir.resolve("absent.yaml")));
    }
}
