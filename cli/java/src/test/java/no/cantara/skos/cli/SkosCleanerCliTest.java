package no.cantara.skos.cli;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class SkosCleanerCliTest {

    @TempDir
    Path dir;

    private final ByteArrayOutputStream stdout = new ByteArrayOutputStream();
    private final ByteArrayOutputStream stderr = new ByteArrayOutputStream();

    private int run(String... args) {
        return SkosCleanerCli.run(args,
                new PrintStream(stdout, true, StandardCharsets.UTF_8),
                new PrintStream(stderr, true, StandardCharsets.UTF_8));
    }

    private String out() {
        return stdout.toString(StandardCharsets.UTF_8);
    }

    private String err() {
        return stderr.toString(StandardCharsets.UTF_8);
    }

    private Path fixture(String name) throws IOException {
        Path target = dir.resolve(name);
        try (InputStream is = SkosCleanerCliTest.class.getResourceAsStream("/fixtures/" + name)) {
            assertNotNull(is, "missing fixture " + name);
            Files.copy(is, target);
        }
        return target;
    }

    // -----------------------------------------------------------------------
    // Argument handling
    // -----------------------------------------------------------------------

    @Test
    void noArgumentsPrintsUsage() {
        assertEquals(1, run());
        assertTrue(err().contains("Usage: skos-cleaner"));
    }

    @Test
    void helpGoesToStdout() {
        assertEquals(0, run("--help"));
        assertTrue(out().contains("--autofix-broader"));
    }

    @Test
    void missingInputFileIsAnError() {
        assertEquals(1, run(dir.resolve("absent.ttl").toString()));
        assertTrue(err().startsWith("Error: file not found"));
    }

    @Test
    void unknownOptionIsAnError() throws IOException {
        assertEquals(1, run(fixture("clean.ttl").toString(), "--frobnicate"));
        assertTrue(err().contains("unexpected argument '--frobnicate'"));
    }

    @Test
    void chunkSizeMustBeNumeric() throws IOException {
        assertEquals(1, run(fixture("clean.ttl").toString(), "--chunk-size", "lots"));
        assertTrue(err().contains("--chunk-size expects an integer"));
    }

    @Test
    void optionValueIsRequired() throws IOException {
        assertEquals(1, run(fixture("clean.ttl").toString(), "-o"));
        assertTrue(err().contains("-o requires a value"));
    }

    @Test
    void invalidChunkSizeIsReportedAsError() throws IOException {
        assertEquals(1, run(fixture("clean.ttl").toString(), "--chunk-size", "0"));
        assertTrue(err().startsWith("Error: chunk_size must be positive"));
    }

    // -----------------------------------------------------------------------
    // Output and reports
    // -----------------------------------------------------------------------

    @Test
    void writesCleanedFileAndReportsNextToInput() throws IOException {
        Path input = fixture("messy.ttl");

        assertEquals(0, run(input.toString()));

        Path output = dir.resolve("messy_cleaned.ttl");
        assertTrue(Files.exists(output));
        assertTrue(Files.readString(output).contains("\"Känguru\"@de"));
        assertTrue(Files.exists(dir.resolve("messy_cleaned_changes.log")));
        assertTrue(Files.exists(dir.resolve("messy_cleaned_validation.log")));
        assertTrue(Files.exists(dir.resolve("messy_cleaned_full.log")));
        assertFalse(Files.exists(dir.resolve("messy_cleaned_report.json")));

        assertTrue(out().contains("SKOS CLEANING REPORT"));
        assertTrue(out().contains("Duplicates removed: 1"));
        assertTrue(out().contains("Found 1 SKOS integrity violation(s)"));
    }

    @Test
    void strictModeFailsOnViolations() throws IOException {
        assertEquals(2, run(fixture("messy.ttl").toString(), "--strict", "--no-reports"));
    }

    @Test
    void strictModePassesCleanInput() throws IOException {
        assertEquals(0, run(fixture("clean.ttl").toString(), "--strict", "--no-reports"));
    }

    @Test
    void noReportsWritesOnlyTheCleanedFile() throws IOException {
        fixture("messy.ttl");
        Path output = dir.resolve("out").resolve("result.ttl");
        Files.createDirectories(output.getParent());

        assertEquals(0, run(dir.resolve("messy.ttl").toString(), "-o", output.toString(), "--no-reports"));

        try (var files = Files.list(output.getParent())) {
            assertEquals(1, files.count());
        }
        assertTrue(Files.exists(output));
    }

    @Test
    void changeLogIsOmittedWhenNothingChanged() throws IOException {
        assertEquals(0, run(fixture("clean.ttl").toString()));

        assertFalse(Files.exists(dir.resolve("clean_cleaned_changes.log")));
        assertTrue(Files.exists(dir.resolve("clean_cleaned_validation.log")));
        assertTrue(Files.exists(dir.resolve("clean_cleaned_full.log")));
    }

    @Test
    void noValidationSkipsValidationReport() throws IOException {
        assertEquals(0, run(fixture("messy.ttl").toString(), "--no-validation", "--strict"));

        assertFalse(Files.exists(dir.resolve("messy_cleaned_validation.log")));
        assertTrue(Files.readString(dir.resolve("messy_cleaned_full.log")).contains("Validation disabled"));
    }

    @Test
    void customOutputNamesTheReports() throws IOException {
        Path output = dir.resolve("vocab.ttl");

        assertEquals(0, run(fixture("messy.ttl").toString(), "--output", output.toString()));

        assertTrue(Files.exists(output));
        assertTrue(Files.exists(dir.resolve("vocab_full.log")));
    }

    @Test
    void jsonReportCarriesSummaryAndFindings() throws IOException {
        assertEquals(0, run(fixture("messy.ttl").toString(), "--json-report"));

        JsonNode json = new ObjectMapper().readTree(dir.resolve("messy_cleaned_report.json").toFile());
        assertEquals(1, json.get("summary").get("duplicatesRemoved").asInt());
        assertFalse(json.get("validation").get("valid").asBoolean());
        assertEquals("S14", json.get("validation").get("violations").get(0).get("check").asText());
        assertEquals(1, json.get("validation").get("countsByCheck").get("S14").asInt());
    }

    // -----------------------------------------------------------------------
    // Configuration
    // -----------------------------------------------------------------------

    @Test
    void configFileEnablesAutofix() throws IOException {
        Path config = dir.resolve("cleaner.yaml");
        Files.writeString(config, "autofix_broader: true\nwarn_missing_narrower: true\n");

        assertEquals(0, run(fixture("messy.ttl").toString(), "--config", config.toString(), "--no-reports"));

        String cleaned = Files.readString(dir.resolve("messy_cleaned.ttl"));
        assertTrue(cleaned.contains("skos:broader <1.2>"));
        assertTrue(out().contains("Broader links added: 1"));
    }

    @Test
    void commandLineFlagsOverrideConfigFile() throws IOException {
        Path config = dir.resolve("cleaner.yaml");
        Files.writeString(config, "validation: true\n");

        assertEquals(0, run(fixture("messy.ttl").toString(), "--config", config.toString(), "--no-validation", "--no-reports"));
        assertFalse(out().contains("VALIDATION RESULTS"));
    }

    @Test
    void invalidConfigIsReportedAsError() throws IOException {
        Path config = dir.resolve("cleaner.yaml");
        Files.writeString(config, "chunk_size: -1\n");

        assertEquals(1, run(fixture("messy.ttl").toString(), "--config", config.toString()));
        assertTrue(err().startsWith("Error:"));
    }

    // -----------------------------------------------------------------------
    // Paths
    // -----------------------------------------------------------------------

    @Test
    void defaultOutputInsertsSuffixBeforeExtension() {
        assertEquals(Path.of("/data/vocab_cleaned.ttl"), SkosCleanerCli.defaultOutput(Path.of("/data/vocab.ttl")));
        assertEquals(Path.of("/data/vocab_cleaned"), SkosCleanerCli.defaultOutput(Path.of("/data/vocab")));
        assertEquals("vocab_cleaned", SkosCleanerCli.reportBase(Path.of("/data/vocab_cleaned.ttl")));
    }
}
