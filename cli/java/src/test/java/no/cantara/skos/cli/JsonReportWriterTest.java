package no.cantara.skos.cli;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import no.cantara.skos.CleanerOptions;
import no.cantara.skos.SkosCleaner;
import no.cantara.skos.model.CheckId;
import no.cantara.skos.report.CleaningResult;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class JsonReportWriterTest {

    private static final String SKOS = "@prefix skos: <http://www.w3.org/2004/02/skos/core#> .\n";

    @Test
    void mapsChangesWithOptionalAfter() {
        CleaningResult result = SkosCleaner.clean(SKOS + """
                <x1> a skos:Concept ; skos:prefLabel "A,B"@en .
                <x1> a skos:Concept .
                """);
        ObjectNode json = JsonReportWriter.toJson(Path.of("in.ttl"), Path.of("out.ttl"), result);

        JsonNode changes = json.get("changes");
        assertEquals(2, changes.size());
        assertEquals("COMMA_SPACING_FIXED", changes.get(0).get("category").asText());
        assertEquals("A, B", changes.get(0).get("after").asText());
        assertEquals("DUPLICATE_REMOVED", changes.get(1).get("category").asText());
        assertFalse(changes.get(1).has("after"));
        assertEquals("in.ttl", json.get("input").asText());
    }

    @Test
    void countsByCheckIncludesZeros() {
        CleaningResult result = SkosCleaner.clean(SKOS + "<a> a skos:Concept ; skos:prefLabel \"A\"@en .\n");
        JsonNode validation = JsonReportWriter.toJson(Path.of("in.ttl"), Path.of("out.ttl"), result).get("validation");

        assertTrue(validation.get("valid").asBoolean());
        assertEquals(CheckId.values().length, validation.get("countsByCheck").size());
        assertEquals(0, validation.get("countsByCheck").get("HIERARCHY_CYCLE").asInt());
        assertEquals(0, validation.get("warnings").size());
    }

    @Test
    void findingsCarrySubjects() {
        CleaningResult result = SkosCleaner.clean(SKOS + "<a> skos:broader <b> .\n<b> skos:broader <a> .\n");
        JsonNode warnings = JsonReportWriter.toJson(Path.of("in.ttl"), Path.of("out.ttl"), result)
                .get("validation").get("warnings");

        JsonNode cycle = warnings.get(0);
        assertEquals("HIERARCHY_CYCLE", cycle.get("check").asText());
        assertEquals("WARNING", cycle.get("severity").asText());
        assertEquals(2, cycle.get("subjects").size());
    }

    @Test
    void skippedValidationHasOnlyPerformedFlag() {
        CleaningResult result = SkosCleaner.clean(SKOS + "<a> a skos:Concept .\n", CleanerOptions.defaults().withValidate(false));
        JsonNode validation = JsonReportWriter.toJson(Path.of("in.ttl"), Path.of("out.ttl"), result).get("validation");

        assertFalse(validation.get("performed").asBoolean());
        assertFalse(validation.has("violations"));
    }

    @Test
    void writesReadableFile(@TempDir Path dir) throws IOException {
        CleaningResult result = SkosCleaner.clean(SKOS + "<a> a skos:Concept ; skos:prefLabel \"A\"@en .\n");
        Path file = dir.resolve("report.json");
        JsonReportWriter.write(file, Path.of("in.ttl"), Path.of("out.ttl"), result);

        JsonNode json = new ObjectMapper().readTree(file.toFile());
        assertEquals(1, json.get("summary").get("finalConceptCount").asInt());
    }
}
