package no.cantara.skos;

import no.cantara.skos.validation.IntegrityValidator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.SafeConstructor;
import org.yaml.snakeyaml.error.YAMLException;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.Set;

/**
 * Options of a cleaning run.
 *
 * @param autofixBroader          insert missing {@code broader} edges instead of warning
 * @param warnMissingNarrower     report parents lacking the mirrored {@code narrower} edge
 * @param validate                run integrity validation and hierarchy inspection
 * @param extendedLabelValidation also check SKOS-XL label resources
 * @param chunkSize               statements per batch in memory-efficient mode
 * @param memoryEfficient         process statements in batches while reading
 * @param maxLabelLength          labels longer than this are reported
 */
public record CleanerOptions(
        boolean autofixBroader,
        boolean warnMissingNarrower,
        boolean validate,
        boolean extendedLabelValidation,
        int chunkSize,
        boolean memoryEfficient,
        int maxLabelLength
) {

    private static final Logger log = LoggerFactory.getLogger(CleanerOptions.class);

    public static final int DEFAULT_CHUNK_SIZE = 1000;

    private static final Yaml YAML = new Yaml(new SafeConstructor(new LoaderOptions()));

    private static final Set<String> KEYS = Set.of(
            "autofix_broader", "warn_missing_narrower", "validation", "skos_xl",
            "chunk_size", "memory_efficient", "max_label_length");

    public CleanerOptions {
        if (chunkSize <= 0) {
            throw new IllegalArgumentException("chunk_size must be positive, was " + chunkSize);
        }
        if (maxLabelLength <= 0) {
            throw new IllegalArgumentException("max_label_length must be positive, was " + maxLabelLength);
        }
    }

    public static CleanerOptions defaults() {
        return new CleanerOptions(false, false, true, false, DEFAULT_CHUNK_SIZE, false,
                IntegrityValidator.DEFAULT_MAX_LABEL_LENGTH);
    }

    /**
     * Reads options from a YAML file. Absent keys keep their defaults.
     *
     * @throws IOException              if the file cannot be read
     * @throws IllegalArgumentException if the content is not a valid options mapping
     */
    public static CleanerOptions load(Path path) throws IOException {
        try (InputStream is = Files.newInputStream(path)) {
            Object data = YAML.load(is);
            if (data == null) return defaults();
            if (!(data instanceof Map<?, ?> map)) {
                throw new IllegalArgumentException(path + ": expected a mapping of options");
            }
            @SuppressWarnings("unchecked")
            Map<String, Object> options = (Map<String, Object>) map;
            return fromMap(options);
        } catch (YAMLException e) {
            throw new IllegalArgumentException(path + ": " + e.getMessage(), e);
        }
    }

    public static CleanerOptions fromMap(Map<String, Object> data) {
        CleanerOptions d = defaults();
        for (String key : data.keySet()) {
            if (!KEYS.contains(key)) log.warn("Ignoring unknown option '{}'", key);
        }
        return new CleanerOptions(
                bool(data, "autofix_broader", d.autofixBroader()),
                bool(data, "warn_missing_narrower", d.warnMissingNarrower()),
                bool(data, "validation", d.validate()),
                bool(data, "skos_xl", d.extendedLabelValidation()),
                integer(data, "chunk_size", d.chunkSize()),
                bool(data, "memory_efficient", d.memoryEfficient()),
                integer(data, "max_label_length", d.maxLabelLength()));
    }

    private static boolean bool(Map<String, Object> data, String key, boolean fallback) {
        Object value = data.get(key);
        if (value == null) return fallback;
        if (value instanceof Boolean b) return b;
        throw new IllegalArgumentException("'" + key + "' must be true or false, was '" + value + "'");
    }

    private static int integer(Map<String, Object> data, String key, int fallback) {
        Object value = data.get(key);
        if (value == null) return fallback;
        if (value instanceof Integer i) return i;
        throw new IllegalArgumentException("'" + key + "' must be an integer, was '" + value + "'");
    }

    public CleanerOptions withAutofixBroader(boolean value) {
        return new CleanerOptions(value, warnMissingNarrower, validate, extendedLabelValidation, chunkSize, memoryEfficient, maxLabelLength);
    }

    public CleanerOptions withWarnMissingNarrower(boolean value) {
        return new CleanerOptions(autofixBroader, value, validate, extendedLabelValidation, chunkSize, memoryEfficient, maxLabelLength);
    }

    public CleanerOptions withValidate(boolean value) {
        return new CleanerOptions(autofixBroader, warnMissingNarrower, value, extendedLabelValidation, chunkSize, memoryEfficient, maxLabelLength);
    }

    public CleanerOptions withExtendedLabelValidation(boolean value) {
        return new CleanerOptions(autofixBroader, warnMissingNarrower, validate, value, chunkSize, memoryEfficient, maxLabelLength);
    }

    public CleanerOptions withChunkSize(int value) {
        return new CleanerOptions(autofixBroader, warnMissingNarrower, validate, extendedLabelValidation, value, memoryEfficient, maxLabelLength);
    }

    public CleanerOptions withMemoryEfficient(boolean value) {
        return new CleanerOptions(autofixBroader, warnMissingNarrower, validate, extendedLabelValidation, chunkSize, value, maxLabelLength);
    }
}
