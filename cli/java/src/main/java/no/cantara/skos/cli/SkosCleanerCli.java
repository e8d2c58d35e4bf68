package no.cantara.skos.cli;

import no.cantara.skos.CleanerOptions;
import no.cantara.skos.SkosCleaner;
import no.cantara.skos.report.CleaningResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.PrintStream;
import java.io.StringReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Command-line entry point.
 *
 * <pre>
 * Usage: skos-cleaner &lt;input.ttl&gt; [-o|--output &lt;file&gt;] [--config &lt;cleaner.yaml&gt;]
 *                     [--autofix-broader] [--warn-missing-narrower] [--no-validation]
 *                     [--enable-skos-xl] [--memory-efficient] [--chunk-size &lt;n&gt;]
 *                     [--no-reports] [--json-report] [--strict] [-v|--verbose]
 * </pre>
 *
 * Exit codes: 0 on success, 1 on usage or I/O errors, 2 when {@code --strict} is given and
 * integrity violations remain.
 */
public class SkosCleanerCli {

    private static final Logger log = LoggerFactory.getLogger(SkosCleanerCli.class);

    static final String USAGE = """
            Usage: skos-cleaner <input.ttl> [options]
              -o, --output <file>        cleaned output file (default: <input>_cleaned.<ext>)
              --config <cleaner.yaml>    load options from a YAML file
              --autofix-broader          add missing skos:broader links derived from hierarchy codes
              --warn-missing-narrower    report parents lacking skos:narrower to their children
              --no-validation            skip integrity validation
              --enable-skos-xl           validate SKOS-XL label resources
              --memory-efficient         build the graph in chunks
              --chunk-size <n>           subject blocks per chunk (default: 1000)
              --no-reports               do not write report files
              --json-report              also write a JSON report
              --strict                   exit with status 2 when integrity violations remain
              -v, --verbose              debug logging
            """;

    public static void main(String[] args) {
        System.exit(run(args, System.out, System.err));
    }

    static int run(String[] args, PrintStream out, PrintStream err) {
        Path input = null;
        Path output = null;
        Path config = null;
        boolean autofix = false;
        boolean narrower = false;
        boolean noValidation = false;
        boolean skosXl = false;
        boolean memoryEfficient = false;
        Integer chunkSize = null;
        boolean reports = true;
        boolean json = false;
        boolean strict = false;

        for (int i = 0; i < args.length; i++) {
            String arg = args[i];
            switch (arg) {
                case "-o", "--output", "--config", "--chunk-size" -> {
                    if (i + 1 >= args.length) {
                        err.println("Error: " + arg + " requires a value");
                        err.print(USAGE);
                        return 1;
                    }
                    String value = args[++i];
                    if (arg.equals("--config")) {
                        config = Path.of(value);
                    } else if (arg.equals("--chunk-size")) {
                        try {
                            chunkSize = Integer.parseInt(value);
                        } catch (NumberFormatException e) {
                            err.println("Error: --chunk-size expects an integer, got '" + value + "'");
                            return 1;
                        }
                    } else {
                        output = Path.of(value);
                    }
                }
                case "--autofix-broader"       -> autofix = true;
                case "--warn-missing-narrower" -> narrower = true;
                case "--no-validation"         -> noValidation = true;
                case "--enable-skos-xl"        -> skosXl = true;
                case "--memory-efficient"      -> memoryEfficient = true;
                case "--no-reports"            -> reports = false;
                case "--json-report"           -> json = true;
                case "--strict"                -> strict = true;
                case "-v", "--verbose"         -> LogLevels.verbose();
                case "-h", "--help"            -> {
                    out.print(USAGE);
                    return 0;
                }
                default -> {
                    if (arg.startsWith("-") || input != null) {
                        err.println("Error: unexpected argument '" + arg + "'");
                        err.print(USAGE);
                        return 1;
                    }
                    input = Path.of(arg);
                }
            }
        }

        if (input == null) {
            err.print(USAGE);
            return 1;
        }
        if (!Files.isRegularFile(input)) {
            err.println("Error: file not found: " + input);
            return 1;
        }
        if (output == null) {
            output = defaultOutput(input);
        }

        CleanerOptions options;
        CleaningResult result;
        try {
            options = config != null ? CleanerOptions.load(config) : CleanerOptions.defaults();
            // flags given on the command line override the file
            if (autofix) options = options.withAutofixBroader(true);
            if (narrower) options = options.withWarnMissingNarrower(true);
            if (noValidation) options = options.withValidate(false);
            if (skosXl) options = options.withExtendedLabelValidation(true);
            if (memoryEfficient) options = options.withMemoryEfficient(true);
            if (chunkSize != null) options = options.withChunkSize(chunkSize);

            DocumentDecoder.Decoded decoded = DocumentDecoder.decode(input);
            log.debug("Decoded {} as {}", input, decoded.charset());
            result = SkosCleaner.clean(new StringReader(decoded.text()), options);
            Files.writeString(output, result.output(), StandardCharsets.UTF_8);
        } catch (IOException | IllegalArgumentException e) {
            err.println("Error: " + e.getMessage());
            return 1;
        }

        ReportWriter writer = new ReportWriter();
        out.print(writer.consoleSummary(input, output, result));

        if (reports) {
            try {
                writeReports(writer, input, output, result, json, out);
            } catch (IOException e) {
                err.println("Error: could not write reports: " + e.getMessage());
                return 1;
            }
        }

        if (strict && !result.validation().isValid()) {
            return 2;
        }
        return 0;
    }

    private static void writeReports(ReportWriter writer, Path input, Path output, CleaningResult result,
                                     boolean json, PrintStream out) throws IOException {
        String base = reportBase(output);
        Path dir = output.toAbsolutePath().getParent();

        out.println();
        out.println("REPORTS:");
        if (!result.changes().isEmpty()) {
            Path changeLog = writer.writeChangeLog(dir.resolve(base + "_changes.log"), result);
            out.println("   Change log: " + changeLog);
        }
        if (result.validation().performed()) {
            Path validation = writer.writeValidationReport(dir.resolve(base + "_validation.log"), result.validation());
            out.println("   Validation report: " + validation);
        }
        Path full = writer.writeFullReport(dir.resolve(base + "_full.log"), input, output, result);
        out.println("   Full report: " + full);
        if (json) {
            Path jsonPath = dir.resolve(base + "_report.json");
            JsonReportWriter.write(jsonPath, input, output, result);
            out.println("   JSON report: " + jsonPath);
        }
    }

    /** {@code dir/name.ttl} becomes {@code dir/name_cleaned.ttl}. */
    static Path defaultOutput(Path input) {
        String name = input.getFileName().toString();
        int dot = name.lastIndexOf('.');
        String cleaned = dot > 0
                ? name.substring(0, dot) + "_cleaned" + name.substring(dot)
                : name + "_cleaned";
        Path parent = input.toAbsolutePath().getParent();
        return parent.resolve(cleaned);
    }

    /** Report files share the output's stem. */
    static String reportBase(Path output) {
        String name = output.getFileName().toString();
        int dot = name.lastIndexOf('.');
        return dot > 0 ? name.substring(0, dot) : name;
    }
}
