package work.lcod.lexicon.cli;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectWriter;
import java.io.PrintWriter;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;
import picocli.CommandLine;
import work.lcod.lexicon.api.DuplicateIdPolicy;
import work.lcod.lexicon.api.LexiconValidator;
import work.lcod.lexicon.api.LogLevel;
import work.lcod.lexicon.api.ValidationOptions;
import work.lcod.lexicon.api.ValidationReport;
import work.lcod.lexicon.runtime.LexiconLoader;

@CommandLine.Command(
    name = "check",
    description = "Validate a lexicon file, or every *.json file under a directory together.",
    mixinStandardHelpOptions = true,
    showDefaultValues = true
)
final class CheckCommand implements Callable<Integer> {
    private static final ObjectWriter JSON_WRITER = new ObjectMapper().writerWithDefaultPrettyPrinter();

    @CommandLine.Spec
    private CommandLine.Model.CommandSpec spec;

    @CommandLine.Parameters(index = "0", paramLabel = "PATH", description = "Lexicon file or directory.")
    private Path path;

    @CommandLine.Option(names = "--json", description = "Print the results as JSON.")
    private boolean json;

    @CommandLine.Option(
        names = "--max-depth",
        description = "Maximum nesting depth of a single traversal (default: 128, or lexicon.toml).",
        defaultValue = CommandLine.Option.NULL_VALUE
    )
    private Integer maxDepth;

    @CommandLine.Option(
        names = "--duplicate-ids",
        paramLabel = "reject|last-wins",
        description = "How to treat two documents with the same id (default: reject, or lexicon.toml).",
        defaultValue = CommandLine.Option.NULL_VALUE
    )
    private String duplicateIds;

    @CommandLine.Option(
        names = "--log-level",
        description = "Log threshold (trace|debug|info|warn|error|off).",
        defaultValue = CommandLine.Option.NULL_VALUE
    )
    private String logLevelRaw;

    @Override
    public Integer call() {
        if (logLevelRaw != null) {
            LogLevels.apply(parse(() -> LogLevel.from(logLevelRaw)));
        }
        if (!Files.exists(path)) {
            throw new CommandLine.ParameterException(spec.commandLine(), "No such file or directory: " + path);
        }
        var options = resolveOptions();
        var validator = new LexiconValidator(options);
        var files = LexiconLoader.load(path);

        // One file per id is validated; the others are reported against it.
        var owners = new HashMap<String, Path>();
        var duplicates = new HashMap<Path, Path>();
        var skipped = new LinkedHashMap<Path, Path>();
        for (var file : files) {
            String id = file.isLoaded() ? documentId(file.json()) : null;
            if (id == null) {
                continue;
            }
            Path owner = owners.get(id);
            if (owner == null) {
                owners.put(id, file.path());
            } else if (options.duplicateIdPolicy() == DuplicateIdPolicy.LAST_WINS) {
                skipped.put(owner, file.path());
                owners.put(id, file.path());
            } else {
                duplicates.put(file.path(), owner);
            }
        }

        var validated = new ArrayList<LexiconLoader.LoadedFile>();
        for (var file : files) {
            if (file.isLoaded() && !duplicates.containsKey(file.path()) && !skipped.containsKey(file.path())) {
                validated.add(file);
            }
        }
        ValidationReport byId = validator.validate(validated.stream().map(LexiconLoader.LoadedFile::json).toList());

        var byFile = new LinkedHashMap<String, List<String>>();
        int index = 0;
        for (var file : files) {
            List<String> errors;
            if (!file.isLoaded()) {
                errors = List.of(file.error());
            } else if (duplicates.containsKey(file.path())) {
                errors = List.of("duplicate lexicon id '" + documentId(file.json()) + "' (first defined in "
                    + duplicates.get(file.path()) + ")");
            } else if (skipped.containsKey(file.path())) {
                errors = List.of();
            } else {
                String id = documentId(file.json());
                errors = byId.errorsFor(id != null ? id : "document[" + index + "]");
                index++;
            }
            byFile.put(file.path().toString(), errors);
        }
        var report = new ValidationReport(byFile);

        PrintWriter out = spec.commandLine().getOut();
        if (json) {
            out.println(toJson(report, skipped));
        } else {
            for (var file : files) {
                Path shadowing = skipped.get(file.path());
                if (shadowing != null) {
                    out.println("- " + file.path());
                    out.println("  skipped: id '" + documentId(file.json()) + "' also defined in " + shadowing);
                    continue;
                }
                var errors = report.errorsFor(file.path().toString());
                out.println((errors.isEmpty() ? "✓ " : "✗ ") + file.path());
                errors.forEach(error -> out.println("  " + error));
            }
            out.println(summary(report, skipped.size()));
        }
        out.flush();
        return report.exitCode();
    }

    private ValidationOptions resolveOptions() {
        var builder = LexiconLoader.readOptions(path, ValidationOptions.defaults()).toBuilder();
        if (maxDepth != null) {
            builder.maxDepth(maxDepth);
        }
        if (duplicateIds != null) {
            builder.duplicateIdPolicy(parse(() -> DuplicateIdPolicy.from(duplicateIds)));
        }
        return parse(builder::build);
    }

    private <T> T parse(java.util.function.Supplier<T> supplier) {
        try {
            return supplier.get();
        } catch (IllegalArgumentException ex) {
            throw new CommandLine.ParameterException(spec.commandLine(), ex.getMessage(), ex);
        }
    }

    // Same key LexiconValidator.validate reports under, when the id is readable.
    private static String documentId(JsonNode document) {
        JsonNode id = document.get("id");
        return id != null && id.isTextual() && !id.textValue().isBlank() ? id.textValue() : null;
    }

    private static String summary(ValidationReport report, int skipped) {
        String line = report.errors().size() + " file(s) checked, " + report.failedCount() + " failed";
        return skipped == 0 ? line : line + ", " + skipped + " skipped";
    }

    private static String toJson(ValidationReport report, Map<Path, Path> skipped) {
        Map<String, Object> root = report.toSerializableMap();
        root.put("checked", report.errors().size());
        root.put("failed", report.failedCount());
        Map<String, String> shadowed = new LinkedHashMap<>();
        skipped.forEach((file, by) -> shadowed.put(file.toString(), by.toString()));
        root.put("skipped", shadowed);
        try {
            return JSON_WRITER.writeValueAsString(root);
        } catch (JsonProcessingException ex) {
            throw new IllegalStateException("Failed to render JSON report", ex);
        }
    }
}
