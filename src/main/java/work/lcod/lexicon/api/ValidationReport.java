package work.lcod.lexicon.api;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectWriter;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Formatted error messages grouped by key, in insertion order. {@link LexiconValidator#validate} keys
 * them by lexicon id and only lists failing documents; the command line keys them by file and lists
 * passing files with no messages.
 */
public record ValidationReport(Map<String, List<String>> errors) {
    private static final ObjectWriter WRITER = new ObjectMapper().writerWithDefaultPrettyPrinter();

    public ValidationReport {
        var copy = new LinkedHashMap<String, List<String>>();
        errors.forEach((id, messages) -> copy.put(id, List.copyOf(messages)));
        errors = Collections.unmodifiableMap(copy);
    }

    public static ValidationReport valid() {
        return new ValidationReport(Map.of());
    }

    public boolean isValid() {
        return errors.values().stream().allMatch(List::isEmpty);
    }

    public List<String> errorsFor(String lexiconId) {
        return errors.getOrDefault(lexiconId, List.of());
    }

    public int errorCount() {
        return errors.values().stream().mapToInt(List::size).sum();
    }

    public int failedCount() {
        return (int) errors.values().stream().filter(messages -> !messages.isEmpty()).count();
    }

    public int exitCode() {
        return isValid() ? 0 : 1;
    }

    public Map<String, Object> toSerializableMap() {
        Map<String, Object> serializable = new LinkedHashMap<>();
        serializable.put("valid", isValid());
        serializable.put("errors", errors);
        return serializable;
    }

    public String toPrettyJson() {
        try {
            return WRITER.writeValueAsString(toSerializableMap());
        } catch (JsonProcessingException ex) {
            return "{\"valid\":false,\"message\":\"" + ex.getOriginalMessage() + "\"}";
        }
    }
}
