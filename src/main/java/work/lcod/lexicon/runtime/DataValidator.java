package work.lcod.lexicon.runtime;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Re-entrant data check installed on a {@link ValidationContext}. Reference and union nodes call it on
 * the schema they resolve, which keeps them independent of the dispatcher.
 */
@FunctionalInterface
public interface DataValidator {
    void validate(JsonNode value, JsonNode schema, ValidationContext ctx);
}
