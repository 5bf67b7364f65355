package work.lcod.lexicon.runtime;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import work.lcod.lexicon.error.InvalidSchemaException;
import work.lcod.lexicon.format.Syntax;

/**
 * A parsed lexicon document. Definitions are kept as JSON objects and interpreted by the dispatcher
 * when they are visited.
 */
public record LexiconDocument(
    String id,
    Optional<Integer> revision,
    Optional<String> description,
    Map<String, ObjectNode> definitions
) {
    public static final int LEXICON_VERSION = 1;

    public LexiconDocument {
        definitions = Collections.unmodifiableMap(new LinkedHashMap<>(definitions));
    }

    public static LexiconDocument parse(JsonNode json) {
        if (json == null || !json.isObject()) {
            throw new InvalidSchemaException("lexicon document must be a JSON object");
        }
        JsonNode idNode = json.get("id");
        if (idNode == null || !idNode.isTextual()) {
            throw new InvalidSchemaException("lexicon document is missing a string 'id'");
        }
        String id = idNode.textValue();
        if (!Syntax.isValidNsid(id)) {
            throw new InvalidSchemaException("lexicon id '" + id + "' is not a valid NSID");
        }

        JsonNode version = json.get("lexicon");
        if (version != null && (!version.isIntegralNumber() || version.asLong() != LEXICON_VERSION)) {
            throw new InvalidSchemaException(id + ": unsupported lexicon version " + version);
        }

        Optional<Integer> revision = Optional.empty();
        JsonNode revisionNode = json.get("revision");
        if (revisionNode != null) {
            if (!revisionNode.isInt() || revisionNode.intValue() < 0) {
                throw new InvalidSchemaException(id + ": revision must be a non-negative integer");
            }
            revision = Optional.of(revisionNode.intValue());
        }

        Optional<String> description = Optional.empty();
        JsonNode descriptionNode = json.get("description");
        if (descriptionNode != null) {
            if (!descriptionNode.isTextual()) {
                throw new InvalidSchemaException(id + ": description must be a string");
            }
            description = Optional.of(descriptionNode.textValue());
        }

        JsonNode defs = json.get("defs");
        if (defs == null || !defs.isObject()) {
            throw new InvalidSchemaException(id + ": 'defs' must be an object");
        }
        var definitions = new LinkedHashMap<String, ObjectNode>();
        var fields = defs.fields();
        while (fields.hasNext()) {
            var entry = fields.next();
            if (entry.getKey().isEmpty()) {
                throw new InvalidSchemaException(id + ": definition names must not be empty");
            }
            if (!entry.getValue().isObject()) {
                throw new InvalidSchemaException(id + ": defs." + entry.getKey() + " must be an object");
            }
            definitions.put(entry.getKey(), (ObjectNode) entry.getValue());
        }
        return new LexiconDocument(id, revision, description, definitions);
    }

    public Optional<ObjectNode> definition(String name) {
        return Optional.ofNullable(definitions.get(name));
    }

    public Optional<ObjectNode> main() {
        return definition(Reference.MAIN);
    }
}
