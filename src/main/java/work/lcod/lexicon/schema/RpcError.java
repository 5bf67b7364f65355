package work.lcod.lexicon.schema;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import work.lcod.lexicon.runtime.ValidationContext;
import work.lcod.lexicon.shared.Constraints;

/**
 * Named error an RPC method may return.
 */
public record RpcError(String name, Optional<String> description) {
    private static final Set<String> FIELDS = Set.of("name", "description");

    static List<RpcError> parseMember(ObjectNode json, ValidationContext ctx) {
        JsonNode node = json.get("errors");
        if (node == null) {
            return List.of();
        }
        var errorsCtx = ctx.withPath("errors");
        if (!node.isArray()) {
            throw SchemaFields.invalid(errorsCtx, "errors must be an array");
        }
        var errors = new ArrayList<RpcError>();
        for (int i = 0; i < node.size(); i++) {
            var itemCtx = errorsCtx.withIndex(i);
            JsonNode item = node.get(i);
            if (!item.isObject()) {
                throw SchemaFields.invalid(itemCtx, "error must be an object");
            }
            ObjectNode error = (ObjectNode) item;
            Constraints.checkAllowedFields(itemCtx, "error", error.fieldNames(), FIELDS);
            String name = SchemaFields.requiredString(error, "name", itemCtx);
            if (name.isEmpty()) {
                throw SchemaFields.invalid(itemCtx, "error name must not be empty");
            }
            errors.add(new RpcError(name, SchemaFields.optionalString(error, "description", itemCtx)));
        }
        return List.copyOf(errors);
    }
}
