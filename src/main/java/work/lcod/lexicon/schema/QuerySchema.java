package work.lcod.lexicon.schema;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import work.lcod.lexicon.runtime.ValidationContext;

/**
 * XRPC query (HTTP GET). Data validation checks the parameters.
 */
public record QuerySchema(Optional<ParamsSchema> parameters, Optional<BodySchema> output, List<RpcError> errors)
    implements RpcSchema {
    private static final Set<String> FIELDS = SchemaFields.allowed("parameters", "output", "errors");

    public QuerySchema {
        errors = List.copyOf(errors);
    }

    public static QuerySchema parse(ObjectNode json, ValidationContext ctx) {
        SchemaFields.allowOnly(json, SchemaType.QUERY, FIELDS, ctx);
        return new QuerySchema(
            ParamsSchema.parseMember(json, ctx),
            BodySchema.parseMember(json, "output", ctx),
            RpcError.parseMember(json, ctx));
    }

    @Override
    public SchemaType type() {
        return SchemaType.QUERY;
    }

    @Override
    public void checkSchema(ValidationContext ctx) {
        parameters.ifPresent(p -> p.checkSchema(ctx.withPath("parameters")));
        output.ifPresent(o -> o.checkSchema(ctx.withPath("output")));
    }

    @Override
    public void checkData(JsonNode value, ValidationContext ctx) {
        parameters.ifPresent(p -> p.checkData(value, ctx));
    }
}
