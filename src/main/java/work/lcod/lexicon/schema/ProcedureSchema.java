package work.lcod.lexicon.schema;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import work.lcod.lexicon.runtime.ValidationContext;

/**
 * XRPC procedure (HTTP POST). Data validation checks the input body.
 */
public record ProcedureSchema(
    Optional<ParamsSchema> parameters,
    Optional<BodySchema> input,
    Optional<BodySchema> output,
    List<RpcError> errors
) implements RpcSchema {
    private static final Set<String> FIELDS = SchemaFields.allowed("parameters", "input", "output", "errors");

    public ProcedureSchema {
        errors = List.copyOf(errors);
    }

    public static ProcedureSchema parse(ObjectNode json, ValidationContext ctx) {
        SchemaFields.allowOnly(json, SchemaType.PROCEDURE, FIELDS, ctx);
        return new ProcedureSchema(
            ParamsSchema.parseMember(json, ctx),
            BodySchema.parseMember(json, "input", ctx),
            BodySchema.parseMember(json, "output", ctx),
            RpcError.parseMember(json, ctx));
    }

    @Override
    public SchemaType type() {
        return SchemaType.PROCEDURE;
    }

    @Override
    public void checkSchema(ValidationContext ctx) {
        parameters.ifPresent(p -> p.checkSchema(ctx.withPath("parameters")));
        input.ifPresent(i -> i.checkSchema(ctx.withPath("input")));
        output.ifPresent(o -> o.checkSchema(ctx.withPath("output")));
    }

    @Override
    public void checkData(JsonNode value, ValidationContext ctx) {
        input.ifPresent(i -> i.checkData(value, ctx));
    }
}
