package work.lcod.lexicon.schema;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import work.lcod.lexicon.runtime.ValidationContext;

/**
 * Event stream (WebSocket). Data validation checks the connection parameters.
 */
public record SubscriptionSchema(Optional<ParamsSchema> parameters, Optional<MessageSchema> message, List<RpcError> errors)
    implements RpcSchema {
    private static final Set<String> FIELDS = SchemaFields.allowed("parameters", "message", "errors");

    public SubscriptionSchema {
        errors = List.copyOf(errors);
    }

    public static SubscriptionSchema parse(ObjectNode json, ValidationContext ctx) {
        SchemaFields.allowOnly(json, SchemaType.SUBSCRIPTION, FIELDS, ctx);
        return new SubscriptionSchema(
            ParamsSchema.parseMember(json, ctx),
            MessageSchema.parseMember(json, ctx),
            RpcError.parseMember(json, ctx));
    }

    @Override
    public SchemaType type() {
        return SchemaType.SUBSCRIPTION;
    }

    @Override
    public void checkSchema(ValidationContext ctx) {
        parameters.ifPresent(p -> p.checkSchema(ctx.withPath("parameters")));
        message.ifPresent(m -> m.checkSchema(ctx.withPath("message")));
    }

    @Override
    public void checkData(JsonNode value, ValidationContext ctx) {
        parameters.ifPresent(p -> p.checkData(value, ctx));
    }
}
