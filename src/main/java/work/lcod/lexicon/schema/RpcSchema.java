package work.lcod.lexicon.schema;

import java.util.List;
import java.util.Optional;

/**
 * Common view of the XRPC definitions.
 */
public sealed interface RpcSchema extends SchemaNode permits QuerySchema, ProcedureSchema, SubscriptionSchema {
    Optional<ParamsSchema> parameters();

    default Optional<BodySchema> input() {
        return Optional.empty();
    }

    default Optional<BodySchema> output() {
        return Optional.empty();
    }

    List<RpcError> errors();
}
