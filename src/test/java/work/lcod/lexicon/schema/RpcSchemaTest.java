package work.lcod.lexicon.schema;

import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static work.lcod.lexicon.support.LexiconTestSupport.allFixtures;
import static work.lcod.lexicon.support.LexiconTestSupport.context;
import static work.lcod.lexicon.support.LexiconTestSupport.json;

import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.Test;
import work.lcod.lexicon.error.DataValidationException;
import work.lcod.lexicon.error.InvalidSchemaException;
import work.lcod.lexicon.runtime.TypeDispatcher;
import work.lcod.lexicon.runtime.ValidationContext;

class RpcSchemaTest {
    private final ValidationContext catalog = context(allFixtures());
    private final ValidationContext isolated = ValidationContext.isolated();

    private String schemaError(String text) {
        return assertThrows(InvalidSchemaException.class, () -> TypeDispatcher.parse(json(text), isolated)).getMessage();
    }

    @Test
    void queryValidatesItsParameters() {
        var ctx = catalog.withCurrentDocument("com.example.getPost");
        var query = assertInstanceOf(QuerySchema.class, TypeDispatcher.parse(ctx.resolve("#main"), ctx));
        assertEquals(List.of(new RpcError("NotFound", Optional.of("No post at that uri."))), query.errors());
        assertEquals("application/json", query.output().orElseThrow().encoding());
        assertTrue(query.input().isEmpty());

        assertDoesNotThrow(() -> query.checkData(json("{\"uri\": \"at://did:plc:abc123/com.example.post/3jzfcijpj2z2a\", \"depth\": 2}"), ctx));
        var missing = assertThrows(DataValidationException.class, () -> query.checkData(json("{\"depth\": 2}"), ctx));
        assertEquals("required parameter 'uri' is missing", missing.getMessage());
        var deep = assertThrows(DataValidationException.class, () ->
            query.checkData(json("{\"uri\": \"at://alice.example.com\", \"depth\": 11}"), ctx));
        assertEquals("depth: value 11 exceeds maximum 10", deep.getMessage());
    }

    @Test
    void procedureValidatesItsInputBody() {
        var ctx = catalog.withCurrentDocument("com.example.createPost");
        var procedure = assertInstanceOf(ProcedureSchema.class, TypeDispatcher.parse(ctx.resolve("#main"), ctx));
        assertTrue(procedure.parameters().isEmpty());

        var input = json("{\"repo\": \"alice.example.com\", \"record\": {\"text\": \"hi\", \"createdAt\": \"2024-01-01T00:00:00Z\"}}");
        assertDoesNotThrow(() -> procedure.checkData(input, ctx));
        var bad = json("{\"repo\": \"alice.example.com\", \"record\": {\"text\": \"hi\"}}");
        var error = assertThrows(DataValidationException.class, () -> procedure.checkData(bad, ctx));
        assertEquals("record: required field 'createdAt' is missing", error.getMessage());
    }

    @Test
    void subscriptionValidatesItsParameters() {
        var ctx = isolated;
        var subscription = assertInstanceOf(SubscriptionSchema.class, TypeDispatcher.parse(json("""
            {
              "type": "subscription",
              "parameters": {"type": "params", "properties": {"cursor": {"type": "integer", "minimum": 0}}},
              "message": {"schema": {"type": "union", "refs": ["#commit", "#info"]}},
              "errors": [{"name": "FutureCursor"}]
            }
            """), ctx));
        assertTrue(subscription.message().isPresent());
        assertDoesNotThrow(() -> subscription.checkData(json("{\"cursor\": 5}"), ctx));
        assertThrows(DataValidationException.class, () -> subscription.checkData(json("{\"cursor\": -5}"), ctx));
    }

    @Test
    void partsWithoutSchemasAcceptAnything() {
        var query = TypeDispatcher.parse(json("{\"type\": \"query\"}"), isolated);
        assertDoesNotThrow(() -> query.checkData(json("{\"whatever\": true}"), isolated));
        var procedure = TypeDispatcher.parse(json("{\"type\": \"procedure\", \"input\": {\"encoding\": \"*/*\"}}"), isolated);
        assertDoesNotThrow(() -> procedure.checkData(json("[1, 2, 3]"), isolated));
    }

    @Test
    void parametersAreRestrictedToScalars() {
        assertEquals("parameters.properties.p: parameter type 'object' is not allowed",
            schemaError("{\"type\": \"query\", \"parameters\": {\"type\": \"params\", \"properties\": {\"p\": {\"type\": \"object\"}}}}"));
        assertEquals("parameters.properties.p: array parameters must hold boolean, integer, string or unknown items",
            schemaError("{\"type\": \"query\", \"parameters\": {\"type\": \"params\", \"properties\": "
                + "{\"p\": {\"type\": \"array\", \"items\": {\"type\": \"object\"}}}}}"));
        assertEquals("parameters: parameters must be a params schema",
            schemaError("{\"type\": \"query\", \"parameters\": {\"type\": \"object\"}}"));
    }

    @Test
    void bodiesAndErrorsAreValidated() {
        assertEquals("input.schema: body schema must be an object, ref or union",
            schemaError("{\"type\": \"procedure\", \"input\": {\"encoding\": \"application/json\", \"schema\": {\"type\": \"string\"}}}"));
        assertEquals("output: missing required field 'encoding'",
            schemaError("{\"type\": \"query\", \"output\": {\"schema\": {\"type\": \"object\"}}}"));
        assertEquals("errors: errors must be an array", schemaError("{\"type\": \"query\", \"errors\": {}}"));
        assertEquals("errors[0]: missing required field 'name'", schemaError("{\"type\": \"query\", \"errors\": [{}]}"));
        assertEquals("message.schema: message schema must be a union",
            schemaError("{\"type\": \"subscription\", \"message\": {\"schema\": {\"type\": \"object\"}}}"));
        assertEquals("field 'input' is not allowed in a query schema", schemaError("{\"type\": \"query\", \"input\": {}}"));
    }

    @Test
    void schemaCheckReachesNestedBodies() {
        var schema = json("""
            {"type": "procedure", "output": {"encoding": "application/json", "schema": {
              "type": "object", "properties": {"n": {"type": "integer", "minimum": 3, "maximum": 1}}
            }}}
            """);
        var error = assertThrows(InvalidSchemaException.class, () -> TypeDispatcher.checkSchema(schema, isolated));
        assertEquals("output.schema.properties.n: minimum (3) cannot be greater than maximum (1)", error.getMessage());
    }
}
