package io.gambit.serialization;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.deser.std.StdDeserializer;
import io.gambit.core.token.Token;
import java.io.IOException;
import java.io.Serial;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;

/// Deserializes token trees from nested objects with a `"type"` discriminator field.
///
/// Every other field of an object is classified by its JSON shape:
/// - **object**: a child token in the operand slot of that name
/// - **`null`**: an operand slot left empty, reported later by the type checker
/// - **integer**: an `Integer` literal such as `Number.value`
/// - **boolean / string**: a literal of that type
///
/// Unknown token kinds are accepted here; rejecting them is the type checker's job.
///
/// @implNote Package-private. Registered by {@link GambitJacksonModule}.
/// @see TokenSerializer for the inverse operation
class TokenDeserializer extends StdDeserializer<Token> {

    @Serial private static final long serialVersionUID = -6183950245508373610L;

    static final String TYPE = "type";

    TokenDeserializer() {
        super(Token.class);
    }

    /// @throws IOException if `"type"` is missing or a field has an unsupported shape
    @Override
    public Token deserialize(JsonParser p, DeserializationContext ctx) throws IOException {
        JsonNode root = p.getCodec().readTree(p);
        return toToken(root, "$");
    }

    private Token toToken(JsonNode node, String location) throws IOException {
        if (!node.isObject()) {
            throw new IOException("Token at " + location + " must be a JSON object");
        }
        JsonNode type = node.get(TYPE);
        if (type == null || !type.isTextual() || type.asText().isBlank()) {
            throw new IOException("Token at " + location + " is missing the \"type\" field");
        }
        Map<String, Token> arguments = new LinkedHashMap<>();
        Map<String, Object> attributes = new LinkedHashMap<>();
        Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            String name = field.getKey();
            JsonNode value = field.getValue();
            if (TYPE.equals(name)) {
                continue;
            }
            String fieldLocation = location + "." + name;
            if (value.isObject()) {
                arguments.put(name, toToken(value, fieldLocation));
            } else if (value.isNull()) {
                arguments.put(name, null);
            } else if (value.isIntegralNumber() && value.canConvertToInt()) {
                attributes.put(name, value.intValue());
            } else if (value.isBoolean()) {
                attributes.put(name, value.booleanValue());
            } else if (value.isTextual()) {
                attributes.put(name, value.textValue());
            } else {
                throw new IOException(
                        "Unsupported value at " + fieldLocation + ": " + value.getNodeType());
            }
        }
        return new Token(type.asText(), arguments, attributes);
    }
}
