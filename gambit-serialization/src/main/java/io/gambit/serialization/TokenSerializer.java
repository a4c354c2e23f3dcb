package io.gambit.serialization;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.JsonMappingException;
import com.fasterxml.jackson.databind.SerializerProvider;
import com.fasterxml.jackson.databind.ser.std.StdSerializer;
import io.gambit.core.token.Token;
import java.io.IOException;
import java.io.Serial;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.Map;
import java.util.Set;

/// Serializes token trees as nested objects with a `"type"` discriminator field.
///
/// Literal attributes are written inline next to the operand slots:
/// `{"type":"GreaterThan","left":{"type":"Number","value":50},"right":{...}}`. A missing
/// operand is written as `null`.
///
/// @implNote Package-private. Registered by {@link GambitJacksonModule}.
/// @see TokenDeserializer for the inverse operation
class TokenSerializer extends StdSerializer<Token> {

    @Serial private static final long serialVersionUID = 2249517603371186904L;

    TokenSerializer() {
        super(Token.class);
    }

    /// Writes the token and its operands depth-first.
    ///
    /// @throws IOException if the generator fails or the tree contains itself
    @Override
    public void serialize(Token token, JsonGenerator gen, SerializerProvider provider)
            throws IOException {
        write(token, gen, provider, Collections.newSetFromMap(new IdentityHashMap<>()));
    }

    private void write(
            Token token, JsonGenerator gen, SerializerProvider provider, Set<Token> path)
            throws IOException {
        if (!path.add(token)) {
            throw JsonMappingException.from(gen, "Cyclic token tree at " + token.getKind());
        }
        gen.writeStartObject();
        gen.writeStringField(TokenDeserializer.TYPE, token.getKind());
        for (Map.Entry<String, Object> attribute : token.getAttributes().entrySet()) {
            provider.defaultSerializeField(attribute.getKey(), attribute.getValue(), gen);
        }
        for (Map.Entry<String, Token> argument : token.getArguments().entrySet()) {
            gen.writeFieldName(argument.getKey());
            if (argument.getValue() == null) {
                gen.writeNull();
            } else {
                write(argument.getValue(), gen, provider, path);
            }
        }
        gen.writeEndObject();
        path.remove(token);
    }
}
