package io.gambit.serialization;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.deser.std.StdDeserializer;
import io.gambit.core.runtime.Action;
import java.io.IOException;
import java.io.Serial;

/// Deserializes resolved actions using a `"type"` discriminator field.
///
/// @implNote Package-private. Registered by {@link GambitJacksonModule}.
/// @see ActionSerializer for the inverse operation
class ActionDeserializer extends StdDeserializer<Action> {

    @Serial private static final long serialVersionUID = 7035482941766310529L;

    ActionDeserializer() {
        super(Action.class);
    }

    /// @throws IOException if the `"type"` value is unknown or `targetId` is absent
    @Override
    public Action deserialize(JsonParser p, DeserializationContext ctx) throws IOException {
        JsonNode root = p.getCodec().readTree(p);

        JsonNode type = root.get("type");
        JsonNode target = root.get(ActionSerializer.TARGET_ID);
        if (type == null || target == null || !target.canConvertToInt()) {
            throw new IOException("Action needs \"type\" and an integer \"targetId\"");
        }

        return switch (type.asText()) {
            case ActionSerializer.STRIKE -> new Action.Strike(target.intValue());
            case ActionSerializer.HEAL -> new Action.Heal(target.intValue());
            default -> throw new IOException("Unknown Action type: " + type.asText());
        };
    }
}
