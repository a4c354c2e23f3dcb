package io.gambit.serialization;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.SerializerProvider;
import com.fasterxml.jackson.databind.ser.std.StdSerializer;
import io.gambit.core.runtime.Action;
import java.io.IOException;
import java.io.Serial;

/// Serializes resolved actions with a `"type"` discriminator field.
///
/// - **`Action.Strike`**: `{"type":"strike","targetId":11}`
/// - **`Action.Heal`**: `{"type":"heal","targetId":2}`
///
/// @implNote Package-private. Registered by {@link GambitJacksonModule}.
/// @see ActionDeserializer for the inverse operation
class ActionSerializer extends StdSerializer<Action> {

    @Serial private static final long serialVersionUID = -1877265406114209350L;

    static final String STRIKE = "strike";
    static final String HEAL = "heal";
    static final String TARGET_ID = "targetId";

    ActionSerializer() {
        super(Action.class);
    }

    @Override
    public void serialize(Action action, JsonGenerator gen, SerializerProvider provider)
            throws IOException {
        gen.writeStartObject();
        if (action instanceof Action.Strike strike) {
            gen.writeStringField("type", STRIKE);
            gen.writeNumberField(TARGET_ID, strike.targetId());
        } else if (action instanceof Action.Heal heal) {
            gen.writeStringField("type", HEAL);
            gen.writeNumberField(TARGET_ID, heal.targetId());
        }
        gen.writeEndObject();
    }
}
