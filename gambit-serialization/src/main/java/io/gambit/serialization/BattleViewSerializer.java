package io.gambit.serialization;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.SerializerProvider;
import com.fasterxml.jackson.databind.ser.std.StdSerializer;
import io.gambit.core.battle.BattleView;
import java.io.IOException;
import java.io.Serial;

/// Serializes a battle snapshot, storing the acting character by id.
///
/// ```
/// {"actingCharacterId":1,"actingSide":"PLAYER","playerTeam":{...},"enemyTeam":{...}}
/// ```
///
/// @implNote Package-private. Registered by {@link GambitJacksonModule}.
/// @see BattleViewDeserializer for the inverse operation
class BattleViewSerializer extends StdSerializer<BattleView> {

    @Serial private static final long serialVersionUID = 5523068117405946082L;

    static final String ACTING_CHARACTER_ID = "actingCharacterId";
    static final String ACTING_SIDE = "actingSide";
    static final String PLAYER_TEAM = "playerTeam";
    static final String ENEMY_TEAM = "enemyTeam";

    BattleViewSerializer() {
        super(BattleView.class);
    }

    @Override
    public void serialize(BattleView battle, JsonGenerator gen, SerializerProvider provider)
            throws IOException {
        gen.writeStartObject();
        gen.writeNumberField(ACTING_CHARACTER_ID, battle.actingCharacter().id());
        gen.writeStringField(ACTING_SIDE, battle.actingSide().name());
        provider.defaultSerializeField(PLAYER_TEAM, battle.playerTeam(), gen);
        provider.defaultSerializeField(ENEMY_TEAM, battle.enemyTeam(), gen);
        gen.writeEndObject();
    }
}
