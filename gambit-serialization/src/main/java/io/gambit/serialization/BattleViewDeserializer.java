package io.gambit.serialization;

import static io.gambit.serialization.BattleViewSerializer.ACTING_CHARACTER_ID;
import static io.gambit.serialization.BattleViewSerializer.ACTING_SIDE;
import static io.gambit.serialization.BattleViewSerializer.ENEMY_TEAM;
import static io.gambit.serialization.BattleViewSerializer.PLAYER_TEAM;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.ObjectCodec;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.deser.std.StdDeserializer;
import io.gambit.core.battle.BattleView;
import io.gambit.core.battle.GameCharacter;
import io.gambit.core.battle.Team;
import io.gambit.core.battle.TeamSide;
import java.io.IOException;
import java.io.Serial;
import java.util.Locale;
import java.util.Optional;

/// Deserializes a battle snapshot and resolves the acting character from its team.
///
/// `actingSide` may be omitted, in which case it is the side whose roster holds
/// `actingCharacterId`.
///
/// @implNote Package-private. Registered by {@link GambitJacksonModule}.
/// @see BattleViewSerializer for the inverse operation
class BattleViewDeserializer extends StdDeserializer<BattleView> {

    @Serial private static final long serialVersionUID = -3309418577520652071L;

    BattleViewDeserializer() {
        super(BattleView.class);
    }

    /// @throws IOException if a team is missing or the acting character is not on its side
    @Override
    public BattleView deserialize(JsonParser p, DeserializationContext ctx) throws IOException {
        ObjectCodec codec = p.getCodec();
        JsonNode root = codec.readTree(p);

        Team players = team(codec, root, PLAYER_TEAM);
        Team enemies = team(codec, root, ENEMY_TEAM);

        JsonNode idNode = root.get(ACTING_CHARACTER_ID);
        if (idNode == null || !idNode.canConvertToInt()) {
            throw new IOException("Battle needs an integer \"" + ACTING_CHARACTER_ID + "\"");
        }
        int actingId = idNode.intValue();

        TeamSide side = actingSide(root, actingId, players);
        Team actingTeam = side == TeamSide.PLAYER ? players : enemies;
        Optional<GameCharacter> acting = actingTeam.member(actingId);
        if (acting.isEmpty()) {
            throw new IOException(
                    "Acting character " + actingId + " is not on the " + side + " side");
        }
        return new BattleView(acting.get(), side, players, enemies);
    }

    private static Team team(ObjectCodec codec, JsonNode root, String field) throws IOException {
        JsonNode node = root.get(field);
        if (node == null || !node.isObject()) {
            throw new IOException("Battle is missing the \"" + field + "\" object");
        }
        return codec.treeToValue(node, Team.class);
    }

    private static TeamSide actingSide(JsonNode root, int actingId, Team players)
            throws IOException {
        JsonNode sideNode = root.get(ACTING_SIDE);
        if (sideNode == null || sideNode.isNull()) {
            return players.member(actingId).isPresent() ? TeamSide.PLAYER : TeamSide.ENEMY;
        }
        try {
            return TeamSide.valueOf(sideNode.asText().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IOException("Unknown team side: " + sideNode.asText(), e);
        }
    }
}
