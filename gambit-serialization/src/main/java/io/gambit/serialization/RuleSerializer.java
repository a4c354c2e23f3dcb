package io.gambit.serialization;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import io.gambit.core.GambitConfig;
import io.gambit.core.battle.BattleView;
import io.gambit.core.runtime.Action;
import io.gambit.core.token.Token;

/// Utility class for reading and writing Gambit rule sets, battle snapshots and actions as JSON.
///
/// ### Usage
/// ```
/// RuleSet rules = RuleSerializer.fromJson(Files.readString(rulesFile));
/// BattleView battle = RuleSerializer.battleFromJson(Files.readString(battleFile));
/// ```
///
/// @implNote Thread-safe. A fresh `ObjectMapper` is created per call via `createMapper()`.
/// Cache the mapper if you parse in a loop.
///
/// @see GambitJacksonModule for the registered type handlers
public final class RuleSerializer {

    private RuleSerializer() {}

    /// Serializes a rule set to pretty-printed JSON.
    ///
    /// @param rules rule set to serialize, not null
    /// @return JSON text, never null
    /// @throws IllegalArgumentException if serialization fails, e.g. on a cyclic token
    public static String toJson(RuleSet rules) {
        return write(rules, "rule set");
    }

    /// Deserializes a rule set.
    ///
    /// @param json JSON text, not null
    /// @return the rule set, never null
    /// @throws IllegalArgumentException if the JSON is malformed
    public static RuleSet fromJson(String json) {
        return read(json, RuleSet.class, "rule set");
    }

    public static String tokenToJson(Token token) {
        return write(token, "token");
    }

    /// Deserializes a single token tree.
    ///
    /// @throws IllegalArgumentException if the JSON is malformed
    public static Token tokenFromJson(String json) {
        return read(json, Token.class, "token");
    }

    public static String battleToJson(BattleView battle) {
        return write(battle, "battle");
    }

    /// Deserializes a battle snapshot.
    ///
    /// @throws IllegalArgumentException if the JSON is malformed or the acting character is
    /// not on its team
    public static BattleView battleFromJson(String json) {
        return read(json, BattleView.class, "battle");
    }

    public static String actionToJson(Action action) {
        return write(action, "action");
    }

    public static Action actionFromJson(String json) {
        return read(json, Action.class, "action");
    }

    /// Deserializes configuration, e.g. `{"healCost": 15, "strictArguments": false}`.
    ///
    /// Omitted fields keep their defaults.
    public static GambitConfig configFromJson(String json) {
        return read(json, GambitConfig.class, "config");
    }

    /// Creates an ObjectMapper configured for Gambit serialization.
    ///
    /// Registers:
    /// - `GambitJacksonModule` for tokens, actions and battles
    /// - `FAIL_ON_UNKNOWN_PROPERTIES` disabled for forward compatibility
    /// - indented output
    ///
    /// @return configured ObjectMapper, never null
    public static ObjectMapper createMapper() {
        return new ObjectMapper()
                .registerModule(new GambitJacksonModule())
                .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
                .enable(SerializationFeature.INDENT_OUTPUT);
    }

    private static String write(Object value, String what) {
        try {
            return createMapper().writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException(
                    "Failed to serialize " + what + ": " + e.getMessage(), e);
        }
    }

    private static <T> T read(String json, Class<T> type, String what) {
        try {
            return createMapper().readValue(json, type);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException(
                    "Failed to deserialize " + what + ": " + e.getMessage(), e);
        }
    }
}
