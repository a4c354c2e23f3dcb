package io.gambit.serialization;

import static io.gambit.core.token.Tokens.actingCharacter;
import static io.gambit.core.token.Tokens.heal;
import static io.gambit.core.token.Tokens.strike;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.gambit.core.GambitConfig;
import io.gambit.core.GambitFactory;
import io.gambit.core.battle.BattleView;
import io.gambit.core.battle.GameCharacter;
import io.gambit.core.battle.Team;
import io.gambit.core.battle.TeamSide;
import io.gambit.core.rule.BatchCompilation;
import io.gambit.core.runtime.Action;
import io.gambit.core.runtime.EvaluationContext;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Random;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class RuleSerializerTest {

    private static String resource(String name) throws IOException {
        try (InputStream in = RuleSerializerTest.class.getResourceAsStream(name)) {
            assertThat(in).as("resource %s", name).isNotNull();
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
        }
    }

    private static GameCharacter character(int id, String name, int hp) {
        return new GameCharacter(id, name, hp, 100, 20, 20, 10);
    }

    @Nested
    class RuleSets {

        @Test
        void shouldLoadRulesThatCompileAndResolve() throws Exception {
            // Given
            RuleSet rules =
                    RuleSerializer.fromJson(resource("/rules/heal-then-strike-weakest.json"));
            BattleView battle = RuleSerializer.battleFromJson(resource("/battles/standard.json"));

            // When
            BatchCompilation batch =
                    GambitFactory.createEnvironment().getRuleCompiler().compileAll(rules.rules());

            // Then
            assertThat(rules.rules()).hasSize(2);
            assertThat(batch.isSuccessful()).isTrue();
            assertThat(
                            GambitFactory.createEnvironment()
                                    .getRuleResolver()
                                    .resolve(
                                            batch.getRules(),
                                            EvaluationContext.of(battle, new Random(1))))
                    .contains(new Action.Strike(10));
        }

        @Test
        void shouldRoundTripRuleSet() {
            RuleSet original =
                    new RuleSet(List.of(heal(actingCharacter()), strike(actingCharacter())));

            RuleSet restored = RuleSerializer.fromJson(RuleSerializer.toJson(original));

            assertThat(restored).isEqualTo(original);
        }

        @Test
        void shouldIgnoreUnknownTopLevelProperties() {
            RuleSet rules =
                    RuleSerializer.fromJson(
                            "{\"version\": 2, \"rules\": [{\"type\": \"AllCharacters\"}]}");

            assertThat(rules.rules()).hasSize(1);
        }

        @Test
        void shouldWrapMalformedJson() {
            assertThatThrownBy(() -> RuleSerializer.fromJson("{\"rules\": [}"))
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessageStartingWith("Failed to deserialize rule set");
        }
    }

    @Nested
    class BattleSnapshots {

        @Test
        void shouldResolveActingCharacterById() throws Exception {
            // When
            BattleView battle = RuleSerializer.battleFromJson(resource("/battles/standard.json"));

            // Then
            assertThat(battle.actingCharacter().name()).isEqualTo("Hero");
            assertThat(battle.actingSide()).isEqualTo(TeamSide.PLAYER);
            assertThat(battle.teamMembers(TeamSide.ENEMY))
                    .extracting(GameCharacter::id)
                    .containsExactly(10, 11);
        }

        @Test
        void shouldInferActingSideWhenOmitted() {
            String json =
                    """
                    {
                      "actingCharacterId": 10,
                      "playerTeam": {"name": "p", "members": []},
                      "enemyTeam": {"name": "e", "members": [
                        {"id": 10, "name": "Slime", "hp": 5, "maxHp": 5, "mp": 0, "maxMp": 0,
                         "attack": 1}
                      ]}
                    }
                    """;

            BattleView battle = RuleSerializer.battleFromJson(json);

            assertThat(battle.actingSide()).isEqualTo(TeamSide.ENEMY);
            assertThat(battle.actingCharacter().id()).isEqualTo(10);
        }

        @Test
        void shouldRejectActingCharacterOnWrongSide() {
            String json =
                    """
                    {
                      "actingCharacterId": 7,
                      "actingSide": "player",
                      "playerTeam": {"name": "p", "members": []},
                      "enemyTeam": {"name": "e", "members": []}
                    }
                    """;

            assertThatThrownBy(() -> RuleSerializer.battleFromJson(json))
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessageContaining("Acting character 7 is not on the PLAYER side");
        }

        @Test
        void shouldRejectMissingTeam() {
            assertThatThrownBy(() -> RuleSerializer.battleFromJson("{\"actingCharacterId\": 1}"))
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessageContaining("missing the \"playerTeam\" object");
        }

        @Test
        void shouldRoundTripWithoutDerivedProperties() {
            // Given
            GameCharacter hero = character(1, "Hero", 0);
            BattleView battle =
                    new BattleView(
                            hero,
                            TeamSide.PLAYER,
                            new Team("players", List.of(hero)),
                            new Team("enemies", List.of(character(10, "Slime", 50))));

            // When
            String json = RuleSerializer.battleToJson(battle);

            // Then
            assertThat(json).contains("\"actingCharacterId\" : 1").doesNotContain("alive");
            assertThat(RuleSerializer.battleFromJson(json)).isEqualTo(battle);
        }
    }

    @Test
    void shouldWriteAndReadActions() {
        String json = RuleSerializer.actionToJson(new Action.Heal(2));

        assertThat(json).contains("\"type\" : \"heal\"").contains("\"targetId\" : 2");
        assertThat(RuleSerializer.actionFromJson(json)).isEqualTo(new Action.Heal(2));
        assertThatThrownBy(
                        () -> RuleSerializer.actionFromJson("{\"type\":\"defend\",\"targetId\":1}"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Unknown Action type: defend");
    }

    @Test
    void shouldReadPartialConfig() {
        GambitConfig config = RuleSerializer.configFromJson("{\"healCost\": 15}");

        assertThat(config.getHealCost()).isEqualTo(15);
        assertThat(config.isStrictArguments()).isTrue();
        assertThat(config.getRandomConditionProbability()).isEqualTo(0.5);
    }

    @Test
    void shouldRejectOutOfRangeConfig() {
        assertThatThrownBy(() -> RuleSerializer.configFromJson("{\"healCost\": -3}"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageStartingWith("Failed to deserialize config")
                .hasMessageContaining("healCost cannot be negative: -3");
        assertThatThrownBy(
                        () ->
                                RuleSerializer.configFromJson(
                                        "{\"randomConditionProbability\": 1.5}"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("randomConditionProbability must be within [0, 1]");
    }
}
