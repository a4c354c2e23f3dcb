package io.gambit.core.runtime.node;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import io.gambit.core.battle.BattleView;
import io.gambit.core.battle.Battles;
import io.gambit.core.battle.GameCharacter;
import io.gambit.core.battle.TeamSide;
import io.gambit.core.runtime.Action;
import io.gambit.core.runtime.EvaluationContext;
import io.gambit.core.runtime.EvaluationError;
import io.gambit.core.runtime.Node;
import io.gambit.core.runtime.RuleBreak;
import io.gambit.core.runtime.ValueType;
import java.util.Random;
import java.util.random.RandomGenerator;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class ActionNodesTest {

    private static EvaluationContext contextActingAs(GameCharacter acting) {
        return EvaluationContext.of(Battles.actingAs(acting), new Random(3));
    }

    @Nested
    class Strike {

        @Test
        void shouldStrikeTarget() throws Exception {
            Node<Action> strike =
                    new StrikeNode(new ConstantNode<>(Battles.character(10, "Slime", 50)));

            assertThat(strike.evaluate(EvaluationContext.of(Battles.standard(), new Random(1))))
                    .isEqualTo(new Action.Strike(10));
        }

        @Test
        @SuppressWarnings("unchecked")
        void shouldBreakWithoutEvaluatingTargetWhenActorIsDead() {
            // Given
            Node<GameCharacter> target = mock(Node.class);
            Node<Action> strike = new StrikeNode(target);

            // When / Then
            EvaluationContext context = contextActingAs(Battles.character(1, "Hero", 0));
            assertThatThrownBy(() -> strike.evaluate(context))
                    .isInstanceOf(RuleBreak.class);
            verifyNoInteractions(target);
        }
    }

    @Nested
    class Heal {

        @Test
        void shouldHealWhenEnoughMp() throws Exception {
            Node<Action> heal = new HealNode(new ActingCharacterNode(), 10);

            Action action = heal.evaluate(contextActingAs(Battles.character(1, "Hero", 40, 10)));

            assertThat(action).isEqualTo(new Action.Heal(1));
        }

        @Test
        void shouldBreakRatherThanFailWhenMpIsShort() {
            Node<Action> heal = new HealNode(new ActingCharacterNode(), 10);
            EvaluationContext context = contextActingAs(Battles.character(1, "Hero", 40, 5));

            assertThatThrownBy(() -> heal.evaluate(context))
                    .isInstanceOf(RuleBreak.class)
                    .hasMessageContaining("5 MP, needs 10");
        }

        @Test
        void shouldRejectNegativeCost() {
            assertThatThrownBy(() -> new HealNode(new ActingCharacterNode(), -1))
                    .isInstanceOf(IllegalArgumentException.class);
        }
    }

    @Nested
    class Check {

        @Test
        void shouldRunActionWhenConditionHolds() throws Exception {
            Node<Action> check =
                    new CheckNode(
                            new ConstantNode<>(true), new StrikeNode(new ActingCharacterNode()));

            assertThat(check.evaluate(contextActingAs(Battles.character(1, "Hero", 10))))
                    .isEqualTo(new Action.Strike(1));
        }

        @Test
        void shouldBreakWhenConditionFails() {
            Node<Action> check =
                    new CheckNode(
                            new ConstantNode<>(false), new StrikeNode(new ActingCharacterNode()));

            assertThatThrownBy(() -> check.evaluate(contextActingAs(Battles.character(1, "A", 9))))
                    .isInstanceOfSatisfying(
                            RuleBreak.class,
                            e -> assertThat(e.getReason()).isEqualTo("condition not met"));
        }
    }

    @Test
    void shouldDrawRandomConditionFromContextSource() throws Exception {
        // Given
        RandomGenerator random = mock(RandomGenerator.class);
        when(random.nextDouble()).thenReturn(0.2, 0.7);
        EvaluationContext context = EvaluationContext.of(Battles.standard(), random);
        Node<Boolean> coin = new RandomConditionNode(0.5);

        // When / Then
        assertThat(coin.evaluate(context)).isTrue();
        assertThat(coin.evaluate(context)).isFalse();
    }

    @Test
    void shouldFindTeamOfCharacter() throws Exception {
        BattleView battle = Battles.standard();
        EvaluationContext context = EvaluationContext.of(battle, new Random(1));

        assertThat(new CharacterTeamNode(new ConstantNode<>(battle.enemyTeam().members().get(0)))
                        .evaluate(context))
                .isEqualTo(TeamSide.ENEMY);
        assertThatThrownBy(
                        () ->
                                new CharacterTeamNode(
                                                new ConstantNode<>(Battles.character(99, "X", 1)))
                                        .evaluate(context))
                .isInstanceOf(EvaluationError.class);
    }

    @Test
    void shouldCompareHpByValueOnly() throws Exception {
        EvaluationContext context = EvaluationContext.of(Battles.standard(), new Random(1));
        Node<Boolean> equal =
                new EqualityNode<>(
                        ValueType.CHARACTER_HP,
                        new ConstantNode<>(Battles.character(1, "A", 40).characterHp()),
                        new ConstantNode<>(Battles.character(2, "B", 40).characterHp()));

        assertThat(equal.evaluate(context)).isTrue();
    }
}
