package io.gambit.core.runtime.node;

import static org.assertj.core.api.Assertions.assertThat;

import io.gambit.core.battle.Battles;
import io.gambit.core.battle.CharacterHp;
import io.gambit.core.runtime.EvaluationContext;
import io.gambit.core.runtime.Node;
import java.util.Random;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

class ComparisonNodeTest {

    private final EvaluationContext context =
            EvaluationContext.of(Battles.standard(), new Random(1));

    private static Node<Boolean> hpAgainst(Comparison comparison, int hp, int threshold) {
        CharacterHp value = Battles.character(5, "Target", hp).characterHp();
        return new ComparisonNode<>(
                comparison,
                new ConstantNode<>(value),
                CharacterHp::value,
                new ConstantNode<>(threshold),
                Integer::intValue);
    }

    @ParameterizedTest
    @CsvSource({"80, 50, true", "80, 100, false", "50, 50, false"})
    void shouldProjectHpBeforeGreaterThan(int hp, int threshold, boolean expected)
            throws Exception {
        assertThat(hpAgainst(Comparison.GREATER_THAN, hp, threshold).evaluate(context))
                .isEqualTo(expected);
    }

    @ParameterizedTest
    @CsvSource({"30, 50, true", "50, 50, false", "70, 50, false"})
    void shouldProjectHpBeforeLessThan(int hp, int threshold, boolean expected)
            throws Exception {
        assertThat(hpAgainst(Comparison.LESS_THAN, hp, threshold).evaluate(context))
                .isEqualTo(expected);
    }

    @Test
    void shouldCompareIntegersDirectly() throws Exception {
        Node<Boolean> node =
                new ComparisonNode<>(
                        Comparison.LESS_THAN,
                        new ConstantNode<>(-3),
                        Integer::intValue,
                        new ConstantNode<>(2),
                        Integer::intValue);

        assertThat(node.evaluate(context)).isTrue();
    }
}
