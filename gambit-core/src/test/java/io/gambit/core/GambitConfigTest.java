package io.gambit.core;

import static io.gambit.core.token.Tokens.actingCharacter;
import static io.gambit.core.token.Tokens.check;
import static io.gambit.core.token.Tokens.heal;
import static io.gambit.core.token.Tokens.trueOrFalseRandom;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.gambit.core.codegen.converter.HealConverter;
import org.junit.jupiter.api.Test;

class GambitConfigTest {

    @Test
    void shouldStartWithDefaults() {
        GambitConfig config = new GambitConfig();

        assertThat(config.getHealCost()).isEqualTo(10);
        assertThat(config.getRandomConditionProbability()).isEqualTo(0.5);
        assertThat(config.isStrictArguments()).isTrue();
    }

    @Test
    void shouldAcceptBoundaryValues() {
        GambitConfig config =
                GambitConfig.builder().healCost(0).randomConditionProbability(1.0).build();

        assertThat(config.getHealCost()).isZero();
        assertThat(config.getRandomConditionProbability()).isEqualTo(1.0);
    }

    @Test
    void shouldRejectNegativeHealCost() {
        assertThatThrownBy(() -> GambitConfig.builder().healCost(-1))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessage("healCost cannot be negative: -1");
        assertThatThrownBy(() -> new GambitConfig().setHealCost(-5))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void shouldRejectProbabilityOutsideUnitInterval() {
        assertThatThrownBy(() -> GambitConfig.builder().randomConditionProbability(2.0))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("randomConditionProbability must be within [0, 1]");
        assertThatThrownBy(() -> new GambitConfig().setRandomConditionProbability(-0.1))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new GambitConfig().setRandomConditionProbability(Double.NaN))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void shouldKeepPreviousValueWhenRejected() {
        GambitConfig config = new GambitConfig();

        assertThatThrownBy(() -> config.setHealCost(-1))
                .isInstanceOf(IllegalArgumentException.class);

        assertThat(config.getHealCost()).isEqualTo(10);
    }

    @Test
    void shouldCompileRandomHealWithEdgeValues() {
        // Given
        GambitConfig config =
                GambitConfig.builder().healCost(0).randomConditionProbability(0.0).build();
        GambitEnvironment env = GambitFactory.createEnvironment(config);

        // When / Then
        assertThat(
                        env.getRuleCompiler()
                                .compile(check(trueOrFalseRandom(), heal(actingCharacter())))
                                .isSuccess())
                .isTrue();
    }

    @Test
    void shouldRejectNegativeCostInHealConverter() {
        assertThatThrownBy(() -> new HealConverter(-1))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("-1");
    }
}
