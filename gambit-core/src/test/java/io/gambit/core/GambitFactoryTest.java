package io.gambit.core;

import static io.gambit.core.token.Tokens.actingCharacter;
import static io.gambit.core.token.Tokens.heal;
import static io.gambit.core.token.Tokens.number;
import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;

import io.gambit.core.battle.Battles;
import io.gambit.core.error.ErrorKind;
import io.gambit.core.rule.CompilationResult;
import io.gambit.core.rule.RuleBook;
import io.gambit.core.rule.RuleCompilationListener;
import io.gambit.core.rule.RuleCompiler;
import io.gambit.core.runtime.Action;
import io.gambit.core.runtime.EvaluationContext;
import io.gambit.core.token.Token;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Random;
import org.junit.jupiter.api.Test;

class GambitFactoryTest {

    private static Token strikeWithExtraOperand() {
        Map<String, Token> arguments = new LinkedHashMap<>();
        arguments.put("target", actingCharacter());
        arguments.put("bonus", number(3));
        return new Token("Strike", arguments, Map.of());
    }

    @Test
    void shouldWireDefaultEnvironment() {
        // When
        GambitEnvironment env = GambitFactory.createEnvironment();

        // Then
        assertThat(env.getConfig().getHealCost()).isEqualTo(10);
        assertThat(env.getMetadataRegistry().get("Strike")).isPresent();
        assertThat(env.getConverterRegistry()).isNotNull();
        assertThat(env.getRuleCompiler().compile(heal(actingCharacter())).isSuccess()).isTrue();
    }

    @Test
    void shouldApplyConfiguredHealCost() throws Exception {
        // Given
        GambitEnvironment env =
                GambitFactory.createEnvironment(GambitConfig.builder().healCost(25).build());
        RuleBook book = env.newRuleBook();
        book.attach(1, List.of(heal(actingCharacter())));

        // When
        var action = book.resolveFor(1, EvaluationContext.of(Battles.standard(), new Random(3)));

        // Then
        assertThat(action).isEmpty();
    }

    @Test
    void shouldHealWithDefaultCost() throws Exception {
        RuleBook book = GambitFactory.createEnvironment().newRuleBook();
        book.attach(1, List.of(heal(actingCharacter())));

        assertThat(book.resolveFor(1, EvaluationContext.of(Battles.standard(), new Random(3))))
                .contains(new Action.Heal(1));
    }

    @Test
    void shouldRejectUndeclaredOperandsByDefault() {
        RuleCompiler compiler = GambitFactory.createEnvironment().getRuleCompiler();

        CompilationResult result = compiler.compile(strikeWithExtraOperand());

        assertThat(result.isSuccess()).isFalse();
        assertThat(result.getError().getKind())
                .isEqualTo(new ErrorKind.ArgumentCountMismatch("Strike", 1, 2));
    }

    @Test
    void shouldIgnoreUndeclaredOperandsWhenLenient() {
        // Given
        GambitEnvironment env =
                GambitFactory.createEnvironment(
                        GambitConfig.builder().strictArguments(false).build());

        // When
        CompilationResult result = env.getRuleCompiler().compile(strikeWithExtraOperand());

        // Then
        assertThat(result.isSuccess()).isTrue();
    }

    @Test
    void shouldNotifyListenerFromBuilder() {
        // Given
        RuleCompilationListener listener = mock(RuleCompilationListener.class);
        GambitEnvironment env = GambitFactory.builder().listener(listener).build();

        // When
        CompilationResult result = env.getRuleCompiler().compile(heal(actingCharacter()));

        // Then
        verify(listener).onCompiled(result.getRule());
    }
}
