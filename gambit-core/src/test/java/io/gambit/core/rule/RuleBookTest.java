package io.gambit.core.rule;

import static io.gambit.core.token.Tokens.actingCharacter;
import static io.gambit.core.token.Tokens.element;
import static io.gambit.core.token.Tokens.heal;
import static io.gambit.core.token.Tokens.strike;
import static org.assertj.core.api.Assertions.assertThat;

import io.gambit.core.GambitFactory;
import io.gambit.core.battle.Battles;
import io.gambit.core.runtime.Action;
import io.gambit.core.runtime.EvaluationContext;
import java.util.List;
import java.util.Random;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class RuleBookTest {

    private RuleBook book;

    @BeforeEach
    void setUp() {
        book = GambitFactory.createEnvironment().newRuleBook();
    }

    @Test
    void shouldAttachCompiledRules() throws Exception {
        // When
        BatchCompilation batch = book.attach(1, List.of(heal(actingCharacter())));

        // Then
        assertThat(batch.isSuccessful()).isTrue();
        assertThat(book.rulesFor(1)).hasSize(1);
        assertThat(book.resolveFor(1, EvaluationContext.of(Battles.standard(), new Random(1))))
                .contains(new Action.Heal(1));
    }

    @Test
    void shouldKeepPreviousRulesWhenAnyRuleFails() {
        // Given
        book.attach(1, List.of(strike(actingCharacter())));

        // When
        BatchCompilation batch =
                book.attach(1, List.of(heal(actingCharacter()), strike(element())));

        // Then
        assertThat(batch.isSuccessful()).isFalse();
        assertThat(batch.getRules()).hasSize(1);
        assertThat(book.rulesFor(1))
                .singleElement()
                .satisfies(rule -> assertThat(rule.token()).isEqualTo(strike(actingCharacter())));
    }

    @Test
    void shouldResolveNothingForCharacterWithoutRules() throws Exception {
        assertThat(book.rulesFor(7)).isEmpty();
        assertThat(book.resolveFor(7, EvaluationContext.of(Battles.standard(), new Random(1))))
                .isEmpty();
    }

    @Test
    void shouldDetachRules() {
        book.attach(2, List.of(strike(actingCharacter())));

        assertThat(book.detach(2)).isTrue();
        assertThat(book.detach(2)).isFalse();
        assertThat(book.rulesFor(2)).isEmpty();
    }
}
