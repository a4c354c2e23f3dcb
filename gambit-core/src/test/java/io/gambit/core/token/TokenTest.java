package io.gambit.core.token;

import static io.gambit.core.token.Tokens.actingCharacter;
import static io.gambit.core.token.Tokens.heal;
import static io.gambit.core.token.Tokens.number;
import static io.gambit.core.token.Tokens.strike;
import static io.gambit.core.token.Tokens.trueOrFalseRandom;
import static org.assertj.core.api.Assertions.assertThat;

import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;
import org.junit.jupiter.api.Test;

class TokenTest {

    private static Token selfChecking() {
        Map<String, Token> arguments = new LinkedHashMap<>();
        Token loop = new Token(TokenKind.CHECK, arguments, Map.of());
        arguments.put("condition", trueOrFalseRandom());
        arguments.put("then_action", loop);
        return loop;
    }

    @Test
    void shouldCompareTreesStructurally() {
        assertThat(strike(actingCharacter())).isEqualTo(strike(actingCharacter()));
        assertThat(strike(actingCharacter()).hashCode())
                .isEqualTo(strike(actingCharacter()).hashCode());
        assertThat(strike(actingCharacter())).isNotEqualTo(heal(actingCharacter()));
        assertThat(number(3)).isNotEqualTo(number(4));
    }

    @Test
    void shouldTellApartTreesDifferingOnlyInDeepOperands() {
        Token left = Tokens.check(trueOrFalseRandom(), strike(actingCharacter()));
        Token right = Tokens.check(trueOrFalseRandom(), strike(Tokens.randomPick(number(1))));

        assertThat(left).isNotEqualTo(right);
    }

    @Test
    void shouldCompareCyclicTreesWithoutOverflow() {
        // Given
        Token first = selfChecking();
        Token second = selfChecking();

        // When / Then
        assertThat(first).isEqualTo(second);
        assertThat(first.hashCode()).isEqualTo(second.hashCode());
        assertThat(first).isNotEqualTo(Tokens.check(trueOrFalseRandom(), strike(number(1))));
    }

    @Test
    void shouldCompareMissingOperands() {
        Map<String, Token> missing = new HashMap<>();
        missing.put("target", null);

        Token withHole = new Token(TokenKind.STRIKE, missing, Map.of());

        assertThat(withHole)
                .isEqualTo(new Token(TokenKind.STRIKE, new HashMap<>(missing), Map.of()));
        assertThat(withHole).isNotEqualTo(strike(actingCharacter()));
    }
}
