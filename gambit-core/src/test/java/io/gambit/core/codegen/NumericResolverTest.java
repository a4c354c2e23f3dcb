package io.gambit.core.codegen;

import static org.assertj.core.api.Assertions.assertThat;

import io.gambit.core.checker.TypedAst;
import io.gambit.core.codegen.NumericResolver.OperandTypes;
import io.gambit.core.token.Token;
import io.gambit.core.token.TokenKind;
import io.gambit.core.type.Type;
import java.util.Map;
import org.junit.jupiter.api.Test;

class NumericResolverTest {

    private final NumericResolver resolver = new NumericResolver();

    private static TypedAst abstractNumber() {
        return TypedAst.leaf(Token.leaf("Stat"), Type.NUMERIC);
    }

    private static TypedAst reduction(String kind, Type elementType) {
        TypedAst array = TypedAst.leaf(Token.leaf("Source"), Type.sequenceOf(elementType));
        return new TypedAst(Token.leaf(kind), Type.NUMERIC, Map.of("array", array));
    }

    @Test
    void shouldKeepConcreteType() {
        assertThat(resolver.resolve(TypedAst.leaf(Token.leaf("Hp"), Type.CHARACTER_HP)))
                .isEqualTo(Type.CHARACTER_HP);
    }

    @Test
    void shouldDefaultAbstractOperandToInteger() {
        assertThat(resolver.resolve(abstractNumber())).isEqualTo(Type.INTEGER);
    }

    @Test
    void shouldFollowSiblingHint() {
        assertThat(resolver.resolve(abstractNumber(), Type.CHARACTER_HP))
                .isEqualTo(Type.CHARACTER_HP);
        assertThat(resolver.resolve(abstractNumber(), Type.NUMERIC)).isEqualTo(Type.INTEGER);
    }

    @Test
    void shouldPreferElementTypeOfReductionOverSibling() {
        // Given
        TypedAst max = reduction(TokenKind.MAX, Type.CHARACTER_HP);

        // When
        Type resolved = resolver.resolve(max, Type.INTEGER);

        // Then
        assertThat(resolved).isEqualTo(Type.CHARACTER_HP);
    }

    @Test
    void shouldIgnoreArrayOfNonReductions() {
        TypedAst count = reduction(TokenKind.COUNT, Type.CHARACTER_HP);

        assertThat(resolver.resolve(count)).isEqualTo(Type.INTEGER);
    }

    @Test
    void shouldResolvePairAgainstEachOther() {
        // Given
        TypedAst hp = TypedAst.leaf(Token.leaf("Hp"), Type.CHARACTER_HP);

        // When
        OperandTypes types = resolver.resolvePair(abstractNumber(), hp);

        // Then
        assertThat(types).isEqualTo(new OperandTypes(Type.CHARACTER_HP, Type.CHARACTER_HP));
    }

    @Test
    void shouldResolveAbstractPairToInteger() {
        OperandTypes types = resolver.resolvePair(abstractNumber(), abstractNumber());

        assertThat(types).isEqualTo(new OperandTypes(Type.INTEGER, Type.INTEGER));
    }
}
