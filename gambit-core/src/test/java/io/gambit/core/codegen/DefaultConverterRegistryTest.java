package io.gambit.core.codegen;

import static io.gambit.core.token.Tokens.actingCharacter;
import static io.gambit.core.token.Tokens.check;
import static io.gambit.core.token.Tokens.greaterThan;
import static io.gambit.core.token.Tokens.number;
import static io.gambit.core.token.Tokens.strike;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.catchThrowableOfType;

import io.gambit.core.battle.Battles;
import io.gambit.core.checker.TypedAst;
import io.gambit.core.codegen.converter.SimpleConverter;
import io.gambit.core.error.CompileError;
import io.gambit.core.error.CompileException;
import io.gambit.core.error.ErrorKind;
import io.gambit.core.runtime.Action;
import io.gambit.core.runtime.EvaluationContext;
import io.gambit.core.runtime.Node;
import io.gambit.core.runtime.ValueType;
import io.gambit.core.runtime.node.ConstantNode;
import io.gambit.core.token.Token;
import io.gambit.core.token.TokenKind;
import io.gambit.core.type.Type;
import java.util.Map;
import java.util.Random;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class DefaultConverterRegistryTest {

    private DefaultConverterRegistry registry;

    @BeforeEach
    void setUp() {
        registry = new DefaultConverterRegistry();
    }

    private CompileError conversionError(TypedAst ast, ValueType<?> target) {
        return catchThrowableOfType(CompileException.class, () -> registry.convert(ast, target))
                .getError();
    }

    @Nested
    class BuiltIns {

        @Test
        void shouldRegisterActionAndConditionConverters() {
            assertThat(registry.hasConverter(TokenKind.STRIKE, ValueType.ACTION)).isTrue();
            assertThat(registry.hasConverter(TokenKind.CHECK, ValueType.ACTION)).isTrue();
            assertThat(registry.hasConverter(TokenKind.GREATER_THAN, ValueType.BOOLEAN)).isTrue();
        }

        @Test
        void shouldRegisterListCombinatorsPerElementType() {
            assertThat(
                            registry.hasConverter(
                                    TokenKind.FILTER_LIST,
                                    ValueType.sequenceOf(ValueType.CHARACTER)))
                    .isTrue();
            assertThat(
                            registry.hasConverter(
                                    TokenKind.MAP,
                                    ValueType.sequenceOf(
                                            ValueType.sequenceOf(ValueType.TEAM_SIDE))))
                    .isTrue();
            assertThat(registry.hasConverter(TokenKind.ELEMENT, ValueType.CHARACTER_HP)).isTrue();
        }

        @Test
        void shouldRegisterExtremumsOnlyForOrderedTypes() {
            assertThat(registry.hasConverter(TokenKind.MAX, ValueType.CHARACTER_HP)).isTrue();
            assertThat(registry.hasConverter(TokenKind.NUMERIC_MIN, ValueType.INTEGER)).isTrue();
            assertThat(registry.hasConverter(TokenKind.MAX, ValueType.CHARACTER)).isTrue();
            assertThat(registry.hasConverter(TokenKind.MIN, ValueType.CHARACTER)).isTrue();
            assertThat(registry.hasConverter(TokenKind.NUMERIC_MAX, ValueType.CHARACTER))
                    .isFalse();
            assertThat(registry.hasConverter(TokenKind.MAX, ValueType.TEAM_SIDE)).isFalse();
        }

        @Test
        void shouldRegisterEqualityForEveryScalar() {
            assertThat(registry.getConverters(TokenKind.EQ, ValueType.BOOLEAN))
                    .hasSize(ValueType.scalars().size());
        }
    }

    @Nested
    class Failures {

        @Test
        void shouldReportMissingConverter() {
            // Given
            Token defend = Token.leaf("Defend");

            // When
            CompileError error =
                    conversionError(TypedAst.leaf(defend, Type.ACTION), ValueType.ACTION);

            // Then
            assertThat(error.getKind()).isEqualTo(new ErrorKind.NoConverter("Defend", Type.ACTION));
            assertThat(error.getToken()).contains(defend);
        }

        @Test
        void shouldReportMissingConverterForIncompatibleTarget() {
            TypedAst ast = TypedAst.leaf(actingCharacter(), Type.CHARACTER);

            CompileError error = conversionError(ast, ValueType.INTEGER);

            assertThat(error.getKind())
                    .isEqualTo(new ErrorKind.NoConverter(TokenKind.ACTING_CHARACTER, Type.INTEGER));
        }

        @Test
        void shouldReportMissingChild() {
            TypedAst ast = new TypedAst(strike(actingCharacter()), Type.ACTION, Map.of());

            CompileError error = conversionError(ast, ValueType.ACTION);

            assertThat(error.getKind()).isEqualTo(new ErrorKind.MissingChild("Strike", "target"));
        }

        @Test
        void shouldReportChildOfWrongType() {
            TypedAst ast =
                    new TypedAst(
                            strike(number(5)),
                            Type.ACTION,
                            Map.of("target", TypedAst.leaf(number(5), Type.INTEGER)));

            CompileError error = conversionError(ast, ValueType.ACTION);

            assertThat(error.getKind())
                    .isEqualTo(
                            new ErrorKind.ChildTypeMismatch(
                                    "Strike", "target", Type.CHARACTER, Type.INTEGER));
        }

        @Test
        void shouldPrependSlotOfEnclosingConversion() {
            // Given: a comparison whose operands were never typed
            Token condition = greaterThan(actingCharacter(), number(1));
            TypedAst ast =
                    new TypedAst(
                            check(condition, strike(actingCharacter())),
                            Type.ACTION,
                            Map.of(
                                    "condition",
                                    new TypedAst(condition, Type.BOOLEAN, Map.of()),
                                    "then_action",
                                    TypedAst.leaf(strike(actingCharacter()), Type.ACTION)));

            // When
            CompileError error = conversionError(ast, ValueType.ACTION);

            // Then
            assertThat(error.getKind())
                    .isEqualTo(new ErrorKind.MissingChild("GreaterThan", "left"));
            assertThat(error.getLocation()).isEqualTo("Check.condition");
        }
    }

    @Nested
    class Registration {

        @Test
        void shouldUseCustomConverter() throws Exception {
            // Given
            Action guard = new Action.Strike(0);
            registry.register(
                    new SimpleConverter<>(
                            "Defend",
                            ValueType.ACTION,
                            (ast, converters) -> new ConstantNode<>(guard)));

            // When
            TypedAst defend = TypedAst.leaf(Token.leaf("Defend"), Type.ACTION);
            Node<Action> node = registry.convert(defend, ValueType.ACTION);

            // Then
            assertThat(node.evaluate(EvaluationContext.of(Battles.standard(), new Random(1))))
                    .isSameAs(guard);
        }

        @Test
        void shouldRejectBlankTokenKind() {
            SimpleConverter<Integer> blank =
                    new SimpleConverter<>(
                            " ", ValueType.INTEGER, (ast, converters) -> new ConstantNode<>(1));

            assertThatThrownBy(() -> registry.register(blank))
                    .isInstanceOf(IllegalArgumentException.class);
        }

        @Test
        void shouldRejectNullConverter() {
            assertThatThrownBy(() -> registry.register(null))
                    .isInstanceOf(NullPointerException.class);
        }
    }
}
