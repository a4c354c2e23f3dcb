package io.gambit.core.type;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

class TypeTest {

    @Nested
    class Compatibility {

        @ParameterizedTest
        @EnumSource(Type.Atom.class)
        void shouldBeCompatibleWithItselfAndAny(Type.Atom type) {
            assertThat(type.isCompatibleWith(type)).isTrue();
            assertThat(type.isCompatibleWith(Type.ANY)).isTrue();
            assertThat(Type.ANY.isCompatibleWith(type)).isTrue();
        }

        @Test
        void shouldAcceptNumericRepresentationsWhereNumericIsExpected() {
            assertThat(Type.NUMERIC.isCompatibleWith(Type.INTEGER)).isTrue();
            assertThat(Type.CHARACTER_HP.isCompatibleWith(Type.NUMERIC)).isTrue();
        }

        @Test
        void shouldNotMixConcreteNumericRepresentations() {
            assertThat(Type.INTEGER.isCompatibleWith(Type.CHARACTER_HP)).isFalse();
        }

        @Test
        void shouldRejectNonNumericWhereNumericIsExpected() {
            assertThat(Type.NUMERIC.isCompatibleWith(Type.CHARACTER)).isFalse();
            assertThat(Type.BOOLEAN.isCompatibleWith(Type.NUMERIC)).isFalse();
        }

        @Test
        void shouldCompareCollectionsElementWise() {
            Type numbers = Type.sequenceOf(Type.NUMERIC);

            assertThat(numbers.isCompatibleWith(Type.sequenceOf(Type.INTEGER))).isTrue();
            assertThat(Type.sequenceOf(Type.CHARACTER).isCompatibleWith(Type.CHARACTER)).isFalse();
            assertThat(Type.optionOf(Type.ANY).isCompatibleWith(Type.optionOf(Type.TEAM_SIDE)))
                    .isTrue();
            assertThat(Type.optionOf(Type.INTEGER).isCompatibleWith(Type.sequenceOf(Type.INTEGER)))
                    .isFalse();
        }
    }

    @Nested
    class Resolution {

        @Test
        void shouldDefaultNumericToInteger() {
            assertThat(Type.NUMERIC.resolveToConcrete(null)).isEqualTo(Type.INTEGER);
            assertThat(Type.NUMERIC.resolveToConcrete(Type.BOOLEAN)).isEqualTo(Type.INTEGER);
        }

        @Test
        void shouldFollowCharacterHpHint() {
            assertThat(Type.NUMERIC.resolveToConcrete(Type.CHARACTER_HP))
                    .isEqualTo(Type.CHARACTER_HP);
        }

        @Test
        void shouldResolveAnyToHintOrVoid() {
            assertThat(Type.ANY.resolveToConcrete(Type.TEAM_SIDE)).isEqualTo(Type.TEAM_SIDE);
            assertThat(Type.ANY.resolveToConcrete(null)).isEqualTo(Type.VOID);
        }

        @Test
        void shouldResolveCollectionsElementWise() {
            Type resolved =
                    Type.sequenceOf(Type.NUMERIC)
                            .resolveToConcrete(Type.sequenceOf(Type.CHARACTER_HP));

            assertThat(resolved).isEqualTo(Type.sequenceOf(Type.CHARACTER_HP));
        }

        @Test
        void shouldLeaveConcreteTypesAlone() {
            assertThat(Type.CHARACTER.resolveToConcrete(Type.INTEGER)).isEqualTo(Type.CHARACTER);
        }
    }

    @Test
    void shouldReportAbstractnessThroughCollections() {
        assertThat(Type.NUMERIC.isAbstract()).isTrue();
        assertThat(Type.sequenceOf(Type.ANY).isAbstract()).isTrue();
        assertThat(Type.optionOf(Type.sequenceOf(Type.INTEGER)).isAbstract()).isFalse();
    }

    @Test
    void shouldRenderNestedDisplayNames() {
        assertThat(Type.sequenceOf(Type.optionOf(Type.CHARACTER_HP)).displayName())
                .isEqualTo("Vec<Option<CharacterHP>>");
        assertThat(Type.sequenceOf(Type.INTEGER).elementType()).contains(Type.INTEGER);
        assertThat(Type.INTEGER.elementType()).isEmpty();
    }
}
