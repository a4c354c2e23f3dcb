package io.gambit.core.codegen;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.fail;

import io.gambit.core.checker.TypeChecker;
import io.gambit.core.checker.TypedAst;
import io.gambit.core.error.CompileException;
import io.gambit.core.metadata.DefaultTokenMetadataRegistry;
import io.gambit.core.token.Token;
import io.gambit.core.token.Tokens;
import io.gambit.core.type.traits.DefaultTraitRegistry;
import java.util.ArrayList;
import java.util.List;
import java.util.Random;
import java.util.function.Function;
import java.util.function.Supplier;
import org.junit.jupiter.api.Test;

/// Every tree the checker accepts must have a generated node.
class CodeGenerationSoundnessTest {

    private static final int TREES = 20_000;
    private static final int MAX_DEPTH = 6;

    private static final List<Supplier<Token>> LEAVES =
            List.of(
                    Tokens::trueOrFalseRandom,
                    () -> Tokens.number(42),
                    Tokens::actingCharacter,
                    Tokens::hero,
                    Tokens::enemy,
                    Tokens::allCharacters,
                    Tokens::allTeamSides,
                    Tokens::element);

    private static final List<Function<Token, Token>> UNARY =
            List.of(
                    Tokens::strike,
                    Tokens::heal,
                    Tokens::characterToHp,
                    Tokens::characterHpToCharacter,
                    Tokens::characterTeam,
                    Tokens::teamMembers,
                    Tokens::randomPick,
                    Tokens::max,
                    Tokens::min,
                    Tokens::numericMax,
                    Tokens::numericMin,
                    Tokens::count);

    private static final List<Binary> BINARY =
            List.of(
                    Tokens::check,
                    Tokens::greaterThan,
                    Tokens::lessThan,
                    Tokens::eq,
                    Tokens::filterList,
                    Tokens::map);

    private final TypeChecker checker =
            new TypeChecker(new DefaultTokenMetadataRegistry(), new DefaultTraitRegistry());
    private final CodeGenerator generator = new CodeGenerator(new DefaultConverterRegistry());

    @FunctionalInterface
    private interface Binary {
        Token apply(Token first, Token second);
    }

    @Test
    void shouldGenerateEveryTreeThatChecks() {
        // Given
        Random random = new Random(20_240_917L);
        List<String> unsound = new ArrayList<>();
        int checked = 0;

        // When
        for (int i = 0; i < TREES; i++) {
            Token tree = randomTree(random, 0);
            TypedAst typed;
            try {
                typed = checker.check(tree);
            } catch (CompileException e) {
                continue;
            }
            checked++;
            try {
                assertThat(generator.generateForCheckedType(typed)).isPresent();
            } catch (CompileException e) {
                unsound.add(tree + " : " + typed.type() + " -> " + e.getError());
            }
        }

        // Then
        assertThat(checked).isGreaterThan(100);
        if (!unsound.isEmpty()) {
            fail("Checked but not generated:%n%s", String.join("\n", unsound));
        }
    }

    private Token randomTree(Random random, int depth) {
        int shape = depth >= MAX_DEPTH ? 0 : random.nextInt(3);
        if (shape == 0) {
            return LEAVES.get(random.nextInt(LEAVES.size())).get();
        }
        if (shape == 1) {
            return UNARY.get(random.nextInt(UNARY.size())).apply(randomTree(random, depth + 1));
        }
        return BINARY.get(random.nextInt(BINARY.size()))
                .apply(randomTree(random, depth + 1), randomTree(random, depth + 1));
    }
}
