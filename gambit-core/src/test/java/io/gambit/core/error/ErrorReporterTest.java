package io.gambit.core.error;

import static io.gambit.core.token.Tokens.actingCharacter;
import static io.gambit.core.token.Tokens.greaterThan;
import static io.gambit.core.token.Tokens.number;
import static org.assertj.core.api.Assertions.assertThat;

import io.gambit.core.metadata.DefaultTokenMetadataRegistry;
import io.gambit.core.token.Token;
import io.gambit.core.type.Type;
import io.gambit.core.type.traits.Traits;
import java.util.List;
import org.junit.jupiter.api.Test;

class ErrorReporterTest {

    private final ErrorReporter reporter = new ErrorReporter(new DefaultTokenMetadataRegistry());

    private static CompileError mismatchInComparison() {
        Token comparison = greaterThan(actingCharacter(), number(50));
        return CompileError.of(
                        new ErrorKind.TypeMismatch(
                                Type.NUMERIC, Type.CHARACTER, "GreaterThan.left"),
                        comparison)
                .withContext(new PathSegment("GreaterThan", "left"))
                .withContext(new PathSegment("Check", "condition"));
    }

    @Test
    void shouldRenderFullReport() {
        // When
        String report = reporter.format(mismatchInComparison());

        // Then
        assertThat(report)
                .isEqualTo(
                        """
                        Compilation Error
                        =================

                        Error: Type mismatch in GreaterThan.left: expected Numeric, found Character

                        Location: Check.condition → GreaterThan.left

                        Token:
                        GreaterThan {
                          left: ActingCharacter
                          right: Number { value: 50 }
                        }

                        Suggestion: Use a token that produces Numeric here
                        """);
    }

    @Test
    void shouldOmitEmptySections() {
        String report =
                reporter.format(CompileError.of(new ErrorKind.NoConverter("Defend", Type.ACTION)));

        assertThat(report)
                .isEqualTo(
                        """
                        Compilation Error
                        =================

                        Error: No converter for Defend producing Action
                        """);
    }

    @Test
    void shouldListAvailableTokensForUndefinedToken() {
        String report =
                reporter.format(
                        CompileError.of(
                                new ErrorKind.UndefinedToken("Fireball"), Token.leaf("Fireball")));

        assertThat(report)
                .contains("Suggestion: Available tokens include:")
                .contains("  Actions: Strike, Heal, Check")
                .contains("  Conditions: TrueOrFalseRandom, GreaterThan, LessThan, Eq")
                .contains("  Context: Element");
    }

    @Test
    void shouldListImplementedTraitsForBoundErrors() {
        CompileError error =
                CompileError.of(
                        new ErrorKind.TraitBoundError(
                                Type.TEAM_SIDE, Traits.ORD, List.of(Traits.EQ, Traits.SHOW)));

        assertThat(reporter.format(error)).contains("Suggestion: TeamSide implements Eq, Show");
    }

    @Test
    void shouldSeparateBatchReports() {
        // Given
        CompileError first = mismatchInComparison();
        CompileError second = CompileError.of(new ErrorKind.CyclicReference("Check"));

        // When
        String report = reporter.formatAll(List.of(first, second));

        // Then
        assertThat(report).startsWith("Found 2 compilation error(s):\n\nCompilation Error\n");
        assertThat(report).contains("\n---\n\nCompilation Error\n");
        assertThat(report).endsWith("Suggestion: A token must not contain itself\n");
    }

    @Test
    void shouldReportNoErrorsForEmptyBatch() {
        assertThat(reporter.formatAll(List.of())).isEqualTo("No errors found.");
    }

    @Test
    void shouldRenderOneLineWithPath() {
        assertThat(reporter.formatOneLine(mismatchInComparison()))
                .isEqualTo(
                        "Type mismatch in GreaterThan.left: expected Numeric, found Character"
                                + " at Check.condition → GreaterThan.left");
        assertThat(reporter.formatOneLine(CompileError.of(new ErrorKind.UndefinedToken("X"))))
                .isEqualTo("Undefined token: X");
    }
}
