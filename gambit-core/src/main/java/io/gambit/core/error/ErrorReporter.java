package io.gambit.core.error;

import io.gambit.core.metadata.TokenCategory;
import io.gambit.core.metadata.TokenMetadataRegistry;
import io.gambit.core.token.TokenKind;
import io.gambit.core.token.TokenPrinter;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/// Renders compile errors for people.
///
/// ```
/// Compilation Error
/// =================
///
/// Error: <message>
///
/// Location: Check.condition → GreaterThan.left
///
/// Token:
/// <pretty-printed token>
///
/// Suggestion: <hint>
/// ```
///
/// Sections without content (no path, no token, no hint) are left out.
public class ErrorReporter {

    static final String NO_ERRORS = "No errors found.";
    static final String SEPARATOR = "---";

    private final TokenMetadataRegistry metadata;

    /// @param metadata used to list known tokens in suggestions, not null
    public ErrorReporter(TokenMetadataRegistry metadata) {
        this.metadata = Objects.requireNonNull(metadata, "metadata");
    }

    /// Renders one error as a full report.
    ///
    /// @param error error to render, not null
    /// @return multi-line report, never null
    public String format(CompileError error) {
        StringBuilder report = new StringBuilder();
        report.append("Compilation Error\n");
        report.append("=================\n\n");
        report.append("Error: ").append(error.getMessage()).append('\n');
        String location = error.getLocation();
        if (!location.isEmpty()) {
            report.append("\nLocation: ").append(location).append('\n');
        }
        error.getToken()
                .ifPresent(
                        token ->
                                report.append("\nToken:\n")
                                        .append(TokenPrinter.pretty(token))
                                        .append('\n'));
        String suggestion = suggestion(error.getKind());
        if (suggestion != null) {
            report.append("\nSuggestion: ").append(suggestion).append('\n');
        }
        return report.toString();
    }

    /// Renders a list of errors, separated by `---`.
    ///
    /// @param errors errors to render, not null
    /// @return the report, or `No errors found.` for an empty list
    public String formatAll(List<CompileError> errors) {
        if (errors.isEmpty()) {
            return NO_ERRORS;
        }
        StringBuilder report = new StringBuilder();
        report.append("Found ").append(errors.size()).append(" compilation error(s):\n\n");
        for (int i = 0; i < errors.size(); i++) {
            if (i > 0) {
                report.append('\n').append(SEPARATOR).append("\n\n");
            }
            report.append(format(errors.get(i)));
        }
        return report.toString();
    }

    /// Renders an error on one line, `<message> at <path>`.
    public String formatOneLine(CompileError error) {
        return error.toString();
    }

    private String suggestion(ErrorKind kind) {
        if (kind instanceof ErrorKind.UndefinedToken) {
            return availableTokens();
        }
        if (kind instanceof ErrorKind.TypeMismatch mismatch) {
            return "Use a token that produces " + mismatch.expected() + " here";
        }
        if (kind instanceof ErrorKind.MissingField missing) {
            return "Add the '" + missing.field() + "' field to " + missing.token();
        }
        if (kind instanceof ErrorKind.UnresolvedType) {
            return "Element is only available inside FilterList.condition and Map.transform";
        }
        if (kind instanceof ErrorKind.TraitBoundError bound) {
            return bound.available().isEmpty()
                    ? bound.type() + " implements no traits"
                    : bound.type() + " implements " + String.join(", ", bound.available());
        }
        if (kind instanceof ErrorKind.CyclicReference) {
            return "A token must not contain itself";
        }
        if (kind instanceof ErrorKind.ArgumentCountMismatch mismatch) {
            return "Remove the operands " + mismatch.token() + " does not declare";
        }
        if (kind instanceof ErrorKind.InfiniteType) {
            return "Check that no operand is required to contain its own type";
        }
        return null;
    }

    private String availableTokens() {
        List<String> lines = new ArrayList<>();
        for (Map.Entry<TokenCategory, List<String>> entry : metadata.kindsByCategory().entrySet()) {
            lines.add(
                    "  " + entry.getKey().getLabel() + ": " + String.join(", ", entry.getValue()));
        }
        lines.add("  " + TokenCategory.CONTEXT.getLabel() + ": " + TokenKind.ELEMENT);
        return "Available tokens include:\n" + String.join("\n", lines);
    }
}
