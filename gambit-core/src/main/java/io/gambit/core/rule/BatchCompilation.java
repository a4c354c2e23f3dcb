package io.gambit.core.rule;

import io.gambit.core.error.CompileError;
import io.gambit.core.error.ErrorReporter;
import java.util.ArrayList;
import java.util.List;

/// Result of compiling a list of rules.
///
/// Each rule fails fast, so a failed rule contributes exactly one error. The compiled rules
/// keep their relative order.
public final class BatchCompilation {

    /// A rule that failed to compile.
    ///
    /// @param index position of the rule in the input list
    /// @param error the first error found in that rule, not null
    public record Failure(int index, CompileError error) {}

    private final List<CompiledRule> rules;
    private final List<Failure> failures;

    public BatchCompilation(List<CompiledRule> rules, List<Failure> failures) {
        this.rules = List.copyOf(rules);
        this.failures = List.copyOf(failures);
    }

    /// Returns the rules that compiled, in input order.
    public List<CompiledRule> getRules() {
        return rules;
    }

    public List<Failure> getFailures() {
        return failures;
    }

    /// Returns the errors of the failed rules, in input order.
    public List<CompileError> getErrors() {
        List<CompileError> errors = new ArrayList<>(failures.size());
        for (Failure failure : failures) {
            errors.add(failure.error());
        }
        return errors;
    }

    public boolean isSuccessful() {
        return failures.isEmpty();
    }

    /// Renders all errors of the batch.
    ///
    /// @param reporter formatter to use, not null
    /// @return the report, `No errors found.` if every rule compiled
    public String report(ErrorReporter reporter) {
        return reporter.formatAll(getErrors());
    }
}
