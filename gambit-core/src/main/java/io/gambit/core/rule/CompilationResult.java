package io.gambit.core.rule;

import io.gambit.core.error.CompileError;
import java.util.Objects;

/// Outcome of compiling one rule: either a {@link CompiledRule} or a {@link CompileError}.
///
/// ### Factory Methods
/// - {@link #success(CompiledRule)} for a rule that compiled
/// - {@link #failure(CompileError)} for a rule that did not
public final class CompilationResult {

    private final CompiledRule rule;
    private final CompileError error;

    private CompilationResult(CompiledRule rule, CompileError error) {
        this.rule = rule;
        this.error = error;
    }

    /// Creates a success result.
    ///
    /// @param rule compiled rule, not null
    /// @return new success result, never null
    public static CompilationResult success(CompiledRule rule) {
        return new CompilationResult(Objects.requireNonNull(rule, "rule"), null);
    }

    /// Creates a failure result.
    ///
    /// @param error the first error found, not null
    /// @return new failure result, never null
    public static CompilationResult failure(CompileError error) {
        return new CompilationResult(null, Objects.requireNonNull(error, "error"));
    }

    public boolean isSuccess() {
        return rule != null;
    }

    /// Returns the compiled rule.
    ///
    /// @return the rule, never null
    /// @throws IllegalStateException if compilation failed
    public CompiledRule getRule() {
        if (rule == null) {
            throw new IllegalStateException("Compilation failed: " + error);
        }
        return rule;
    }

    /// Returns the compile error.
    ///
    /// @return the error, never null
    /// @throws IllegalStateException if compilation succeeded
    public CompileError getError() {
        if (error == null) {
            throw new IllegalStateException("Compilation succeeded");
        }
        return error;
    }

    @Override
    public String toString() {
        return isSuccess() ? "CompilationResult[success]" : "CompilationResult[" + error + "]";
    }
}
