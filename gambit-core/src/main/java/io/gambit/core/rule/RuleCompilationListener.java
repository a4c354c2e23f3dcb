package io.gambit.core.rule;

import io.gambit.core.error.CompileError;
import io.gambit.core.runtime.Action;
import io.gambit.core.runtime.RuleBreak;
import io.gambit.core.token.Token;

/// Listener for rule compilation and resolution events.
///
/// All methods have default no-op implementations, so listeners override only the events
/// they care about.
///
/// ### Callback Order
/// ```
/// onCompiled(rule) | onCompileFailed(token, error)   once per compiled token
/// onRuleBreak(index, break)                            per rule that breaks during a turn
/// onActionResolved(index, action)                      at most once per turn
/// ```
public interface RuleCompilationListener {

    /// Listener that ignores every event.
    RuleCompilationListener NOOP = new RuleCompilationListener() {};

    /// Called after a rule compiled.
    ///
    /// @param rule the compiled rule, not null
    default void onCompiled(CompiledRule rule) {}

    /// Called after a rule failed to compile.
    ///
    /// @param token the rule's token tree, not null
    /// @param error the error found, not null
    default void onCompileFailed(Token token, CompileError error) {}

    /// Called when a rule breaks and resolution moves on.
    ///
    /// @param index position of the rule in its list
    /// @param ruleBreak why the rule did not apply, not null
    default void onRuleBreak(int index, RuleBreak ruleBreak) {}

    /// Called when a rule produced the turn's action.
    ///
    /// @param index position of the rule in its list
    /// @param action the chosen action, not null
    default void onActionResolved(int index, Action action) {}
}
