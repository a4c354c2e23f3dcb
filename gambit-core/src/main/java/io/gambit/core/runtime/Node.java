package io.gambit.core.runtime;

/// A compiled, executable piece of a rule producing a value of type `T`.
///
/// Nodes are immutable and keep no per-call state, so one compiled tree is evaluated once per
/// turn for the whole battle. The only side effect allowed is drawing from the context's
/// random source.
///
/// @param <T> Java representation of the node's output, see {@link ValueType}
@FunctionalInterface
public interface Node<T> {

    /// Evaluates the node.
    ///
    /// @param context battle view, random source and element binding, not null
    /// @return the value, never null
    /// @throws EvaluationError if evaluation is impossible
    /// @throws RuleBreak if a guarded action does not apply
    T evaluate(EvaluationContext context) throws EvaluationError, RuleBreak;
}
