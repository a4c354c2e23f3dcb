package io.gambit.core.runtime;

import java.io.Serial;

/// A well-typed rule hit an impossible situation at runtime, such as reducing an empty list or
/// reading the current element outside a list combinator.
///
/// Signals a defect in the rule or the battle data; the rule driver propagates it.
public class EvaluationError extends Exception {
    @Serial private static final long serialVersionUID = 7031295447285019816L;

    public EvaluationError(String message) {
        super(message);
    }
}
