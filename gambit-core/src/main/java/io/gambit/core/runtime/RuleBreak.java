package io.gambit.core.runtime;

import java.io.Serial;

/// Soft signal that a rule does not apply this turn.
///
/// Raised by guarded actions (dead acting character, not enough MP) and by a `Check` whose
/// condition is false. The rule driver moves on to the next rule.
public class RuleBreak extends Exception {
    @Serial private static final long serialVersionUID = -5418852007632911431L;

    public RuleBreak(String reason) {
        super(reason, null, false, false);
    }

    public String getReason() {
        return getMessage();
    }
}
