package io.gambit.core.rule;

import io.gambit.core.runtime.Action;
import io.gambit.core.runtime.EvaluationContext;
import io.gambit.core.runtime.EvaluationError;
import io.gambit.core.runtime.RuleBreak;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.logging.Logger;

/// Picks the action of one turn from an ordered rule list.
///
/// Rules are tried in order. The first rule that produces an action wins and no later rule
/// runs. A rule that breaks is skipped; randomness it consumed stays consumed.
///
/// ### Outcomes
/// - an action: the first rule that did not break
/// - empty: the list is empty or every rule broke
/// - {@link EvaluationError}: a rule hit a hard runtime failure
public class RuleResolver {

    private static final Logger logger = Logger.getLogger(RuleResolver.class.getName());

    private final RuleCompilationListener listener;

    public RuleResolver() {
        this(RuleCompilationListener.NOOP);
    }

    public RuleResolver(RuleCompilationListener listener) {
        this.listener = Objects.requireNonNull(listener, "listener");
    }

    /// Resolves one turn.
    ///
    /// @param rules compiled rules in priority order, not null
    /// @param context battle view and random source of this turn, not null
    /// @return the chosen action, or empty for no action
    /// @throws EvaluationError if a rule fails hard
    public Optional<Action> resolve(List<CompiledRule> rules, EvaluationContext context)
            throws EvaluationError {
        Objects.requireNonNull(rules, "rules");
        Objects.requireNonNull(context, "context");
        for (int i = 0; i < rules.size(); i++) {
            try {
                Action action = rules.get(i).node().evaluate(context);
                listener.onActionResolved(i, action);
                return Optional.of(action);
            } catch (RuleBreak ruleBreak) {
                logger.fine("Rule " + i + " skipped: " + ruleBreak.getReason());
                listener.onRuleBreak(i, ruleBreak);
            }
        }
        logger.info(
                "No action for character "
                        + context.getBattle().actingCharacter().id()
                        + " after "
                        + rules.size()
                        + " rule(s)");
        return Optional.empty();
    }
}
