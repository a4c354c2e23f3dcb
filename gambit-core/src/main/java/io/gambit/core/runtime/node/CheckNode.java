package io.gambit.core.runtime.node;

import io.gambit.core.runtime.Action;
import io.gambit.core.runtime.EvaluationContext;
import io.gambit.core.runtime.EvaluationError;
import io.gambit.core.runtime.Node;
import io.gambit.core.runtime.RuleBreak;

/// Runs the action when the condition holds and breaks otherwise.
public final class CheckNode implements Node<Action> {

    private final Node<Boolean> condition;
    private final Node<Action> thenAction;

    public CheckNode(Node<Boolean> condition, Node<Action> thenAction) {
        this.condition = condition;
        this.thenAction = thenAction;
    }

    @Override
    public Action evaluate(EvaluationContext context) throws EvaluationError, RuleBreak {
        if (!condition.evaluate(context)) {
            throw new RuleBreak("condition not met");
        }
        return thenAction.evaluate(context);
    }
}
