package io.gambit.core.runtime.node;

import io.gambit.core.battle.GameCharacter;
import io.gambit.core.runtime.Action;
import io.gambit.core.runtime.EvaluationContext;
import io.gambit.core.runtime.EvaluationError;
import io.gambit.core.runtime.Node;
import io.gambit.core.runtime.RuleBreak;

/// Attacks the target. Breaks when the acting character is dead; the target is not evaluated
/// in that case.
public final class StrikeNode implements Node<Action> {

    private final Node<GameCharacter> target;

    public StrikeNode(Node<GameCharacter> target) {
        this.target = target;
    }

    @Override
    public Action evaluate(EvaluationContext context) throws EvaluationError, RuleBreak {
        GameCharacter acting = context.getBattle().actingCharacter();
        if (!acting.isAlive()) {
            throw new RuleBreak(acting.name() + " cannot strike: not alive");
        }
        return new Action.Strike(target.evaluate(context).id());
    }
}
