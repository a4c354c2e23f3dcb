package io.gambit.core.runtime.node;

import io.gambit.core.battle.GameCharacter;
import io.gambit.core.runtime.Action;
import io.gambit.core.runtime.EvaluationContext;
import io.gambit.core.runtime.EvaluationError;
import io.gambit.core.runtime.Node;
import io.gambit.core.runtime.RuleBreak;

/// Heals the target. Breaks when the acting character is dead or has less MP than the cost.
public final class HealNode implements Node<Action> {

    private final Node<GameCharacter> target;
    private final int mpCost;

    /// @param target node choosing whom to heal, not null
    /// @param mpCost MP the acting character needs to cast, not negative
    public HealNode(Node<GameCharacter> target, int mpCost) {
        if (mpCost < 0) {
            throw new IllegalArgumentException("mpCost cannot be negative: " + mpCost);
        }
        this.target = target;
        this.mpCost = mpCost;
    }

    @Override
    public Action evaluate(EvaluationContext context) throws EvaluationError, RuleBreak {
        GameCharacter acting = context.getBattle().actingCharacter();
        if (!acting.isAlive()) {
            throw new RuleBreak(acting.name() + " cannot heal: not alive");
        }
        if (acting.mp() < mpCost) {
            throw new RuleBreak(
                    acting.name() + " cannot heal: " + acting.mp() + " MP, needs " + mpCost);
        }
        return new Action.Heal(target.evaluate(context).id());
    }
}
