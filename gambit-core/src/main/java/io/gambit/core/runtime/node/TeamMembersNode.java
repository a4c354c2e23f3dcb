package io.gambit.core.runtime.node;

import io.gambit.core.battle.GameCharacter;
import io.gambit.core.battle.TeamSide;
import io.gambit.core.runtime.EvaluationContext;
import io.gambit.core.runtime.EvaluationError;
import io.gambit.core.runtime.Node;
import io.gambit.core.runtime.RuleBreak;
import java.util.List;

/// Members of one side, in roster order.
public final class TeamMembersNode implements Node<List<GameCharacter>> {

    private final Node<TeamSide> side;

    public TeamMembersNode(Node<TeamSide> side) {
        this.side = side;
    }

    @Override
    public List<GameCharacter> evaluate(EvaluationContext context)
            throws EvaluationError, RuleBreak {
        return context.getBattle().teamMembers(side.evaluate(context));
    }
}
