package io.gambit.core.runtime.node;

import io.gambit.core.battle.GameCharacter;
import io.gambit.core.battle.TeamSide;
import io.gambit.core.runtime.EvaluationContext;
import io.gambit.core.runtime.EvaluationError;
import io.gambit.core.runtime.Node;
import io.gambit.core.runtime.RuleBreak;

/// The side a character fights on.
public final class CharacterTeamNode implements Node<TeamSide> {

    private final Node<GameCharacter> character;

    public CharacterTeamNode(Node<GameCharacter> character) {
        this.character = character;
    }

    @Override
    public TeamSide evaluate(EvaluationContext context) throws EvaluationError, RuleBreak {
        GameCharacter value = character.evaluate(context);
        return context.getBattle()
                .sideOf(value.id())
                .orElseThrow(
                        () ->
                                new EvaluationError(
                                        "Character " + value.id() + " is on neither team"));
    }
}
