package io.gambit.core.runtime.node;

import io.gambit.core.battle.GameCharacter;
import io.gambit.core.runtime.EvaluationContext;
import io.gambit.core.runtime.Node;

/// The character whose rules are being resolved.
public final class ActingCharacterNode implements Node<GameCharacter> {

    @Override
    public GameCharacter evaluate(EvaluationContext context) {
        return context.getBattle().actingCharacter();
    }
}
