package io.gambit.core.runtime.node;

import io.gambit.core.battle.GameCharacter;
import io.gambit.core.runtime.EvaluationContext;
import io.gambit.core.runtime.Node;
import java.util.List;

/// Every character in the battle, player side first.
public final class AllCharactersNode implements Node<List<GameCharacter>> {

    @Override
    public List<GameCharacter> evaluate(EvaluationContext context) {
        return context.getBattle().allCharacters();
    }
}
