package io.gambit.core.runtime.node;

import io.gambit.core.battle.CharacterHp;
import io.gambit.core.battle.GameCharacter;
import io.gambit.core.runtime.EvaluationContext;
import io.gambit.core.runtime.EvaluationError;
import io.gambit.core.runtime.Node;
import io.gambit.core.runtime.RuleBreak;

/// Returns the owner of an HP value.
public final class CharacterHpToCharacterNode implements Node<GameCharacter> {

    private final Node<CharacterHp> characterHp;

    public CharacterHpToCharacterNode(Node<CharacterHp> characterHp) {
        this.characterHp = characterHp;
    }

    @Override
    public GameCharacter evaluate(EvaluationContext context) throws EvaluationError, RuleBreak {
        return characterHp.evaluate(context).character();
    }
}
