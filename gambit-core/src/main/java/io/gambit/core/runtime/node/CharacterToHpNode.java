package io.gambit.core.runtime.node;

import io.gambit.core.battle.CharacterHp;
import io.gambit.core.battle.GameCharacter;
import io.gambit.core.runtime.EvaluationContext;
import io.gambit.core.runtime.EvaluationError;
import io.gambit.core.runtime.Node;
import io.gambit.core.runtime.RuleBreak;

/// Takes a character's HP, keeping the character as its owner.
public final class CharacterToHpNode implements Node<CharacterHp> {

    private final Node<GameCharacter> character;

    public CharacterToHpNode(Node<GameCharacter> character) {
        this.character = character;
    }

    @Override
    public CharacterHp evaluate(EvaluationContext context) throws EvaluationError, RuleBreak {
        return character.evaluate(context).characterHp();
    }
}
