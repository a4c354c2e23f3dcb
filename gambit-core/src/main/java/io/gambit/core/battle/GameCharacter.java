package io.gambit.core.battle;

import java.util.Objects;

/// A combatant as seen by the rule runtime.
///
/// Read-only snapshot; stat changes are applied by the battle driver, which hands the runtime a
/// fresh {@link BattleView} every turn.
///
/// @param id unique identifier within a battle
/// @param name display name, not null
/// @param hp current hit points
/// @param maxHp maximum hit points
/// @param mp current magic points
/// @param maxMp maximum magic points
/// @param attack attack power
public record GameCharacter(
        int id, String name, int hp, int maxHp, int mp, int maxMp, int attack) {

    public GameCharacter {
        Objects.requireNonNull(name, "name");
    }

    public boolean isAlive() {
        return hp > 0;
    }

    /// Returns the character's HP as a value that remembers its owner.
    public CharacterHp characterHp() {
        return new CharacterHp(this, hp);
    }
}
