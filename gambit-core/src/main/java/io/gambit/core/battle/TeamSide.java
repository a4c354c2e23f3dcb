package io.gambit.core.battle;

/// The two sides of a battle.
public enum TeamSide {
    PLAYER,
    ENEMY;

    public TeamSide opposite() {
        return this == PLAYER ? ENEMY : PLAYER;
    }
}
