package io.gambit.core.runtime;

/// The decision a rule produces, handed to the battle driver for execution.
public sealed interface Action permits Action.Strike, Action.Heal {

    /// Returns the id of the character the action is aimed at.
    int targetId();

    record Strike(int targetId) implements Action {}

    record Heal(int targetId) implements Action {}
}
