package io.gambit.core.battle;

import java.util.Comparator;
import java.util.Objects;

/// A character's HP value that keeps a reference to the character it belongs to.
///
/// Compared and ordered by {@link #value()} alone, so HP values of different characters with
/// the same HP are equivalent in comparisons.
///
/// @param character owner, not null
/// @param value HP at the time the value was taken
public record CharacterHp(GameCharacter character, int value) {

    /// Orders HP values by their numeric component.
    public static final Comparator<CharacterHp> BY_VALUE =
            Comparator.comparingInt(CharacterHp::value);

    public CharacterHp {
        Objects.requireNonNull(character, "character");
    }

    /// Returns whether two HP values are equal, ignoring their owners.
    public boolean sameValue(CharacterHp other) {
        return value == other.value;
    }
}
