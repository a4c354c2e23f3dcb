package io.gambit.core.type.traits;

import io.gambit.core.type.Type;
import java.util.Objects;

/// States that a type implements a trait.
///
/// A collection type whose element is `Any` stands for every instantiation of that collection,
/// so `Vec<Any>` implementing `Collection` covers `Vec<I32>`, `Vec<Character>` and so on.
///
/// @param traitName implemented trait, not null
/// @param forType implementing type, not null
public record TraitImplementation(String traitName, Type forType) {

    public TraitImplementation {
        Objects.requireNonNull(traitName, "traitName");
        Objects.requireNonNull(forType, "forType");
    }

    /// Checks whether this implementation applies to the given type.
    ///
    /// @param type candidate type, not null
    /// @return `true` if `type` is covered by this implementation
    public boolean appliesTo(Type type) {
        if (forType.equals(type)) {
            return true;
        }
        if (forType instanceof Type.Sequence pattern && type instanceof Type.Sequence) {
            return pattern.element() == Type.ANY;
        }
        if (forType instanceof Type.Option pattern && type instanceof Type.Option) {
            return pattern.inner() == Type.ANY;
        }
        return false;
    }
}
