package io.gambit.core.metadata;

import io.gambit.core.checker.inference.PolyType;
import io.gambit.core.type.Type;
import java.util.List;
import java.util.Objects;

/// Declares one operand slot of a token kind.
///
/// @param name slot name as it appears in rule files, not null
/// @param type expected type, possibly over the signature's type parameters, not null
/// @param required whether the slot must be present
/// @param requiredTraits traits the operand's type must implement, not null
/// @param boundsOnElements whether `requiredTraits` apply to the operand's element type
///        instead of the operand's own type
public record ArgumentSpec(
        String name,
        PolyType type,
        boolean required,
        List<String> requiredTraits,
        boolean boundsOnElements) {

    public ArgumentSpec {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(type, "type");
        requiredTraits = List.copyOf(requiredTraits);
    }

    /// Creates a required slot without trait bounds.
    public static ArgumentSpec of(String name, PolyType type) {
        return new ArgumentSpec(name, type, true, List.of(), false);
    }

    /// Creates a required slot of a concrete type.
    public static ArgumentSpec of(String name, Type type) {
        return of(name, PolyType.of(type));
    }

    /// Returns a copy requiring the operand to implement the given traits.
    public ArgumentSpec requiring(String... traits) {
        return new ArgumentSpec(name, type, required, List.of(traits), boundsOnElements);
    }

    /// Returns a copy whose trait bounds apply to the operand's elements.
    public ArgumentSpec onElements() {
        return new ArgumentSpec(name, type, required, requiredTraits, true);
    }

    /// Returns a copy that may be left out.
    public ArgumentSpec optional() {
        return new ArgumentSpec(name, type, false, requiredTraits, boundsOnElements);
    }
}
