package io.gambit.core.checker.inference;

import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/// A type quantified over some of its variables: `forall a b. type`.
///
/// @param quantified variables replaced by fresh ones on each instantiation, not null
/// @param type the body, not null
public record TypeScheme(List<TypeVariable> quantified, PolyType type) {

    public TypeScheme {
        quantified = List.copyOf(quantified);
        Objects.requireNonNull(type, "type");
    }

    /// Wraps a type without quantifying anything.
    public static TypeScheme monomorphic(PolyType type) {
        return new TypeScheme(List.of(), type);
    }

    @Override
    public String toString() {
        if (quantified.isEmpty()) {
            return type.displayName();
        }
        return quantified.stream()
                        .map(TypeVariable::displayName)
                        .collect(Collectors.joining(" ", "forall ", ". "))
                + type.displayName();
    }
}
