package io.gambit.core.type.traits;

import java.util.List;
import java.util.Objects;

/// Declares an abstract capability.
///
/// @param name trait name, not null
/// @param typeParameters generic parameters, e.g. `T` for `Collection<T>`, not null
/// @param methods required methods, not null
/// @param supertraits traits every implementor must also satisfy, not null
public record TraitDefinition(
        String name,
        List<String> typeParameters,
        List<MethodSignature> methods,
        List<String> supertraits) {

    public TraitDefinition {
        Objects.requireNonNull(name, "name");
        typeParameters = List.copyOf(typeParameters);
        methods = List.copyOf(methods);
        supertraits = List.copyOf(supertraits);
    }

    /// Creates a trait without type parameters or supertraits.
    public static TraitDefinition of(String name, MethodSignature... methods) {
        return new TraitDefinition(name, List.of(), List.of(methods), List.of());
    }
}
