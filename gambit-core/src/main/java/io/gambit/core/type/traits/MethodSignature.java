package io.gambit.core.type.traits;

import io.gambit.core.type.Type;
import java.util.List;
import java.util.Objects;

/// A method a trait requires of its implementors.
///
/// @param name method name, not null
/// @param parameters parameter types excluding the receiver, not null
/// @param returnType return type, not null
public record MethodSignature(String name, List<Type> parameters, Type returnType) {

    public MethodSignature {
        Objects.requireNonNull(name, "name");
        parameters = List.copyOf(parameters);
        Objects.requireNonNull(returnType, "returnType");
    }

    /// Creates a signature for a method without parameters.
    public static MethodSignature of(String name, Type returnType) {
        return new MethodSignature(name, List.of(), returnType);
    }

    @Override
    public String toString() {
        return name + "(" + parameters + ") -> " + returnType;
    }
}
