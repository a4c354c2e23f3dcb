package io.gambit.core.checker.inference;

/// A placeholder for a type the engine has yet to determine.
///
/// Engine variables have non-negative ids. Signature parameters declared in token metadata use
/// negative ids so they never collide with variables the engine hands out.
///
/// @param id identity of the variable
/// @param name display name, may be null
public record TypeVariable(int id, String name) {

    /// Creates a variable for a quantified signature parameter.
    ///
    /// @param index position of the parameter in its signature, from 0
    /// @param name parameter name, e.g. `a`, not null
    /// @return the parameter variable, never null
    public static TypeVariable parameter(int index, String name) {
        return new TypeVariable(-(index + 1), name);
    }

    public String displayName() {
        return name != null ? name : "t" + id;
    }

    @Override
    public String toString() {
        return displayName();
    }
}
