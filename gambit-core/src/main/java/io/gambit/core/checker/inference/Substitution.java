package io.gambit.core.checker.inference;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/// Bindings from type variables to types.
///
/// {@link #apply} follows chains of bindings, so a variable bound to another bound variable
/// resolves to the final type.
public final class Substitution {

    private final Map<TypeVariable, PolyType> bindings = new LinkedHashMap<>();

    public void bind(TypeVariable variable, PolyType type) {
        bindings.put(variable, type);
    }

    public Optional<PolyType> lookup(TypeVariable variable) {
        return Optional.ofNullable(bindings.get(variable));
    }

    public boolean isEmpty() {
        return bindings.isEmpty();
    }

    public int size() {
        return bindings.size();
    }

    public void clear() {
        bindings.clear();
    }

    /// Replaces every bound variable in the type.
    ///
    /// @param type type to rewrite, not null
    /// @return rewritten type, never null
    public PolyType apply(PolyType type) {
        if (type instanceof PolyType.Var var) {
            PolyType bound = bindings.get(var.variable());
            return bound == null ? type : apply(bound);
        }
        if (type instanceof PolyType.Generic generic) {
            List<PolyType> arguments = generic.arguments().stream().map(this::apply).toList();
            return new PolyType.Generic(generic.constructor(), arguments);
        }
        if (type instanceof PolyType.Function function) {
            List<PolyType> parameters = function.parameters().stream().map(this::apply).toList();
            return new PolyType.Function(parameters, apply(function.result()));
        }
        return type;
    }

    @Override
    public String toString() {
        return bindings.toString();
    }
}
