package io.gambit.core.checker.inference;

import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/// Immutable mapping from bound names to type schemes.
///
/// Rule trees bind no names today, so the checker always starts from {@link #empty()}.
public final class TypeEnvironment {

    private static final TypeEnvironment EMPTY = new TypeEnvironment(Map.of());

    private final Map<String, TypeScheme> bindings;

    private TypeEnvironment(Map<String, TypeScheme> bindings) {
        this.bindings = bindings;
    }

    public static TypeEnvironment empty() {
        return EMPTY;
    }

    /// Returns a copy with one more binding.
    ///
    /// @param name bound name, not null
    /// @param scheme its scheme, not null
    /// @return new environment, never null
    public TypeEnvironment extend(String name, TypeScheme scheme) {
        Map<String, TypeScheme> extended = new LinkedHashMap<>(bindings);
        extended.put(name, scheme);
        return new TypeEnvironment(Map.copyOf(extended));
    }

    public Optional<TypeScheme> lookup(String name) {
        return Optional.ofNullable(bindings.get(name));
    }

    /// Returns the variables free in any binding, i.e. not quantified by its scheme.
    public Set<TypeVariable> freeVariables(Substitution substitution) {
        Set<TypeVariable> free = new LinkedHashSet<>();
        for (TypeScheme scheme : bindings.values()) {
            Set<TypeVariable> variables = substitution.apply(scheme.type()).freeVariables();
            scheme.quantified().forEach(variables::remove);
            free.addAll(variables);
        }
        return free;
    }
}
