package io.gambit.core.checker.inference;

import io.gambit.core.type.Type;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/// A type that may contain type variables.
///
/// {@link Generic} applications use the constructors {@link #VEC} and {@link #OPTION} and are
/// interchangeable with the equivalent concrete {@link Type.Sequence} or {@link Type.Option}
/// once their arguments are concrete.
public sealed interface PolyType
        permits PolyType.Concrete, PolyType.Var, PolyType.Generic, PolyType.Function {

    String VEC = "Vec";
    String OPTION = "Option";

    static PolyType of(Type type) {
        return new Concrete(type);
    }

    static PolyType var(TypeVariable variable) {
        return new Var(variable);
    }

    static PolyType vec(PolyType element) {
        return new Generic(VEC, List.of(element));
    }

    static PolyType option(PolyType inner) {
        return new Generic(OPTION, List.of(inner));
    }

    static PolyType function(List<PolyType> parameters, PolyType result) {
        return new Function(parameters, result);
    }

    /// Returns the variables occurring in this type.
    ///
    /// @return variables in order of first occurrence, never null
    default Set<TypeVariable> freeVariables() {
        Set<TypeVariable> result = new LinkedHashSet<>();
        collectVariables(this, result);
        return result;
    }

    /// Converts to a concrete type if no variables remain.
    ///
    /// @return the concrete type, or empty while a variable is unresolved
    default Optional<Type> toType() {
        if (!freeVariables().isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(toTypeOrAny());
    }

    /// Converts to a concrete type, reading every unresolved variable as `Any`.
    ///
    /// @return concrete type, never null
    default Type toTypeOrAny() {
        if (this instanceof Concrete concrete) {
            return concrete.type();
        }
        if (this instanceof Generic generic) {
            Type argument = generic.arguments().get(0).toTypeOrAny();
            return VEC.equals(generic.constructor())
                    ? Type.sequenceOf(argument)
                    : Type.optionOf(argument);
        }
        return Type.ANY;
    }

    String displayName();

    private static void collectVariables(PolyType type, Set<TypeVariable> into) {
        if (type instanceof Var var) {
            into.add(var.variable());
        } else if (type instanceof Generic generic) {
            generic.arguments().forEach(argument -> collectVariables(argument, into));
        } else if (type instanceof Function function) {
            function.parameters().forEach(parameter -> collectVariables(parameter, into));
            collectVariables(function.result(), into);
        }
    }

    record Concrete(Type type) implements PolyType {
        public Concrete {
            Objects.requireNonNull(type, "type");
        }

        @Override
        public String displayName() {
            return type.displayName();
        }
    }

    record Var(TypeVariable variable) implements PolyType {
        public Var {
            Objects.requireNonNull(variable, "variable");
        }

        @Override
        public String displayName() {
            return variable.displayName();
        }
    }

    record Generic(String constructor, List<PolyType> arguments) implements PolyType {
        public Generic {
            if (!VEC.equals(constructor) && !OPTION.equals(constructor)) {
                throw new IllegalArgumentException("Unknown type constructor: " + constructor);
            }
            if (arguments.size() != 1) {
                throw new IllegalArgumentException(constructor + " takes exactly one argument");
            }
            arguments = List.copyOf(arguments);
        }

        @Override
        public String displayName() {
            return constructor
                    + arguments.stream()
                            .map(PolyType::displayName)
                            .collect(Collectors.joining(", ", "<", ">"));
        }
    }

    record Function(List<PolyType> parameters, PolyType result) implements PolyType {
        public Function {
            parameters = List.copyOf(parameters);
            Objects.requireNonNull(result, "result");
        }

        @Override
        public String displayName() {
            return parameters.stream()
                            .map(PolyType::displayName)
                            .collect(Collectors.joining(", ", "(", ")"))
                    + " -> "
                    + result.displayName();
        }
    }
}
