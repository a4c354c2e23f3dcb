package io.gambit.core.checker.inference;

import io.gambit.core.error.CompileException;
import io.gambit.core.error.ErrorKind;
import io.gambit.core.type.Type;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/// Unification engine backing the type checker.
///
/// Hands out fresh {@link TypeVariable}s, collects {@link Constraint}s and solves them in one
/// pass with an occurs check. Concrete types unify when they are compatible in the sense of
/// {@link Type#isCompatibleWith(Type)}, so `Numeric` unifies with `I32` and `CharacterHP`
/// without binding anything.
///
/// ### Contracts
/// - A failed unification throws {@link CompileException} carrying
///   {@link ErrorKind.TypeMismatch} or {@link ErrorKind.InfiniteType}
/// - Bindings made before a failure are kept; callers abandon the engine after an error
///
/// @implNote Not thread-safe. One engine serves one check pass and is discarded afterwards.
public class InferenceEngine {

    private final Substitution substitution = new Substitution();
    private final List<Constraint> pending = new ArrayList<>();
    private int nextVariableId;

    /// Creates a variable no other part of this pass uses.
    ///
    /// @return fresh variable, never null
    public TypeVariable freshVariable() {
        return new TypeVariable(nextVariableId++, null);
    }

    /// Shorthand for {@code PolyType.var(freshVariable())}.
    public PolyType freshType() {
        return PolyType.var(freshVariable());
    }

    /// Records an equality to be solved by the next {@link #solve()}.
    ///
    /// @param expected type the slot requires, not null
    /// @param actual type the operand has, not null
    /// @param origin slot description for diagnostics, not null
    public void addConstraint(PolyType expected, PolyType actual, String origin) {
        pending.add(new Constraint(expected, actual, origin));
    }

    /// Returns the number of constraints awaiting {@link #solve()}.
    public int pendingConstraints() {
        return pending.size();
    }

    /// Unifies all pending constraints in the order they were added and clears the list.
    ///
    /// @throws CompileException on the first constraint that cannot be satisfied
    public void solve() throws CompileException {
        List<Constraint> batch = new ArrayList<>(pending);
        pending.clear();
        for (Constraint constraint : batch) {
            unify(constraint.expected(), constraint.actual(), constraint.origin());
        }
    }

    /// Unifies two types immediately.
    ///
    /// @param expected type the slot requires, not null
    /// @param actual type the operand has, not null
    /// @param origin slot description for diagnostics, not null
    /// @throws CompileException if the types cannot be made equal
    public void unify(PolyType expected, PolyType actual, String origin) throws CompileException {
        if (!unifyStructure(expected, actual)) {
            throw new CompileException(
                    new ErrorKind.TypeMismatch(
                            apply(expected).toTypeOrAny(), apply(actual).toTypeOrAny(), origin));
        }
    }

    /// Applies the current substitution.
    ///
    /// @param type type to rewrite, not null
    /// @return rewritten type, never null
    public PolyType apply(PolyType type) {
        return substitution.apply(type);
    }

    /// Replaces the quantified variables of a scheme with fresh ones.
    ///
    /// @param scheme scheme to instantiate, not null
    /// @return the scheme's body over fresh variables, never null
    public PolyType instantiate(TypeScheme scheme) {
        if (scheme.quantified().isEmpty()) {
            return scheme.type();
        }
        Substitution fresh = new Substitution();
        for (TypeVariable variable : scheme.quantified()) {
            fresh.bind(variable, freshType());
        }
        return fresh.apply(scheme.type());
    }

    /// Quantifies the variables of a type that are not free in the environment.
    ///
    /// @param type type to generalize, not null
    /// @param environment names in scope, not null
    /// @return the generalized scheme, never null
    public TypeScheme generalize(PolyType type, TypeEnvironment environment) {
        PolyType applied = apply(type);
        Set<TypeVariable> variables = applied.freeVariables();
        variables.removeAll(environment.freeVariables(substitution));
        return new TypeScheme(List.copyOf(variables), applied);
    }

    /// Returns a snapshot of the current bindings.
    public Map<TypeVariable, PolyType> bindings() {
        Map<TypeVariable, PolyType> snapshot = new HashMap<>();
        for (int id = 0; id < nextVariableId; id++) {
            TypeVariable variable = new TypeVariable(id, null);
            substitution.lookup(variable).ifPresent(bound -> snapshot.put(variable, apply(bound)));
        }
        return snapshot;
    }

    /// Discards all variables, bindings and pending constraints.
    public void reset() {
        substitution.clear();
        pending.clear();
        nextVariableId = 0;
    }

    private boolean unifyStructure(PolyType left, PolyType right) throws CompileException {
        PolyType a = apply(left);
        PolyType b = apply(right);
        if (a.equals(b)) {
            return true;
        }
        if (a instanceof PolyType.Var var) {
            bind(var.variable(), b);
            return true;
        }
        if (b instanceof PolyType.Var var) {
            bind(var.variable(), a);
            return true;
        }
        if (a instanceof PolyType.Concrete ca && b instanceof PolyType.Concrete cb) {
            return ca.type().isCompatibleWith(cb.type());
        }
        if (isAny(a) || isAny(b)) {
            return true;
        }
        PolyType liftedA = lift(a);
        PolyType liftedB = lift(b);
        if (liftedA instanceof PolyType.Generic ga && liftedB instanceof PolyType.Generic gb) {
            if (!ga.constructor().equals(gb.constructor())) {
                return false;
            }
            for (int i = 0; i < ga.arguments().size(); i++) {
                if (!unifyStructure(ga.arguments().get(i), gb.arguments().get(i))) {
                    return false;
                }
            }
            return true;
        }
        if (a instanceof PolyType.Function fa && b instanceof PolyType.Function fb) {
            if (fa.parameters().size() != fb.parameters().size()) {
                return false;
            }
            for (int i = 0; i < fa.parameters().size(); i++) {
                if (!unifyStructure(fa.parameters().get(i), fb.parameters().get(i))) {
                    return false;
                }
            }
            return unifyStructure(fa.result(), fb.result());
        }
        return false;
    }

    private void bind(TypeVariable variable, PolyType type) throws CompileException {
        if (type instanceof PolyType.Var other && other.variable().equals(variable)) {
            return;
        }
        if (type.freeVariables().contains(variable)) {
            throw new CompileException(
                    new ErrorKind.InfiniteType(variable.displayName(), type.displayName()));
        }
        substitution.bind(variable, type);
    }

    private static boolean isAny(PolyType type) {
        return type instanceof PolyType.Concrete concrete && concrete.type() == Type.ANY;
    }

    private static PolyType lift(PolyType type) {
        if (type instanceof PolyType.Concrete concrete) {
            if (concrete.type() instanceof Type.Sequence sequence) {
                return PolyType.vec(PolyType.of(sequence.element()));
            }
            if (concrete.type() instanceof Type.Option option) {
                return PolyType.option(PolyType.of(option.inner()));
            }
        }
        return type;
    }
}
