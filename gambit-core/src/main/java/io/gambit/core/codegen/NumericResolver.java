package io.gambit.core.codegen;

import io.gambit.core.checker.TypedAst;
import io.gambit.core.token.TokenKind;
import io.gambit.core.type.Type;
import java.util.Optional;
import java.util.Set;

/// Chooses concrete representations for operands whose checked type is abstract.
///
/// In order of preference an operand takes:
/// 1. its own checked type, when concrete
/// 2. the concrete element type of the array it reduces (`Max`, `Min`, `NumericMax`,
///    `NumericMin`, `RandomPick`)
/// 3. the concrete type of its sibling operand
/// 4. `I32`
public final class NumericResolver {

    private static final Set<String> REDUCTIONS =
            Set.of(
                    TokenKind.MAX,
                    TokenKind.MIN,
                    TokenKind.NUMERIC_MAX,
                    TokenKind.NUMERIC_MIN,
                    TokenKind.RANDOM_PICK);

    /// Concrete types chosen for a pair of operands.
    public record OperandTypes(Type left, Type right) {}

    /// Resolves a single operand without sibling.
    ///
    /// @param operand typed operand, not null
    /// @return concrete type, never null
    public Type resolve(TypedAst operand) {
        return resolve(operand, null);
    }

    /// Resolves an operand, using a sibling type as a hint.
    ///
    /// @param operand typed operand, not null
    /// @param siblingHint type of the other operand, may be null or abstract
    /// @return concrete type, never null
    public Type resolve(TypedAst operand, Type siblingHint) {
        Optional<Type> known = knownType(operand);
        if (known.isPresent()) {
            return known.get();
        }
        Type hint = siblingHint != null && !siblingHint.isAbstract() ? siblingHint : null;
        return operand.type().resolveToConcrete(hint);
    }

    /// Resolves the operands of a binary operator, letting each side inform the other.
    ///
    /// @param left left operand, not null
    /// @param right right operand, not null
    /// @return concrete types of both sides, never null
    public OperandTypes resolvePair(TypedAst left, TypedAst right) {
        Type leftKnown = knownType(left).orElse(null);
        Type rightKnown = knownType(right).orElse(null);
        Type leftType = leftKnown != null ? leftKnown : left.type().resolveToConcrete(rightKnown);
        Type rightType =
                rightKnown != null ? rightKnown : right.type().resolveToConcrete(leftKnown);
        return new OperandTypes(leftType, rightType);
    }

    private static Optional<Type> knownType(TypedAst operand) {
        if (!operand.type().isAbstract()) {
            return Optional.of(operand.type());
        }
        if (REDUCTIONS.contains(operand.kind())) {
            return operand.child("array")
                    .flatMap(array -> array.type().elementType())
                    .filter(element -> !element.isAbstract());
        }
        return Optional.empty();
    }
}
