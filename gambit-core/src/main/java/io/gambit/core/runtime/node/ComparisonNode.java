package io.gambit.core.runtime.node;

import io.gambit.core.runtime.EvaluationContext;
import io.gambit.core.runtime.EvaluationError;
import io.gambit.core.runtime.Node;
import io.gambit.core.runtime.RuleBreak;
import java.util.function.ToIntFunction;

/// Compares two numeric operands after projecting each to an integer.
///
/// Operands may have different representations, e.g. a `CharacterHP` against an `I32`
/// literal: each side carries its own projection. The left operand is evaluated first.
///
/// @param <L> left operand type
/// @param <R> right operand type
public final class ComparisonNode<L, R> implements Node<Boolean> {

    private final Comparison comparison;
    private final Node<L> left;
    private final ToIntFunction<L> leftProjection;
    private final Node<R> right;
    private final ToIntFunction<R> rightProjection;

    public ComparisonNode(
            Comparison comparison,
            Node<L> left,
            ToIntFunction<L> leftProjection,
            Node<R> right,
            ToIntFunction<R> rightProjection) {
        this.comparison = comparison;
        this.left = left;
        this.leftProjection = leftProjection;
        this.right = right;
        this.rightProjection = rightProjection;
    }

    @Override
    public Boolean evaluate(EvaluationContext context) throws EvaluationError, RuleBreak {
        int leftValue = leftProjection.applyAsInt(left.evaluate(context));
        int rightValue = rightProjection.applyAsInt(right.evaluate(context));
        return comparison.test(leftValue, rightValue);
    }
}
