package io.gambit.core.runtime.node;

import io.gambit.core.runtime.EvaluationContext;
import io.gambit.core.runtime.EvaluationError;
import io.gambit.core.runtime.Node;
import io.gambit.core.runtime.RuleBreak;
import io.gambit.core.runtime.ValueType;

/// Compares two operands of the same type with that type's equivalence.
///
/// @param <T> operand type
public final class EqualityNode<T> implements Node<Boolean> {

    private final ValueType<T> operandType;
    private final Node<T> left;
    private final Node<T> right;

    public EqualityNode(ValueType<T> operandType, Node<T> left, Node<T> right) {
        this.operandType = operandType;
        this.left = left;
        this.right = right;
    }

    @Override
    public Boolean evaluate(EvaluationContext context) throws EvaluationError, RuleBreak {
        T leftValue = left.evaluate(context);
        return operandType.equivalent(leftValue, right.evaluate(context));
    }
}
