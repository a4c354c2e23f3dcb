package io.gambit.core.runtime.node;

import io.gambit.core.runtime.EvaluationContext;
import io.gambit.core.runtime.EvaluationError;
import io.gambit.core.runtime.Node;
import io.gambit.core.runtime.ValueType;

/// Reads the element bound by the innermost `FilterList` or `Map`.
///
/// @param <T> expected element type
public final class ElementNode<T> implements Node<T> {

    private final ValueType<T> elementType;

    public ElementNode(ValueType<T> elementType) {
        this.elementType = elementType;
    }

    @Override
    public T evaluate(EvaluationContext context) throws EvaluationError {
        Object element =
                context.getCurrentElement()
                        .orElseThrow(() -> new EvaluationError("No current element in context"));
        return elementType.narrow(element);
    }
}
