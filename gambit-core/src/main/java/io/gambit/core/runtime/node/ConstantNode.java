package io.gambit.core.runtime.node;

import io.gambit.core.runtime.EvaluationContext;
import io.gambit.core.runtime.Node;
import java.util.Objects;

/// Always yields the same value.
///
/// @param <T> value type
public final class ConstantNode<T> implements Node<T> {

    private final T value;

    public ConstantNode(T value) {
        this.value = Objects.requireNonNull(value, "value");
    }

    @Override
    public T evaluate(EvaluationContext context) {
        return value;
    }

    @Override
    public String toString() {
        return "Constant(" + value + ")";
    }
}
