package io.gambit.core.runtime.node;

import io.gambit.core.runtime.EvaluationContext;
import io.gambit.core.runtime.EvaluationError;
import io.gambit.core.runtime.Node;
import io.gambit.core.runtime.RuleBreak;
import java.util.List;

/// Number of elements.
///
/// @param <T> element type
public final class CountNode<T> implements Node<Integer> {

    private final Node<List<T>> array;

    public CountNode(Node<List<T>> array) {
        this.array = array;
    }

    @Override
    public Integer evaluate(EvaluationContext context) throws EvaluationError, RuleBreak {
        return array.evaluate(context).size();
    }
}
