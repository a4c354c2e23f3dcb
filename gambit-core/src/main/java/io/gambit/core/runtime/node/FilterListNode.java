package io.gambit.core.runtime.node;

import io.gambit.core.runtime.EvaluationContext;
import io.gambit.core.runtime.EvaluationError;
import io.gambit.core.runtime.Node;
import io.gambit.core.runtime.RuleBreak;
import java.util.ArrayList;
import java.util.List;

/// Keeps the elements for which the condition holds, in source order.
///
/// The source is evaluated once; the condition is evaluated per element with that element bound
/// as the current element.
///
/// @param <T> element type
public final class FilterListNode<T> implements Node<List<T>> {

    private final Node<List<T>> array;
    private final Node<Boolean> condition;

    public FilterListNode(Node<List<T>> array, Node<Boolean> condition) {
        this.array = array;
        this.condition = condition;
    }

    @Override
    public List<T> evaluate(EvaluationContext context) throws EvaluationError, RuleBreak {
        List<T> source = array.evaluate(context);
        List<T> kept = new ArrayList<>();
        for (T element : source) {
            if (condition.evaluate(context.withCurrentElement(element))) {
                kept.add(element);
            }
        }
        return List.copyOf(kept);
    }
}
