package io.gambit.core.runtime.node;

import io.gambit.core.runtime.EvaluationContext;
import io.gambit.core.runtime.EvaluationError;
import io.gambit.core.runtime.Node;
import io.gambit.core.runtime.RuleBreak;
import java.util.ArrayList;
import java.util.List;

/// Applies the transform to every element, with that element bound as the current element.
///
/// @param <I> source element type
/// @param <O> result element type
public final class MapNode<I, O> implements Node<List<O>> {

    private final Node<List<I>> array;
    private final Node<O> transform;

    public MapNode(Node<List<I>> array, Node<O> transform) {
        this.array = array;
        this.transform = transform;
    }

    @Override
    public List<O> evaluate(EvaluationContext context) throws EvaluationError, RuleBreak {
        List<I> source = array.evaluate(context);
        List<O> mapped = new ArrayList<>(source.size());
        for (I element : source) {
            mapped.add(transform.evaluate(context.withCurrentElement(element)));
        }
        return List.copyOf(mapped);
    }
}
