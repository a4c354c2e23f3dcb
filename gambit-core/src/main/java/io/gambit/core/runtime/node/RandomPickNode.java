package io.gambit.core.runtime.node;

import io.gambit.core.runtime.EvaluationContext;
import io.gambit.core.runtime.EvaluationError;
import io.gambit.core.runtime.Node;
import io.gambit.core.runtime.RuleBreak;
import java.util.List;

/// Picks one element uniformly at random.
///
/// @param <T> element type
public final class RandomPickNode<T> implements Node<T> {

    private final Node<List<T>> array;

    public RandomPickNode(Node<List<T>> array) {
        this.array = array;
    }

    @Override
    public T evaluate(EvaluationContext context) throws EvaluationError, RuleBreak {
        List<T> source = array.evaluate(context);
        if (source.isEmpty()) {
            throw new EvaluationError("Cannot pick from an empty array");
        }
        return source.get(context.getRandom().nextInt(source.size()));
    }
}
