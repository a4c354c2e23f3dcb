package io.gambit.core.runtime.node;

import io.gambit.core.runtime.EvaluationContext;
import io.gambit.core.runtime.EvaluationError;
import io.gambit.core.runtime.Node;
import io.gambit.core.runtime.RuleBreak;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;

/// Largest or smallest element. On ties the first occurrence wins.
///
/// @param <T> element type
public final class ExtremumNode<T> implements Node<T> {

    /// Which end of the order to take.
    public enum Direction {
        MAX,
        MIN
    }

    private final Direction direction;
    private final Node<List<T>> array;
    private final Comparator<T> order;

    public ExtremumNode(Direction direction, Node<List<T>> array, Comparator<T> order) {
        this.direction = direction;
        this.array = array;
        this.order = order;
    }

    @Override
    public T evaluate(EvaluationContext context) throws EvaluationError, RuleBreak {
        List<T> source = array.evaluate(context);
        if (source.isEmpty()) {
            String name = direction.name().toLowerCase(Locale.ROOT);
            throw new EvaluationError("Cannot take " + name + " of an empty array");
        }
        T best = source.get(0);
        for (int i = 1; i < source.size(); i++) {
            T candidate = source.get(i);
            int comparison = order.compare(candidate, best);
            if (direction == Direction.MAX ? comparison > 0 : comparison < 0) {
                best = candidate;
            }
        }
        return best;
    }
}
