package io.gambit.core.runtime.node;

import io.gambit.core.runtime.EvaluationContext;
import io.gambit.core.runtime.Node;

/// True with a fixed probability; draws one double from the context's random source.
public final class RandomConditionNode implements Node<Boolean> {

    private final double probability;

    /// @param probability chance of `true`, between 0 and 1
    public RandomConditionNode(double probability) {
        if (probability < 0.0 || probability > 1.0) {
            throw new IllegalArgumentException("probability must be within [0, 1]: " + probability);
        }
        this.probability = probability;
    }

    @Override
    public Boolean evaluate(EvaluationContext context) {
        return context.getRandom().nextDouble() < probability;
    }
}
