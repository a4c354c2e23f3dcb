package io.gambit.core.runtime;

import io.gambit.core.battle.BattleView;
import java.util.Objects;
import java.util.Optional;
import java.util.random.RandomGenerator;

/// Everything a node may read while it evaluates.
///
/// ### Fields
/// - `battle`: read-only battle view, required
/// - `random`: the caller's random source, required; nodes draw from it in evaluation order
/// - `currentElement`: value bound by the innermost `FilterList` or `Map`, optional
///
/// @implNote Immutable apart from the random source it refers to. List combinators derive a
/// child with {@link #withCurrentElement}; the parent keeps its own binding, so the binding
/// ends with the subtree that introduced it.
public final class EvaluationContext {

    private final BattleView battle;
    private final RandomGenerator random;
    private final Object currentElement;

    private EvaluationContext(Builder builder) {
        this.battle = Objects.requireNonNull(builder.battle, "battle");
        this.random = Objects.requireNonNull(builder.random, "random");
        this.currentElement = builder.currentElement;
    }

    public BattleView getBattle() {
        return battle;
    }

    /// Returns the random source shared by every node of one evaluation.
    ///
    /// @return random source, never null
    public RandomGenerator getRandom() {
        return random;
    }

    /// Returns the value bound by the innermost enclosing list combinator.
    ///
    /// @return the element, or empty outside any combinator
    public Optional<Object> getCurrentElement() {
        return Optional.ofNullable(currentElement);
    }

    /// Creates a child context with a different element binding.
    ///
    /// @param element value to bind, not null
    /// @return new context sharing this battle view and random source, never null
    public EvaluationContext withCurrentElement(Object element) {
        return builder()
                .battle(battle)
                .random(random)
                .currentElement(Objects.requireNonNull(element, "element"))
                .build();
    }

    public static Builder builder() {
        return new Builder();
    }

    /// Creates a root context without element binding.
    ///
    /// @param battle battle view, not null
    /// @param random random source, not null
    /// @return new context, never null
    public static EvaluationContext of(BattleView battle, RandomGenerator random) {
        return builder().battle(battle).random(random).build();
    }

    /// Builder for {@link EvaluationContext}.
    public static final class Builder {
        private BattleView battle;
        private RandomGenerator random;
        private Object currentElement;

        private Builder() {}

        public Builder battle(BattleView battle) {
            this.battle = battle;
            return this;
        }

        public Builder random(RandomGenerator random) {
            this.random = random;
            return this;
        }

        public Builder currentElement(Object currentElement) {
            this.currentElement = currentElement;
            return this;
        }

        public EvaluationContext build() {
            return new EvaluationContext(this);
        }
    }
}
