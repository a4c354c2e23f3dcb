package io.gambit.core;

/// Configuration options for a Gambit environment.
///
/// Controls the runtime costs and probabilities baked into compiled rules and how strictly the
/// checker treats token operands. Use the {@link Builder} for fluent configuration or construct
/// directly with setters. Out-of-range values are rejected when set.
///
/// ### Default Values
/// - `healCost`: `10` MP per heal
/// - `randomConditionProbability`: `0.5` for `TrueOrFalseRandom`
/// - `strictArguments`: `true`, operand slots a token kind does not declare are errors
///
/// @implNote **Not thread-safe**. Configure before passing to {@link GambitFactory}; compiled
/// rules capture the values at compile time.
///
/// @see GambitFactory#createEnvironment(GambitConfig)
public class GambitConfig {
    private int healCost = 10;
    private double randomConditionProbability = 0.5;
    private boolean strictArguments = true;

    /// Creates a configuration with default values.
    public GambitConfig() {}

    /// Returns the MP a heal costs the acting character.
    public int getHealCost() {
        return healCost;
    }

    /// Sets the MP a heal costs the acting character.
    ///
    /// @param healCost MP cost, not negative
    /// @throws IllegalArgumentException if `healCost` is negative
    public void setHealCost(int healCost) {
        if (healCost < 0) {
            throw new IllegalArgumentException("healCost cannot be negative: " + healCost);
        }
        this.healCost = healCost;
    }

    /// Returns the probability that `TrueOrFalseRandom` yields `true`.
    public double getRandomConditionProbability() {
        return randomConditionProbability;
    }

    /// Sets the probability that `TrueOrFalseRandom` yields `true`.
    ///
    /// @param randomConditionProbability probability within `[0, 1]`
    /// @throws IllegalArgumentException if the probability is outside `[0, 1]` or NaN
    public void setRandomConditionProbability(double randomConditionProbability) {
        if (!(randomConditionProbability >= 0.0 && randomConditionProbability <= 1.0)) {
            throw new IllegalArgumentException(
                    "randomConditionProbability must be within [0, 1]: "
                            + randomConditionProbability);
        }
        this.randomConditionProbability = randomConditionProbability;
    }

    /// Returns whether undeclared operand slots fail type checking.
    public boolean isStrictArguments() {
        return strictArguments;
    }

    /// Sets whether undeclared operand slots fail type checking.
    ///
    /// @param strictArguments `true` to report them as argument count mismatches, `false` to
    ///        ignore them
    public void setStrictArguments(boolean strictArguments) {
        this.strictArguments = strictArguments;
    }

    public static Builder builder() {
        return new Builder();
    }

    /// Fluent builder for {@link GambitConfig}.
    ///
    /// @implNote The builder mutates a single config instance and returns it on {@link #build()}.
    /// Values are validated as they are set, so a built config is always usable.
    public static class Builder {
        private final GambitConfig config = new GambitConfig();

        /// @throws IllegalArgumentException if `healCost` is negative
        public Builder healCost(int healCost) {
            config.setHealCost(healCost);
            return this;
        }

        /// @throws IllegalArgumentException if the probability is outside `[0, 1]`
        public Builder randomConditionProbability(double probability) {
            config.setRandomConditionProbability(probability);
            return this;
        }

        public Builder strictArguments(boolean strictArguments) {
            config.setStrictArguments(strictArguments);
            return this;
        }

        public GambitConfig build() {
            return config;
        }
    }
}
