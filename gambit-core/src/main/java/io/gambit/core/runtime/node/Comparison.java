package io.gambit.core.runtime.node;

/// Relational operators over integers.
public enum Comparison {
    GREATER_THAN {
        @Override
        public boolean test(int left, int right) {
            return left > right;
        }
    },
    LESS_THAN {
        @Override
        public boolean test(int left, int right) {
            return left < right;
        }
    };

    public abstract boolean test(int left, int right);
}
