package io.gambit.core.checker.inference;

import java.util.Objects;

/// A pending equality between an expected and an actual type.
///
/// @param expected type the slot requires, not null
/// @param actual type the operand has, not null
/// @param origin slot description used in diagnostics, e.g. `GreaterThan.left`, not null
public record Constraint(PolyType expected, PolyType actual, String origin) {

    public Constraint {
        Objects.requireNonNull(expected, "expected");
        Objects.requireNonNull(actual, "actual");
        Objects.requireNonNull(origin, "origin");
    }
}
