package io.gambit.core.error;

import java.util.Objects;

/// One step of an error location: an operand slot of an enclosing token.
///
/// @param tokenKind kind of the enclosing token, not null
/// @param argument operand slot name, not null
public record PathSegment(String tokenKind, String argument) {

    public PathSegment {
        Objects.requireNonNull(tokenKind, "tokenKind");
        Objects.requireNonNull(argument, "argument");
    }

    @Override
    public String toString() {
        return tokenKind + "." + argument;
    }
}
