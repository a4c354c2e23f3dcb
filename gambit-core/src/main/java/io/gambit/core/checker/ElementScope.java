package io.gambit.core.checker;

import io.gambit.core.type.Type;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Optional;

/// Stack of element types bound by enclosing list combinators during a check pass.
///
/// The checker pushes when it enters an operand that sees an element binding and pops when
/// that operand has been checked, so `Element` always resolves to the innermost binding.
final class ElementScope {

    private final Deque<Type> bindings = new ArrayDeque<>();

    void push(Type elementType) {
        bindings.push(elementType);
    }

    void pop() {
        if (bindings.isEmpty()) {
            throw new IllegalStateException("No element binding to pop");
        }
        bindings.pop();
    }

    Optional<Type> current() {
        return Optional.ofNullable(bindings.peek());
    }

    int depth() {
        return bindings.size();
    }
}
