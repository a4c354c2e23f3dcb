package io.gambit.core.rule;

import io.gambit.core.checker.TypedAst;
import io.gambit.core.runtime.Action;
import io.gambit.core.runtime.Node;
import io.gambit.core.token.Token;
import java.util.Objects;

/// A rule that passed type checking and code generation.
///
/// Immutable; the node can be evaluated any number of times against different contexts.
///
/// @param token source token tree, not null
/// @param typedAst checked tree, not null
/// @param node evaluation node, not null
public record CompiledRule(Token token, TypedAst typedAst, Node<Action> node) {

    public CompiledRule {
        Objects.requireNonNull(token, "token");
        Objects.requireNonNull(typedAst, "typedAst");
        Objects.requireNonNull(node, "node");
    }
}
