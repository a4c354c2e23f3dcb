package io.gambit.core.checker;

import io.gambit.core.token.Token;
import io.gambit.core.type.Type;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/// A token annotated with its checked type and its checked operands.
///
/// Built bottom-up by the {@link TypeChecker}, consumed top-down by the code generator and
/// discarded once the rule is compiled.
///
/// @param token the checked token, not null
/// @param type its output type, not null
/// @param children checked operands keyed by slot name, in checking order, not null
public record TypedAst(Token token, Type type, Map<String, TypedAst> children) {

    public TypedAst {
        Objects.requireNonNull(token, "token");
        Objects.requireNonNull(type, "type");
        children = Collections.unmodifiableMap(new LinkedHashMap<>(children));
    }

    /// Creates a node without operands.
    public static TypedAst leaf(Token token, Type type) {
        return new TypedAst(token, type, Map.of());
    }

    public String kind() {
        return token.getKind();
    }

    public Optional<TypedAst> child(String name) {
        return Optional.ofNullable(children.get(name));
    }
}
