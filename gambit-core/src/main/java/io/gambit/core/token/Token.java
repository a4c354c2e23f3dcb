package io.gambit.core.token;

import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/// A node of the raw, untyped rule tree.
///
/// A token has a kind (e.g. `Strike`, `FilterList`), named operand slots holding child tokens
/// and inline literal attributes such as `Number.value`. Tokens are built once per rule and
/// shared read-only by the checker and the generator.
///
/// @implNote The operand map passed to the constructor is wrapped, not copied. Callers must not
/// modify it afterwards; a tree made cyclic that way is rejected by the type checker.
///
/// @see Tokens for factory methods
/// @see TokenKind for the built-in kinds
public final class Token {

    private final String kind;
    private final Map<String, Token> arguments;
    private final Map<String, Object> attributes;

    /// Creates a token.
    ///
    /// @param kind token kind, not null or blank
    /// @param arguments named child tokens in declaration order, not null
    /// @param attributes inline literals, not null
    public Token(String kind, Map<String, Token> arguments, Map<String, Object> attributes) {
        if (kind == null || kind.isBlank()) {
            throw new IllegalArgumentException("kind cannot be null or blank");
        }
        this.kind = kind;
        this.arguments = Collections.unmodifiableMap(Objects.requireNonNull(arguments));
        this.attributes = Collections.unmodifiableMap(new LinkedHashMap<>(attributes));
    }

    /// Creates a token without operands or literals.
    public static Token leaf(String kind) {
        return new Token(kind, Map.of(), Map.of());
    }

    public String getKind() {
        return kind;
    }

    /// Returns the named operand slots.
    ///
    /// @return unmodifiable view in declaration order, never null
    public Map<String, Token> getArguments() {
        return arguments;
    }

    /// Returns the inline literal attributes.
    ///
    /// @return unmodifiable map, never null
    public Map<String, Object> getAttributes() {
        return attributes;
    }

    /// Returns the child token in the given operand slot.
    ///
    /// @param name operand name, not null
    /// @return the child, or empty if the slot is absent
    public Optional<Token> getArgument(String name) {
        return Optional.ofNullable(arguments.get(name));
    }

    /// Returns an inline literal.
    ///
    /// @param name attribute name, not null
    /// @return the literal, or empty if absent
    public Optional<Object> getAttribute(String name) {
        return Optional.ofNullable(attributes.get(name));
    }

    /// Returns whether the token has neither operands nor literals.
    public boolean isLeaf() {
        return arguments.isEmpty() && attributes.isEmpty();
    }

    /// Compares trees structurally. A pair of tokens already being compared further up counts
    /// as equal, so cyclic trees compare without unbounded recursion.
    @Override
    public boolean equals(Object o) {
        return this == o
                || o instanceof Token other && sameTree(this, other, new IdentityHashMap<>());
    }

    /// Hashes the kind, literals and operand names only, which is consistent with
    /// {@link #equals} and never descends into operands.
    @Override
    public int hashCode() {
        return Objects.hash(kind, attributes, arguments.keySet());
    }

    private static boolean sameTree(Token left, Token right, Map<Token, Set<Token>> comparing) {
        if (left == right) {
            return true;
        }
        if (left == null || right == null) {
            return false;
        }
        if (!left.kind.equals(right.kind)
                || !left.attributes.equals(right.attributes)
                || !left.arguments.keySet().equals(right.arguments.keySet())) {
            return false;
        }
        Set<Token> partners =
                comparing.computeIfAbsent(
                        left, key -> Collections.newSetFromMap(new IdentityHashMap<>()));
        if (!partners.add(right)) {
            return true;
        }
        for (Map.Entry<String, Token> argument : left.arguments.entrySet()) {
            Token other = right.arguments.get(argument.getKey());
            if (!sameTree(argument.getValue(), other, comparing)) {
                return false;
            }
        }
        return true;
    }

    @Override
    public String toString() {
        return TokenPrinter.inline(this);
    }
}
