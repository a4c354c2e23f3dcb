package io.gambit.core.type;

import java.util.Objects;
import java.util.Optional;

/// Compile-time type of a token or typed AST node.
///
/// The algebra is closed: atomic types ({@link Atom}), plus the two parameterized collections
/// {@link Sequence} (`Vec<T>`) and {@link Option} (`Option<T>`).
///
/// ### Compatibility
/// Compatibility is the relation used for validation and for unification of concrete types:
/// - identical types match
/// - `Numeric` matches `I32` and `CharacterHP` in either direction
/// - `Any` matches anything in either direction
/// - collections are compatible element-wise
///
/// @see io.gambit.core.type.traits.TraitRegistry for capability facts
public sealed interface Type permits Type.Atom, Type.Sequence, Type.Option {

    Type INTEGER = Atom.INTEGER;
    Type BOOLEAN = Atom.BOOLEAN;
    Type STRING = Atom.STRING;
    Type CHARACTER = Atom.CHARACTER;
    Type TEAM = Atom.TEAM;
    Type CHARACTER_HP = Atom.CHARACTER_HP;
    Type TEAM_SIDE = Atom.TEAM_SIDE;
    Type NUMERIC = Atom.NUMERIC;
    Type ACTION = Atom.ACTION;
    Type CONDITION = Atom.CONDITION;
    Type VOID = Atom.VOID;
    Type ANY = Atom.ANY;

    /// Returns the name used in diagnostics, e.g. `Vec<Character>`.
    ///
    /// @return display name, never null
    String displayName();

    /// Creates a sequence type.
    ///
    /// @param element element type, not null
    /// @return `Vec<element>`, never null
    static Type sequenceOf(Type element) {
        return new Sequence(element);
    }

    /// Creates an optional type.
    ///
    /// @param inner wrapped type, not null
    /// @return `Option<inner>`, never null
    static Type optionOf(Type inner) {
        return new Option(inner);
    }

    /// Checks whether a value of this type is acceptable where `other` is expected, or the
    /// reverse. The relation is symmetric.
    ///
    /// @param other type to compare with, not null
    /// @return `true` if the types are compatible
    default boolean isCompatibleWith(Type other) {
        if (this.equals(other)) {
            return true;
        }
        if (this == ANY || other == ANY) {
            return true;
        }
        if (this == NUMERIC && other.isNumeric() || other == NUMERIC && this.isNumeric()) {
            return true;
        }
        if (this instanceof Sequence left && other instanceof Sequence right) {
            return left.element().isCompatibleWith(right.element());
        }
        if (this instanceof Option left && other instanceof Option right) {
            return left.inner().isCompatibleWith(right.inner());
        }
        return false;
    }

    /// Returns whether this is one of the numeric representations or the `Numeric` capability.
    default boolean isNumeric() {
        return this == INTEGER || this == CHARACTER_HP || this == NUMERIC;
    }

    /// Returns whether this type, or any type nested inside it, is `Numeric` or `Any`.
    default boolean isAbstract() {
        if (this == NUMERIC || this == ANY) {
            return true;
        }
        if (this instanceof Sequence sequence) {
            return sequence.element().isAbstract();
        }
        if (this instanceof Option option) {
            return option.inner().isAbstract();
        }
        return false;
    }

    /// Replaces abstract markers with a concrete representative.
    ///
    /// `Numeric` becomes `CharacterHP` when the hint is `CharacterHP`, otherwise `I32`.
    /// `Any` becomes the hint, or `Void` without one. Collections resolve element-wise
    /// against the hint's element.
    ///
    /// @param hint concretely known sibling type, may be null
    /// @return concrete type, never null
    default Type resolveToConcrete(Type hint) {
        if (this == NUMERIC) {
            return hint == CHARACTER_HP ? CHARACTER_HP : INTEGER;
        }
        if (this == ANY) {
            return hint != null ? hint : VOID;
        }
        if (this instanceof Sequence sequence) {
            Type elementHint = hint instanceof Sequence other ? other.element() : null;
            return sequenceOf(sequence.element().resolveToConcrete(elementHint));
        }
        if (this instanceof Option option) {
            Type innerHint = hint instanceof Option other ? other.inner() : null;
            return optionOf(option.inner().resolveToConcrete(innerHint));
        }
        return this;
    }

    /// Returns the element type of a sequence.
    ///
    /// @return element type, or empty for anything that is not a sequence
    default Optional<Type> elementType() {
        return this instanceof Sequence sequence
                ? Optional.of(sequence.element())
                : Optional.empty();
    }

    /// Non-parameterized types.
    enum Atom implements Type {
        INTEGER("I32"),
        BOOLEAN("Bool"),
        STRING("String"),
        CHARACTER("Character"),
        TEAM("Team"),
        CHARACTER_HP("CharacterHP"),
        TEAM_SIDE("TeamSide"),
        NUMERIC("Numeric"),
        ACTION("Action"),
        CONDITION("Condition"),
        VOID("Void"),
        ANY("Any");

        private final String displayName;

        Atom(String displayName) {
            this.displayName = displayName;
        }

        @Override
        public String displayName() {
            return displayName;
        }

        @Override
        public String toString() {
            return displayName;
        }
    }

    /// `Vec<T>`.
    record Sequence(Type element) implements Type {
        public Sequence {
            Objects.requireNonNull(element, "element");
        }

        @Override
        public String displayName() {
            return "Vec<" + element.displayName() + ">";
        }

        @Override
        public String toString() {
            return displayName();
        }
    }

    /// `Option<T>`.
    record Option(Type inner) implements Type {
        public Option {
            Objects.requireNonNull(inner, "inner");
        }

        @Override
        public String displayName() {
            return "Option<" + inner.displayName() + ">";
        }

        @Override
        public String toString() {
            return displayName();
        }
    }
}
