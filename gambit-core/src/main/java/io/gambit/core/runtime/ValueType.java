package io.gambit.core.runtime;

import io.gambit.core.battle.CharacterHp;
import io.gambit.core.battle.GameCharacter;
import io.gambit.core.battle.TeamSide;
import io.gambit.core.type.Type;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.function.BiPredicate;
import java.util.function.ToIntFunction;

/// Runtime representation of a concrete {@link Type}.
///
/// The set is closed: the scalar types below, `Action`, and lists of any of them. Each value
/// type knows how to narrow an untyped value (the current element), and carries the numeric
/// projection, ordering and equivalence its operations need.
///
/// | Type | Java type | Numeric | Ordered | Equivalence |
/// |---|---|---|---|---|
/// | `I32` | `Integer` | itself | natural | equals |
/// | `Bool` | `Boolean` | | | equals |
/// | `Character` | {@link GameCharacter} | | by HP | same id |
/// | `CharacterHP` | {@link CharacterHp} | HP value | by value | same value |
/// | `TeamSide` | {@link TeamSide} | | | equals |
/// | `Action` | {@link Action} | | | equals |
/// | `Vec<T>` | `List<T>` | | | element-wise |
///
/// @param <T> the Java type of values
public final class ValueType<T> {

    public static final ValueType<Integer> INTEGER =
            new ValueType<>(
                    Type.INTEGER,
                    Integer.class,
                    null,
                    Integer::intValue,
                    Comparator.naturalOrder(),
                    Integer::equals);

    public static final ValueType<Boolean> BOOLEAN =
            new ValueType<>(Type.BOOLEAN, Boolean.class, null, null, null, Boolean::equals);

    public static final ValueType<GameCharacter> CHARACTER =
            new ValueType<>(
                    Type.CHARACTER,
                    GameCharacter.class,
                    null,
                    null,
                    Comparator.comparingInt(GameCharacter::hp),
                    (left, right) -> left.id() == right.id());

    public static final ValueType<CharacterHp> CHARACTER_HP =
            new ValueType<>(
                    Type.CHARACTER_HP,
                    CharacterHp.class,
                    null,
                    CharacterHp::value,
                    CharacterHp.BY_VALUE,
                    CharacterHp::sameValue);

    public static final ValueType<TeamSide> TEAM_SIDE =
            new ValueType<>(Type.TEAM_SIDE, TeamSide.class, null, null, null, TeamSide::equals);

    public static final ValueType<Action> ACTION =
            new ValueType<>(Type.ACTION, Action.class, null, null, null, Action::equals);

    private static final List<ValueType<?>> SCALARS =
            List.of(INTEGER, BOOLEAN, CHARACTER, CHARACTER_HP, TEAM_SIDE);

    private final Type type;
    private final Class<?> javaType;
    private final ValueType<?> element;
    private final ToIntFunction<T> numericProjection;
    private final Comparator<T> ordering;
    private final BiPredicate<T, T> equivalence;

    private ValueType(
            Type type,
            Class<?> javaType,
            ValueType<?> element,
            ToIntFunction<T> numericProjection,
            Comparator<T> ordering,
            BiPredicate<T, T> equivalence) {
        this.type = type;
        this.javaType = javaType;
        this.element = element;
        this.numericProjection = numericProjection;
        this.ordering = ordering;
        this.equivalence = equivalence;
    }

    /// Returns the value type of lists of `element`.
    ///
    /// @param element element value type, not null
    /// @param <E> element Java type
    /// @return list value type, never null
    public static <E> ValueType<List<E>> sequenceOf(ValueType<E> element) {
        Objects.requireNonNull(element, "element");
        BiPredicate<List<E>, List<E>> elementWise =
                (left, right) -> {
                    if (left.size() != right.size()) {
                        return false;
                    }
                    for (int i = 0; i < left.size(); i++) {
                        if (!element.equivalent(left.get(i), right.get(i))) {
                            return false;
                        }
                    }
                    return true;
                };
        return new ValueType<>(
                Type.sequenceOf(element.type), List.class, element, null, null, elementWise);
    }

    /// Returns the scalar value types usable as list elements.
    public static List<ValueType<?>> scalars() {
        return SCALARS;
    }

    /// Returns the value types list combinators are generated for: the scalars and lists of
    /// scalars.
    public static List<ValueType<?>> elementTypes() {
        List<ValueType<?>> types = new ArrayList<>(SCALARS);
        for (ValueType<?> scalar : SCALARS) {
            types.add(sequenceOf(scalar));
        }
        return List.copyOf(types);
    }

    /// Finds the value type of a concrete type.
    ///
    /// @param type compile-time type, not null
    /// @return the value type, or empty for abstract types and types without a runtime form
    public static Optional<ValueType<?>> forType(Type type) {
        if (type instanceof Type.Sequence sequence) {
            return forType(sequence.element()).map(element -> listOf(element));
        }
        if (type == Type.ACTION) {
            return Optional.of(ACTION);
        }
        return SCALARS.stream().filter(scalar -> scalar.type.equals(type)).findFirst();
    }

    private static <E> ValueType<?> listOf(ValueType<E> element) {
        return sequenceOf(element);
    }

    public Type type() {
        return type;
    }

    /// Returns the element value type of a list type.
    ///
    /// @return element type, or empty for scalars
    public Optional<ValueType<?>> elementType() {
        return Optional.ofNullable(element);
    }

    /// Returns how to read a value of this type as an integer.
    ///
    /// @return projection, or empty for non-numeric types
    public Optional<ToIntFunction<T>> numericProjection() {
        return Optional.ofNullable(numericProjection);
    }

    /// Returns the total order on values of this type.
    ///
    /// @return comparator, or empty for unordered types
    public Optional<Comparator<T>> ordering() {
        return Optional.ofNullable(ordering);
    }

    /// Compares two values with this type's equivalence.
    public boolean equivalent(T left, T right) {
        return equivalence.test(left, right);
    }

    /// Checks an untyped value against this type and returns it typed.
    ///
    /// @param value value to narrow, may be null
    /// @return the same value, typed, never null
    /// @throws EvaluationError if the value is null or of another type
    @SuppressWarnings("unchecked")
    public T narrow(Object value) throws EvaluationError {
        if (!javaType.isInstance(value)) {
            throw new EvaluationError(
                    "Expected "
                            + type
                            + " but found "
                            + (value == null ? "nothing" : value.getClass().getSimpleName()));
        }
        if (element != null) {
            for (Object item : (List<?>) value) {
                element.narrow(item);
            }
        }
        return (T) value;
    }

    @Override
    public boolean equals(Object o) {
        return this == o || o instanceof ValueType<?> other && type.equals(other.type);
    }

    @Override
    public int hashCode() {
        return type.hashCode();
    }

    @Override
    public String toString() {
        return type.displayName();
    }
}
