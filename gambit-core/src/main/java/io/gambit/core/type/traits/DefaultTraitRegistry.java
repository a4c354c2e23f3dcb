package io.gambit.core.type.traits;

import io.gambit.core.type.Type;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/// Default implementation of {@link TraitRegistry}.
///
/// Registers the built-in traits on construction:
/// - `Numeric` (`to_i32`): `I32`, `CharacterHP` and the `Numeric` capability itself
/// - `Eq`: `I32`, `Bool`, `String`, `Character`, `Team`, `CharacterHP`, `TeamSide`
/// - `Ord` (supertrait `Eq`): `I32`, `CharacterHP`, `Numeric`, and `Character` ordered by HP
/// - `Collection<T>` (`len`): every `Vec`
/// - `Show` (`to_string`): the scalar value types and flat lists of them
///
/// @implNote Not thread-safe for registration. Populate before sharing.
public class DefaultTraitRegistry implements TraitRegistry {

    private final Map<String, TraitDefinition> traits = new LinkedHashMap<>();
    private final List<TraitImplementation> implementations = new ArrayList<>();

    /// Creates a registry with the built-in traits and implementations.
    public DefaultTraitRegistry() {
        registerTrait(
                TraitDefinition.of(Traits.NUMERIC, MethodSignature.of("to_i32", Type.INTEGER)));
        registerTrait(
                TraitDefinition.of(
                        Traits.EQ,
                        new MethodSignature("eq", List.of(Type.ANY), Type.BOOLEAN)));
        registerTrait(
                new TraitDefinition(
                        Traits.ORD,
                        List.of(),
                        List.of(new MethodSignature("cmp", List.of(Type.ANY), Type.INTEGER)),
                        List.of(Traits.EQ)));
        registerTrait(
                new TraitDefinition(
                        Traits.COLLECTION,
                        List.of("T"),
                        List.of(MethodSignature.of("len", Type.INTEGER)),
                        List.of()));
        registerTrait(
                TraitDefinition.of(Traits.SHOW, MethodSignature.of("to_string", Type.STRING)));

        for (Type type : List.of(Type.INTEGER, Type.CHARACTER_HP, Type.NUMERIC)) {
            registerImplementation(new TraitImplementation(Traits.NUMERIC, type));
            registerImplementation(new TraitImplementation(Traits.ORD, type));
        }
        for (Type type :
                List.of(
                        Type.INTEGER,
                        Type.BOOLEAN,
                        Type.STRING,
                        Type.CHARACTER,
                        Type.TEAM,
                        Type.CHARACTER_HP,
                        Type.TEAM_SIDE)) {
            registerImplementation(new TraitImplementation(Traits.EQ, type));
        }
        registerImplementation(new TraitImplementation(Traits.ORD, Type.CHARACTER));
        registerImplementation(
                new TraitImplementation(Traits.COLLECTION, Type.sequenceOf(Type.ANY)));
        for (Type type :
                List.of(
                        Type.INTEGER,
                        Type.BOOLEAN,
                        Type.STRING,
                        Type.CHARACTER,
                        Type.CHARACTER_HP,
                        Type.TEAM_SIDE)) {
            registerImplementation(new TraitImplementation(Traits.SHOW, type));
            registerImplementation(new TraitImplementation(Traits.SHOW, Type.sequenceOf(type)));
        }
    }

    @Override
    public void registerTrait(TraitDefinition definition) {
        Objects.requireNonNull(definition, "definition");
        if (traits.containsKey(definition.name())) {
            throw new IllegalArgumentException("Trait already registered: " + definition.name());
        }
        traits.put(definition.name(), definition);
    }

    @Override
    public void registerImplementation(TraitImplementation implementation) {
        Objects.requireNonNull(implementation, "implementation");
        if (!traits.containsKey(implementation.traitName())) {
            throw new IllegalArgumentException(
                    "Cannot implement unknown trait: " + implementation.traitName());
        }
        implementations.add(implementation);
    }

    @Override
    public Optional<TraitDefinition> getTrait(String name) {
        return Optional.ofNullable(traits.get(name));
    }

    @Override
    public boolean implementsTrait(Type type, String traitName) {
        return traitsFor(type).contains(traitName);
    }

    @Override
    public Set<String> traitsFor(Type type) {
        Set<String> result = new LinkedHashSet<>();
        Deque<String> pending = new ArrayDeque<>();
        for (TraitImplementation implementation : implementations) {
            if (implementation.appliesTo(type)) {
                pending.add(implementation.traitName());
            }
        }
        while (!pending.isEmpty()) {
            String trait = pending.poll();
            if (result.add(trait)) {
                TraitDefinition definition = traits.get(trait);
                if (definition != null) {
                    pending.addAll(definition.supertraits());
                }
            }
        }
        return result;
    }
}
