package io.gambit.core.type.traits;

import io.gambit.core.type.Type;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/// Registry of traits and the types implementing them.
///
/// Implementation lookups honour supertraits: a type implementing `Ord` also implements `Eq`.
public interface TraitRegistry {

    /// Registers a trait definition.
    ///
    /// @param definition the trait, not null
    /// @throws IllegalArgumentException if a trait with the same name exists
    void registerTrait(TraitDefinition definition);

    /// Registers an implementation of an already registered trait.
    ///
    /// @param implementation the implementation, not null
    /// @throws IllegalArgumentException if the trait is unknown
    void registerImplementation(TraitImplementation implementation);

    /// Looks up a trait definition.
    ///
    /// @param name trait name, not null
    /// @return the definition, or empty if not registered
    Optional<TraitDefinition> getTrait(String name);

    /// Checks whether a type implements a trait directly or through a supertrait.
    ///
    /// @param type the type, not null
    /// @param traitName trait name, not null
    /// @return `true` if implemented
    boolean implementsTrait(Type type, String traitName);

    /// Returns every trait the type implements, including the supertrait closure.
    ///
    /// @param type the type, not null
    /// @return trait names in registration order, never null
    Set<String> traitsFor(Type type);

    /// Returns the traits from `required` that the type does not implement.
    ///
    /// @param type the type, not null
    /// @param required trait names, not null
    /// @return the unsatisfied traits in the order given, empty if all bounds hold
    default List<String> unsatisfiedBounds(Type type, Collection<String> required) {
        return required.stream().filter(trait -> !implementsTrait(type, trait)).toList();
    }
}
