package io.gambit.core.battle;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/// A named roster of characters.
///
/// @param name team name, not null
/// @param members characters in roster order, not null
public record Team(String name, List<GameCharacter> members) {

    public Team {
        Objects.requireNonNull(name, "name");
        members = List.copyOf(members);
    }

    public Optional<GameCharacter> member(int characterId) {
        return members.stream().filter(member -> member.id() == characterId).findFirst();
    }
}
