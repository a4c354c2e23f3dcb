package io.gambit.core.battle;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/// Read-only view of the battle for one rule evaluation.
///
/// @param actingCharacter the character whose rules are resolved, not null
/// @param actingSide the side the acting character fights on, not null
/// @param playerTeam player roster, not null
/// @param enemyTeam enemy roster, not null
public record BattleView(
        GameCharacter actingCharacter, TeamSide actingSide, Team playerTeam, Team enemyTeam) {

    public BattleView {
        Objects.requireNonNull(actingCharacter, "actingCharacter");
        Objects.requireNonNull(actingSide, "actingSide");
        Objects.requireNonNull(playerTeam, "playerTeam");
        Objects.requireNonNull(enemyTeam, "enemyTeam");
    }

    public Team team(TeamSide side) {
        return side == TeamSide.PLAYER ? playerTeam : enemyTeam;
    }

    public List<GameCharacter> teamMembers(TeamSide side) {
        return team(side).members();
    }

    /// Returns every character, player side first, each side in roster order.
    public List<GameCharacter> allCharacters() {
        List<GameCharacter> all =
                new ArrayList<>(playerTeam.members().size() + enemyTeam.members().size());
        all.addAll(playerTeam.members());
        all.addAll(enemyTeam.members());
        return List.copyOf(all);
    }

    /// Finds the side a character belongs to.
    ///
    /// @param characterId character id
    /// @return the side, or empty if neither roster contains the character
    public Optional<TeamSide> sideOf(int characterId) {
        if (playerTeam.member(characterId).isPresent()) {
            return Optional.of(TeamSide.PLAYER);
        }
        if (enemyTeam.member(characterId).isPresent()) {
            return Optional.of(TeamSide.ENEMY);
        }
        return Optional.empty();
    }
}
