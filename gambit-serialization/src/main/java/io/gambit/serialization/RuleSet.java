package io.gambit.serialization;

import io.gambit.core.token.Token;
import java.util.List;
import java.util.Objects;

/// An ordered list of rule token trees as stored in a rules file.
///
/// ```
/// {"rules": [{"type": "Heal", "target": {"type": "ActingCharacter"}}]}
/// ```
///
/// @param rules rule roots in priority order, not null
public record RuleSet(List<Token> rules) {

    public RuleSet {
        rules = List.copyOf(Objects.requireNonNull(rules, "rules"));
    }
}
