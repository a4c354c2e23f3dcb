package io.gambit.core.rule;

import io.gambit.core.runtime.Action;
import io.gambit.core.runtime.EvaluationContext;
import io.gambit.core.runtime.EvaluationError;
import io.gambit.core.token.Token;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.logging.Logger;

/// Compiled rule lists per character.
///
/// Attaching is all-or-nothing: if any rule of a set fails to compile, the character keeps
/// whatever rules it had before.
///
/// @implNote Not thread-safe.
public class RuleBook {

    private static final Logger logger = Logger.getLogger(RuleBook.class.getName());

    private final RuleCompiler compiler;
    private final RuleResolver resolver;
    private final Map<Integer, List<CompiledRule>> rulesByCharacter = new HashMap<>();

    public RuleBook(RuleCompiler compiler, RuleResolver resolver) {
        this.compiler = Objects.requireNonNull(compiler, "compiler");
        this.resolver = Objects.requireNonNull(resolver, "resolver");
    }

    /// Compiles a rule set and attaches it to a character, replacing its previous rules.
    ///
    /// @param characterId character to attach to
    /// @param tokens rule token trees in priority order, not null
    /// @return the batch outcome; rules are attached only if it is successful
    public BatchCompilation attach(int characterId, List<Token> tokens) {
        BatchCompilation batch = compiler.compileAll(tokens);
        if (batch.isSuccessful()) {
            rulesByCharacter.put(characterId, batch.getRules());
            logger.fine("Attached " + batch.getRules().size() + " rule(s) to " + characterId);
        } else {
            logger.warning(
                    "Rejected rule set for character "
                            + characterId
                            + ": "
                            + batch.getFailures().size()
                            + " rule(s) failed to compile");
        }
        return batch;
    }

    /// Returns the rules attached to a character.
    ///
    /// @return rules in priority order, empty if none are attached
    public List<CompiledRule> rulesFor(int characterId) {
        return rulesByCharacter.getOrDefault(characterId, List.of());
    }

    /// Resolves the turn of a character with its attached rules.
    ///
    /// @throws EvaluationError if a rule fails hard
    public Optional<Action> resolveFor(int characterId, EvaluationContext context)
            throws EvaluationError {
        return resolver.resolve(rulesFor(characterId), context);
    }

    /// Removes the rules of a character.
    ///
    /// @return true if the character had rules
    public boolean detach(int characterId) {
        return rulesByCharacter.remove(characterId) != null;
    }
}
