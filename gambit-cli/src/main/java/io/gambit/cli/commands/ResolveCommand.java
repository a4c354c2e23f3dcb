package io.gambit.cli.commands;

import io.gambit.cli.exception.InputException;
import io.gambit.core.GambitEnvironment;
import io.gambit.core.battle.BattleView;
import io.gambit.core.battle.GameCharacter;
import io.gambit.core.rule.BatchCompilation;
import io.gambit.core.runtime.Action;
import io.gambit.core.runtime.EvaluationContext;
import io.gambit.core.runtime.EvaluationError;
import io.gambit.serialization.RuleSerializer;
import java.nio.file.Path;
import java.util.Optional;
import java.util.Random;
import picocli.CommandLine;

/// CLI command that resolves one turn for the acting character of a battle snapshot.
///
/// Rules are tried in file order; the first one that yields an action wins.
///
/// ### Usage
/// ```bash
/// gambit resolve <rules.json> --battle <battle.json> [--seed <n>] [--json]
/// ```
///
/// Prints `Strike -> Slime (10)` (or the action as JSON with `--json`), or `no action` when
/// every rule was skipped.
@CommandLine.Command(name = "resolve", description = "Resolve the acting character's action")
class ResolveCommand extends GambitCommand {

    static final String NO_ACTION = "no action";

    @CommandLine.Parameters(index = "0", description = "Rules JSON file")
    private Path rulesPath;

    @CommandLine.Option(
            names = {"-b", "--battle"},
            required = true,
            description = "Battle snapshot JSON file")
    private Path battlePath;

    @CommandLine.Option(
            names = {"-s", "--seed"},
            description = "Seed for random conditions and picks")
    private Long seed;

    @CommandLine.Option(names = "--json", description = "Print the action as JSON")
    private boolean json;

    @Override
    protected void execute() throws InputException {
        GambitEnvironment env = createEnvironment();
        BatchCompilation batch = compileRules(env, rulesPath);
        if (!batch.isSuccessful()) {
            return;
        }
        BattleView battle =
                parse(() -> RuleSerializer.battleFromJson(readFile(battlePath, "battle")));
        Random random = seed != null ? new Random(seed) : new Random();

        Optional<Action> action;
        try {
            action =
                    env.getRuleResolver()
                            .resolve(batch.getRules(), EvaluationContext.of(battle, random));
        } catch (EvaluationError e) {
            fail(EXIT_RULE_FAILURE, "Evaluation failed: " + e.getMessage());
            return;
        }

        if (action.isEmpty()) {
            System.out.println(NO_ACTION);
        } else if (json) {
            System.out.println(RuleSerializer.actionToJson(action.get()));
        } else {
            System.out.println(describe(action.get(), battle));
        }
    }

    static String describe(Action action, BattleView battle) {
        int targetId;
        String verb;
        if (action instanceof Action.Strike strike) {
            verb = "Strike";
            targetId = strike.targetId();
        } else {
            verb = "Heal";
            targetId = ((Action.Heal) action).targetId();
        }
        String name =
                battle.allCharacters().stream()
                        .filter(character -> character.id() == targetId)
                        .map(GameCharacter::name)
                        .findFirst()
                        .orElse("?");
        return verb + " -> " + name + " (" + targetId + ")";
    }
}
