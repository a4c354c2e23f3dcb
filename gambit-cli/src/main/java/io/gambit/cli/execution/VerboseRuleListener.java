package io.gambit.cli.execution;

import io.gambit.core.rule.CompiledRule;
import io.gambit.core.rule.RuleCompilationListener;
import io.gambit.core.runtime.Action;
import io.gambit.core.runtime.RuleBreak;
import io.gambit.core.token.TokenPrinter;
import java.io.PrintStream;
import java.util.Objects;

/// Compilation listener that prints rule progress to the terminal.
///
/// ### Output Format
/// ```
///   compiled  Strike { target: ActingCharacter }
///   rule #0   skipped: condition not met
///   rule #1   chose Strike[targetId=10]
/// ```
///
/// Compile failures are not printed here; the command prints the full report.
///
/// @implNote **Not thread-safe**.
public class VerboseRuleListener implements RuleCompilationListener {

    private final PrintStream out;

    /// @param out output stream, typically `System.out`, not null
    public VerboseRuleListener(PrintStream out) {
        this.out = Objects.requireNonNull(out, "out");
    }

    @Override
    public void onCompiled(CompiledRule rule) {
        out.println("  compiled  " + TokenPrinter.inline(rule.token()));
    }

    @Override
    public void onRuleBreak(int index, RuleBreak ruleBreak) {
        out.printf("  rule #%-3d skipped: %s%n", index, ruleBreak.getReason());
    }

    @Override
    public void onActionResolved(int index, Action action) {
        out.printf("  rule #%-3d chose %s%n", index, action);
    }
}
