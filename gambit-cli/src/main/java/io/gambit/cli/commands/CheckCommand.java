package io.gambit.cli.commands;

import io.gambit.cli.exception.InputException;
import io.gambit.core.GambitEnvironment;
import io.gambit.core.rule.BatchCompilation;
import java.nio.file.Path;
import picocli.CommandLine;

/// CLI command that compiles a rules file and reports diagnostics.
///
/// ### Usage
/// ```bash
/// gambit check [-v] [-c <config.json>] <rules.json>
/// ```
///
/// Prints ` [OK] N rule(s) compiled` on success. Otherwise prints the batch report on stderr
/// and exits with `1`.
@CommandLine.Command(name = "check", description = "Type-check and compile a rules file")
class CheckCommand extends GambitCommand {

    @CommandLine.Parameters(index = "0", description = "Rules JSON file")
    private Path rulesPath;

    @Override
    protected void execute() throws InputException {
        GambitEnvironment env = createEnvironment();
        BatchCompilation batch = compileRules(env, rulesPath);
        if (batch.isSuccessful()) {
            System.out.println(" [OK] " + batch.getRules().size() + " rule(s) compiled");
        }
    }
}
