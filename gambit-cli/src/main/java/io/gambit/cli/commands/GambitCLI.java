package io.gambit.cli.commands;

import picocli.CommandLine;
import picocli.CommandLine.Command;

/// Main entry point for the Gambit CLI application.
///
/// Registers the subcommands:
/// - `check` - Compile a rules file and report diagnostics
/// - `resolve` - Compile a rules file and resolve one turn against a battle snapshot
///
/// ### Exit Codes
/// - `0` success
/// - `1` a rule failed to compile or evaluation failed
/// - `2` an input file could not be read or parsed
///
/// @see CheckCommand
/// @see ResolveCommand
@Command(
        name = "gambit",
        description = "Typed combat rule compiler",
        mixinStandardHelpOptions = true,
        version = "gambit 0.1.0",
        subcommands = {CheckCommand.class, ResolveCommand.class})
public class GambitCLI {

    public static void main(String[] args) {
        System.exit(new CommandLine(new GambitCLI()).execute(args));
    }
}
