package io.gambit.cli.commands;

import io.gambit.cli.exception.InputException;
import io.gambit.cli.execution.VerboseRuleListener;
import io.gambit.core.GambitConfig;
import io.gambit.core.GambitEnvironment;
import io.gambit.core.GambitFactory;
import io.gambit.core.rule.BatchCompilation;
import io.gambit.core.rule.RuleCompilationListener;
import io.gambit.serialization.RuleSerializer;
import io.gambit.serialization.RuleSet;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.logging.Logger;
import picocli.CommandLine;
import picocli.CommandLine.Option;

/// Base class for Gambit CLI commands.
///
/// Owns the shared options, environment wiring and the {@link #run()} / {@link #execute()}
/// contract. Subclasses set the exit code through {@link #fail(int, String)}.
///
/// @implNote Subclasses must be package-private and annotated with `@Command`.
/// @see CheckCommand
/// @see ResolveCommand
public abstract class GambitCommand implements Runnable, CommandLine.IExitCodeGenerator {

    private static final Logger logger = Logger.getLogger(GambitCommand.class.getName());

    static final int EXIT_RULE_FAILURE = 1;
    static final int EXIT_BAD_INPUT = 2;

    @Option(
            names = {"-c", "--config"},
            description = "JSON file with healCost, randomConditionProbability, strictArguments")
    protected Path configPath;

    @Option(
            names = {"-v", "--verbose"},
            description = "Print each compiled rule and why rules were skipped")
    protected boolean verbose;

    private int exitCode;

    @Override
    public final void run() {
        try {
            execute();
        } catch (InputException e) {
            fail(EXIT_BAD_INPUT, e.getMessage());
        }
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }

    protected abstract void execute() throws InputException;

    /// Builds an environment from `--config` and `--verbose`.
    ///
    /// @throws InputException if the config file cannot be read or parsed
    protected GambitEnvironment createEnvironment() throws InputException {
        GambitConfig config =
                configPath != null
                        ? parse(() -> RuleSerializer.configFromJson(readFile(configPath, "config")))
                        : new GambitConfig();
        RuleCompilationListener listener =
                verbose ? new VerboseRuleListener(System.out) : RuleCompilationListener.NOOP;
        return GambitFactory.builder().config(config).listener(listener).build();
    }

    /// Loads and compiles a rules file, printing the batch report on failure.
    ///
    /// @return the batch, successful or not
    /// @throws InputException if the file cannot be read or parsed
    protected BatchCompilation compileRules(GambitEnvironment env, Path rulesPath)
            throws InputException {
        RuleSet rules = parse(() -> RuleSerializer.fromJson(readFile(rulesPath, "rules")));
        BatchCompilation batch = env.getRuleCompiler().compileAll(rules.rules());
        if (!batch.isSuccessful()) {
            fail(
                    EXIT_RULE_FAILURE,
                    batch.getFailures().size()
                            + " of "
                            + rules.rules().size()
                            + " rule(s) failed to compile");
            System.err.println();
            System.err.print(batch.report(env.getErrorReporter()));
        }
        return batch;
    }

    /// Reads a whole file as UTF-8.
    ///
    /// @throws InputException if the file is missing or unreadable
    protected String readFile(Path path, String what) throws InputException {
        try {
            return Files.readString(path);
        } catch (IOException e) {
            logger.fine("Failed to read " + what + " file " + path + ": " + e);
            throw new InputException("Cannot read " + what + " file: " + path, e);
        }
    }

    /// Runs a parse step, turning JSON errors into {@link InputException}.
    protected <T> T parse(ParseStep<T> step) throws InputException {
        try {
            return step.parse();
        } catch (IllegalArgumentException e) {
            throw new InputException(e.getMessage(), e);
        }
    }

    /// Prints a failure marker on stderr and records the exit code.
    protected void fail(int code, String message) {
        exitCode = code;
        System.err.println(" [FAIL] " + message);
    }

    @FunctionalInterface
    protected interface ParseStep<T> {
        T parse() throws InputException;
    }
}
