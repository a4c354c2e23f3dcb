package io.gambit.core.rule;

import io.gambit.core.checker.TypeChecker;
import io.gambit.core.checker.TypedAst;
import io.gambit.core.codegen.CodeGenerator;
import io.gambit.core.error.CompileError;
import io.gambit.core.error.CompileException;
import io.gambit.core.runtime.Action;
import io.gambit.core.runtime.Node;
import io.gambit.core.token.Token;
import io.gambit.core.type.Type;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.logging.Logger;

/// Compiles rule token trees into evaluation nodes.
///
/// Runs the type checker, requiring the root to be an `Action`, then the code generator.
/// Every compile error is returned as a {@link CompilationResult#failure}; nothing escapes as
/// an exception.
///
/// @see TypeChecker
/// @see CodeGenerator
public class RuleCompiler {

    static final String RULE_ROOT = "rule root";

    private static final Logger logger = Logger.getLogger(RuleCompiler.class.getName());

    private final TypeChecker checker;
    private final CodeGenerator generator;
    private final RuleCompilationListener listener;

    public RuleCompiler(TypeChecker checker, CodeGenerator generator) {
        this(checker, generator, RuleCompilationListener.NOOP);
    }

    /// @param checker type checker, not null
    /// @param generator code generator, not null
    /// @param listener compilation events observer, not null
    public RuleCompiler(
            TypeChecker checker, CodeGenerator generator, RuleCompilationListener listener) {
        this.checker = Objects.requireNonNull(checker, "checker");
        this.generator = Objects.requireNonNull(generator, "generator");
        this.listener = Objects.requireNonNull(listener, "listener");
    }

    /// Compiles one rule.
    ///
    /// @param token rule token tree, not null
    /// @return the compiled rule or its first error, never null
    public CompilationResult compile(Token token) {
        Objects.requireNonNull(token, "token");
        try {
            TypedAst typed = checker.check(token, Type.ACTION, RULE_ROOT);
            Node<Action> node = generator.generate(typed);
            CompiledRule rule = new CompiledRule(token, typed, node);
            logger.fine("Compiled rule " + token.getKind() + ": " + node);
            listener.onCompiled(rule);
            return CompilationResult.success(rule);
        } catch (CompileException e) {
            CompileError error = e.getError().withToken(token);
            logger.fine("Rule " + token.getKind() + " failed to compile: " + error);
            listener.onCompileFailed(token, error);
            return CompilationResult.failure(error);
        }
    }

    /// Compiles a list of rules, collecting one error per failed rule.
    ///
    /// @param tokens rule token trees in priority order, not null
    /// @return the batch outcome, never null
    public BatchCompilation compileAll(List<Token> tokens) {
        List<CompiledRule> rules = new ArrayList<>();
        List<BatchCompilation.Failure> failures = new ArrayList<>();
        for (int i = 0; i < tokens.size(); i++) {
            CompilationResult result = compile(tokens.get(i));
            if (result.isSuccess()) {
                rules.add(result.getRule());
            } else {
                failures.add(new BatchCompilation.Failure(i, result.getError()));
            }
        }
        if (!failures.isEmpty()) {
            logger.info(failures.size() + " of " + tokens.size() + " rule(s) failed to compile");
        }
        return new BatchCompilation(rules, failures);
    }
}
