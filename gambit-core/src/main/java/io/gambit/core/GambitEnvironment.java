package io.gambit.core;

import io.gambit.core.checker.TypeChecker;
import io.gambit.core.codegen.CodeGenerator;
import io.gambit.core.codegen.ConverterRegistry;
import io.gambit.core.error.ErrorReporter;
import io.gambit.core.metadata.TokenMetadataRegistry;
import io.gambit.core.rule.RuleBook;
import io.gambit.core.rule.RuleCompiler;
import io.gambit.core.rule.RuleResolver;
import io.gambit.core.type.traits.TraitRegistry;

/// Container holding the wired components of a rule pipeline.
///
/// All references are fixed at construction. The registries are not thread-safe for
/// registration, so extend them before sharing the environment.
///
/// @apiNote Create instances via {@link GambitFactory#createEnvironment()} or
/// {@link GambitFactory.Builder} rather than direct construction.
public final class GambitEnvironment {

    private final GambitConfig config;
    private final TraitRegistry traitRegistry;
    private final TokenMetadataRegistry metadataRegistry;
    private final ConverterRegistry converterRegistry;
    private final TypeChecker typeChecker;
    private final CodeGenerator codeGenerator;
    private final RuleCompiler ruleCompiler;
    private final RuleResolver ruleResolver;
    private final ErrorReporter errorReporter;

    public GambitEnvironment(
            GambitConfig config,
            TraitRegistry traitRegistry,
            TokenMetadataRegistry metadataRegistry,
            ConverterRegistry converterRegistry,
            TypeChecker typeChecker,
            CodeGenerator codeGenerator,
            RuleCompiler ruleCompiler,
            RuleResolver ruleResolver,
            ErrorReporter errorReporter) {
        this.config = config;
        this.traitRegistry = traitRegistry;
        this.metadataRegistry = metadataRegistry;
        this.converterRegistry = converterRegistry;
        this.typeChecker = typeChecker;
        this.codeGenerator = codeGenerator;
        this.ruleCompiler = ruleCompiler;
        this.ruleResolver = ruleResolver;
        this.errorReporter = errorReporter;
    }

    public GambitConfig getConfig() {
        return config;
    }

    public TraitRegistry getTraitRegistry() {
        return traitRegistry;
    }

    public TokenMetadataRegistry getMetadataRegistry() {
        return metadataRegistry;
    }

    public ConverterRegistry getConverterRegistry() {
        return converterRegistry;
    }

    public TypeChecker getTypeChecker() {
        return typeChecker;
    }

    public CodeGenerator getCodeGenerator() {
        return codeGenerator;
    }

    public RuleCompiler getRuleCompiler() {
        return ruleCompiler;
    }

    public RuleResolver getRuleResolver() {
        return ruleResolver;
    }

    public ErrorReporter getErrorReporter() {
        return errorReporter;
    }

    /// Creates an empty rule book backed by this environment's compiler and resolver.
    ///
    /// @return new rule book, never null
    public RuleBook newRuleBook() {
        return new RuleBook(ruleCompiler, ruleResolver);
    }
}
