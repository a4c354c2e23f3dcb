package io.gambit.core;

import io.gambit.core.checker.TypeChecker;
import io.gambit.core.codegen.CodeGenerator;
import io.gambit.core.codegen.ConverterRegistry;
import io.gambit.core.codegen.DefaultConverterRegistry;
import io.gambit.core.error.ErrorReporter;
import io.gambit.core.metadata.DefaultTokenMetadataRegistry;
import io.gambit.core.metadata.TokenMetadataRegistry;
import io.gambit.core.rule.RuleCompilationListener;
import io.gambit.core.rule.RuleCompiler;
import io.gambit.core.rule.RuleResolver;
import io.gambit.core.type.traits.DefaultTraitRegistry;
import io.gambit.core.type.traits.TraitRegistry;
import java.util.Objects;

/// Factory for creating and wiring {@link GambitEnvironment} instances.
///
/// ### Usage
/// ```java
/// var env = GambitFactory.builder()
///     .config(GambitConfig.builder().healCost(5).build())
///     .listener(myListener)
///     .build();
/// var book = env.newRuleBook();
/// ```
///
/// or, with defaults, `GambitFactory.createEnvironment()`.
///
/// @see GambitEnvironment
/// @see GambitConfig
public final class GambitFactory {

    private GambitFactory() {
        // Utility class - prevent instantiation
    }

    /// Creates an environment with default configuration.
    ///
    /// @return a fully-wired environment, never null
    public static GambitEnvironment createEnvironment() {
        return createEnvironment(new GambitConfig());
    }

    /// Creates an environment with custom configuration.
    ///
    /// @param config heal cost, random probability and argument strictness, not null
    /// @return a fully-wired environment, never null
    public static GambitEnvironment createEnvironment(GambitConfig config) {
        return builder().config(config).build();
    }

    public static Builder builder() {
        return new Builder();
    }

    /// Fluent builder for environments with custom registries or a listener.
    public static final class Builder {

        private GambitConfig config = new GambitConfig();
        private TraitRegistry traitRegistry;
        private TokenMetadataRegistry metadataRegistry;
        private ConverterRegistry converterRegistry;
        private RuleCompilationListener listener = RuleCompilationListener.NOOP;

        private Builder() {}

        public Builder config(GambitConfig config) {
            this.config = Objects.requireNonNull(config, "config");
            return this;
        }

        /// Uses a custom trait registry instead of {@link DefaultTraitRegistry}.
        public Builder traitRegistry(TraitRegistry traitRegistry) {
            this.traitRegistry = traitRegistry;
            return this;
        }

        /// Uses a custom metadata registry instead of {@link DefaultTokenMetadataRegistry}.
        public Builder metadataRegistry(TokenMetadataRegistry metadataRegistry) {
            this.metadataRegistry = metadataRegistry;
            return this;
        }

        /// Uses a custom converter registry instead of {@link DefaultConverterRegistry}.
        public Builder converterRegistry(ConverterRegistry converterRegistry) {
            this.converterRegistry = converterRegistry;
            return this;
        }

        public Builder listener(RuleCompilationListener listener) {
            this.listener = Objects.requireNonNull(listener, "listener");
            return this;
        }

        /// Wires the environment.
        ///
        /// @return new environment, never null
        public GambitEnvironment build() {
            TraitRegistry traits =
                    traitRegistry != null ? traitRegistry : new DefaultTraitRegistry();
            TokenMetadataRegistry metadata =
                    metadataRegistry != null
                            ? metadataRegistry
                            : new DefaultTokenMetadataRegistry();
            ConverterRegistry converters =
                    converterRegistry != null
                            ? converterRegistry
                            : new DefaultConverterRegistry(config);
            TypeChecker checker = new TypeChecker(metadata, traits, config.isStrictArguments());
            CodeGenerator generator = new CodeGenerator(converters);
            return new GambitEnvironment(
                    config,
                    traits,
                    metadata,
                    converters,
                    checker,
                    generator,
                    new RuleCompiler(checker, generator, listener),
                    new RuleResolver(listener),
                    new ErrorReporter(metadata));
        }
    }
}
