package io.gambit.core.codegen;

import io.gambit.core.GambitConfig;
import io.gambit.core.checker.TypedAst;
import io.gambit.core.codegen.converter.BuiltinConverters;
import io.gambit.core.error.CompileError;
import io.gambit.core.error.CompileException;
import io.gambit.core.error.ErrorKind;
import io.gambit.core.runtime.Node;
import io.gambit.core.runtime.ValueType;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/// Default implementation of {@link ConverterRegistry}.
///
/// Registers converters for every built-in token kind and every value type it can produce.
/// Custom converters can be added with {@link #register}; they are consulted after the
/// built-ins registered under the same key.
///
/// @implNote Not thread-safe for registration. Conversion itself only reads the registry.
public class DefaultConverterRegistry implements ConverterRegistry {

    private static final Logger logger = Logger.getLogger(DefaultConverterRegistry.class.getName());

    private final Map<ConverterKey, List<NodeConverter<?>>> converters = new HashMap<>();
    private final NumericResolver numericResolver = new NumericResolver();

    /// Creates a registry with built-in converters using default configuration.
    public DefaultConverterRegistry() {
        this(new GambitConfig());
    }

    /// Creates a registry with built-in converters.
    ///
    /// @param config heal cost and random probability baked into generated nodes, not null
    public DefaultConverterRegistry(GambitConfig config) {
        BuiltinConverters.registerAll(this, config);
    }

    @Override
    public void register(NodeConverter<?> converter) {
        Objects.requireNonNull(converter, "converter");
        if (converter.tokenKind() == null || converter.tokenKind().isBlank()) {
            throw new IllegalArgumentException("tokenKind cannot be null or blank");
        }
        ConverterKey key = new ConverterKey(converter.outputType().type(), converter.tokenKind());
        converters.computeIfAbsent(key, k -> new ArrayList<>()).add(converter);
        if (logger.isLoggable(Level.FINEST)) {
            logger.finest("Registered converter " + key.tokenKind() + " -> " + key.outputType());
        }
    }

    @Override
    @SuppressWarnings("unchecked")
    public <T> List<NodeConverter<T>> getConverters(String tokenKind, ValueType<T> outputType) {
        List<NodeConverter<?>> registered =
                converters.getOrDefault(new ConverterKey(outputType.type(), tokenKind), List.of());
        List<NodeConverter<T>> typed = new ArrayList<>(registered.size());
        for (NodeConverter<?> converter : registered) {
            // Keyed by output type, so the cast holds
            typed.add((NodeConverter<T>) converter);
        }
        return typed;
    }

    @Override
    public boolean hasConverter(String tokenKind, ValueType<?> outputType) {
        return converters.containsKey(new ConverterKey(outputType.type(), tokenKind));
    }

    @Override
    public <T> Node<T> convert(TypedAst ast, ValueType<T> target) throws CompileException {
        if (ast.type().isCompatibleWith(target.type())) {
            for (NodeConverter<T> converter : getConverters(ast.kind(), target)) {
                if (converter.canConvert(ast)) {
                    return converter.convert(ast, this);
                }
            }
        }
        throw new CompileException(
                CompileError.of(new ErrorKind.NoConverter(ast.kind(), target.type()), ast.token()));
    }

    @Override
    public <T> Node<T> convertChild(TypedAst parent, String argument, ValueType<T> target)
            throws CompileException {
        TypedAst child =
                parent.child(argument)
                        .orElseThrow(
                                () ->
                                        new CompileException(
                                                CompileError.of(
                                                        new ErrorKind.MissingChild(
                                                                parent.kind(), argument),
                                                        parent.token())));
        if (!child.type().isCompatibleWith(target.type())) {
            throw new CompileException(
                    CompileError.of(
                            new ErrorKind.ChildTypeMismatch(
                                    parent.kind(), argument, target.type(), child.type()),
                            child.token()));
        }
        try {
            return convert(child, target);
        } catch (CompileException e) {
            throw e.withContext(parent.kind(), argument);
        }
    }

    @Override
    public NumericResolver numericResolver() {
        return numericResolver;
    }
}
