package io.gambit.core.codegen.converter;

import io.gambit.core.checker.TypedAst;
import io.gambit.core.codegen.ConverterRegistry;
import io.gambit.core.error.CompileException;
import io.gambit.core.runtime.Node;
import io.gambit.core.runtime.ValueType;

/// Converter backed by a function, for tokens whose node needs no type dispatch.
///
/// @param <T> output Java type
public final class SimpleConverter<T> extends AbstractConverter<T> {

    /// Builds a node from a typed token.
    @FunctionalInterface
    public interface Conversion<T> {
        Node<T> convert(TypedAst ast, ConverterRegistry registry) throws CompileException;
    }

    private final Conversion<T> conversion;

    public SimpleConverter(String tokenKind, ValueType<T> outputType, Conversion<T> conversion) {
        super(tokenKind, outputType);
        this.conversion = conversion;
    }

    @Override
    public Node<T> convert(TypedAst ast, ConverterRegistry registry) throws CompileException {
        return conversion.convert(ast, registry);
    }
}
