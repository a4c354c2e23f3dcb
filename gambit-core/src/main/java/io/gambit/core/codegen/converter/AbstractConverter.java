package io.gambit.core.codegen.converter;

import io.gambit.core.checker.TypedAst;
import io.gambit.core.codegen.NodeConverter;
import io.gambit.core.error.CompileError;
import io.gambit.core.error.CompileException;
import io.gambit.core.error.ErrorKind;
import io.gambit.core.runtime.ValueType;
import io.gambit.core.type.Type;
import java.util.Objects;

/// Base class holding the registry key of a converter.
///
/// @param <T> output Java type
public abstract class AbstractConverter<T> implements NodeConverter<T> {

    private final String tokenKind;
    private final ValueType<T> outputType;

    protected AbstractConverter(String tokenKind, ValueType<T> outputType) {
        this.tokenKind = Objects.requireNonNull(tokenKind, "tokenKind");
        this.outputType = Objects.requireNonNull(outputType, "outputType");
    }

    @Override
    public String tokenKind() {
        return tokenKind;
    }

    @Override
    public ValueType<T> outputType() {
        return outputType;
    }

    /// Returns an operand whose typed node is needed before conversion.
    ///
    /// @throws CompileException with {@link ErrorKind.MissingChild} if the slot is empty
    protected static TypedAst child(TypedAst ast, String argument) throws CompileException {
        return ast.child(argument)
                .orElseThrow(
                        () ->
                                new CompileException(
                                        CompileError.of(
                                                new ErrorKind.MissingChild(ast.kind(), argument),
                                                ast.token())));
    }

    /// Finds the value type of the elements of an array operand.
    ///
    /// @throws CompileException with {@link ErrorKind.NoConverter} if the element type has no
    ///         runtime representation
    protected static ValueType<?> elementValueType(TypedAst ast, TypedAst array)
            throws CompileException {
        Type element = array.type().elementType().orElse(Type.ANY).resolveToConcrete(null);
        return ValueType.forType(element)
                .orElseThrow(
                        () ->
                                new CompileException(
                                        CompileError.of(
                                                new ErrorKind.NoConverter(
                                                        ast.kind(), array.type()),
                                                ast.token())));
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "[" + tokenKind + " -> " + outputType + "]";
    }
}
