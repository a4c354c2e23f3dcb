package io.gambit.core.codegen;

import io.gambit.core.checker.TypedAst;
import io.gambit.core.error.CompileException;
import io.gambit.core.error.ErrorKind;
import io.gambit.core.runtime.Node;
import io.gambit.core.runtime.ValueType;
import java.util.List;

/// Registry of {@link NodeConverter}s keyed by (output type, token kind).
///
/// Conversion never throws anything but {@link CompileException}: a missing converter, a
/// missing operand and an operand of the wrong type are all reported as compile errors.
public interface ConverterRegistry {

    /// Registers a converter after those already registered under the same key.
    ///
    /// @param converter converter to register, not null
    void register(NodeConverter<?> converter);

    /// Returns the converters registered under a key, in registration order.
    ///
    /// @param tokenKind token kind, not null
    /// @param outputType output value type, not null
    /// @param <T> output Java type
    /// @return converters, possibly empty, never null
    <T> List<NodeConverter<T>> getConverters(String tokenKind, ValueType<T> outputType);

    /// Checks whether any converter is registered under a key.
    boolean hasConverter(String tokenKind, ValueType<?> outputType);

    /// Converts a typed node to an evaluation node of the requested type.
    ///
    /// @param ast typed node, not null
    /// @param target requested output type, not null
    /// @param <T> output Java type
    /// @return the evaluation node, never null
    /// @throws CompileException with {@link ErrorKind.NoConverter} if no converter applies
    <T> Node<T> convert(TypedAst ast, ValueType<T> target) throws CompileException;

    /// Converts an operand of a typed node.
    ///
    /// Errors raised while converting the operand get the slot prepended to their path.
    ///
    /// @param parent typed node owning the operand, not null
    /// @param argument operand slot name, not null
    /// @param target requested output type, not null
    /// @param <T> output Java type
    /// @return the evaluation node, never null
    /// @throws CompileException with {@link ErrorKind.MissingChild} if the slot is empty,
    ///         {@link ErrorKind.ChildTypeMismatch} if the operand's type does not fit `target`
    <T> Node<T> convertChild(TypedAst parent, String argument, ValueType<T> target)
            throws CompileException;

    /// Returns the resolver used to choose concrete types for abstract operands.
    NumericResolver numericResolver();
}
