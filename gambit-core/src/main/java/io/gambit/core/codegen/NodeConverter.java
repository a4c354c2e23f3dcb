package io.gambit.core.codegen;

import io.gambit.core.checker.TypedAst;
import io.gambit.core.error.CompileException;
import io.gambit.core.runtime.Node;
import io.gambit.core.runtime.ValueType;

/// Builds the evaluation node for one token kind and one output type.
///
/// Converters are registered in a {@link ConverterRegistry} under
/// `(outputType().type(), tokenKind())`. Several converters may share a key; the registry uses
/// the first whose {@link #canConvert} accepts the typed node.
///
/// ### Example
/// {@snippet :
/// registry.register(new SimpleConverter<>(TokenKind.HERO, ValueType.TEAM_SIDE,
///         (ast, converters) -> new ConstantNode<>(TeamSide.PLAYER)));
/// }
///
/// @param <T> Java type of the produced node's values
public interface NodeConverter<T> {

    /// Returns the token kind this converter handles.
    String tokenKind();

    /// Returns the value type the produced node yields.
    ValueType<T> outputType();

    /// Decides between converters registered under the same key.
    ///
    /// @param ast typed node about to be converted, not null
    /// @return `true` if this converter handles it
    default boolean canConvert(TypedAst ast) {
        return true;
    }

    /// Builds the node, converting operands through the registry.
    ///
    /// @param ast typed node of kind {@link #tokenKind()}, not null
    /// @param registry registry for operand conversion, not null
    /// @return the evaluation node, never null
    /// @throws CompileException if an operand cannot be converted
    Node<T> convert(TypedAst ast, ConverterRegistry registry) throws CompileException;
}
