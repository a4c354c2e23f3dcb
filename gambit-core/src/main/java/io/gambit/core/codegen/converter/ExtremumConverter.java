package io.gambit.core.codegen.converter;

import io.gambit.core.checker.TypedAst;
import io.gambit.core.codegen.ConverterRegistry;
import io.gambit.core.error.CompileException;
import io.gambit.core.runtime.Node;
import io.gambit.core.runtime.ValueType;
import io.gambit.core.runtime.node.ExtremumNode;
import java.util.Comparator;
import java.util.List;

/// `Max`, `Min`, `NumericMax` and `NumericMin` over one ordered element type.
///
/// @param <T> element Java type
public final class ExtremumConverter<T> extends AbstractConverter<T> {

    private final ExtremumNode.Direction direction;
    private final Comparator<T> order;

    /// @param tokenKind one of the extremum token kinds, not null
    /// @param direction which end of the order to take, not null
    /// @param elementType ordered element type, not null
    /// @throws IllegalArgumentException if the element type has no ordering
    public ExtremumConverter(
            String tokenKind, ExtremumNode.Direction direction, ValueType<T> elementType) {
        super(tokenKind, elementType);
        this.direction = direction;
        this.order =
                elementType
                        .ordering()
                        .orElseThrow(
                                () ->
                                        new IllegalArgumentException(
                                                elementType + " has no ordering"));
    }

    @Override
    public Node<T> convert(TypedAst ast, ConverterRegistry registry) throws CompileException {
        Node<List<T>> array =
                registry.convertChild(ast, "array", ValueType.sequenceOf(outputType()));
        return new ExtremumNode<>(direction, array, order);
    }
}
