package io.gambit.core.codegen.converter;

import io.gambit.core.checker.TypedAst;
import io.gambit.core.codegen.ConverterRegistry;
import io.gambit.core.error.CompileException;
import io.gambit.core.runtime.Node;
import io.gambit.core.runtime.ValueType;
import io.gambit.core.runtime.node.MapNode;
import io.gambit.core.token.TokenKind;
import java.util.List;

/// `Map { array, transform }` producing one result element type.
///
/// The source element type is read from the typed `array` operand, so one instance serves
/// every source type.
///
/// @param <O> result element Java type
public final class MapConverter<O> extends AbstractConverter<List<O>> {

    private final ValueType<O> resultType;

    public MapConverter(ValueType<O> resultType) {
        super(TokenKind.MAP, ValueType.sequenceOf(resultType));
        this.resultType = resultType;
    }

    @Override
    public Node<List<O>> convert(TypedAst ast, ConverterRegistry registry)
            throws CompileException {
        return build(elementValueType(ast, child(ast, "array")), ast, registry);
    }

    private <I> Node<List<O>> build(
            ValueType<I> sourceType, TypedAst ast, ConverterRegistry registry)
            throws CompileException {
        Node<List<I>> array = registry.convertChild(ast, "array", ValueType.sequenceOf(sourceType));
        Node<O> transform = registry.convertChild(ast, "transform", resultType);
        return new MapNode<>(array, transform);
    }
}
