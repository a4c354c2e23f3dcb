package io.gambit.core.codegen.converter;

import io.gambit.core.checker.TypedAst;
import io.gambit.core.codegen.ConverterRegistry;
import io.gambit.core.error.CompileException;
import io.gambit.core.runtime.Node;
import io.gambit.core.runtime.ValueType;
import io.gambit.core.runtime.node.CountNode;
import io.gambit.core.token.TokenKind;

/// `Count { array }` for arrays of any element type.
public final class CountConverter extends AbstractConverter<Integer> {

    public CountConverter() {
        super(TokenKind.COUNT, ValueType.INTEGER);
    }

    @Override
    public Node<Integer> convert(TypedAst ast, ConverterRegistry registry)
            throws CompileException {
        return build(elementValueType(ast, child(ast, "array")), ast, registry);
    }

    private static <E> Node<Integer> build(
            ValueType<E> elementType, TypedAst ast, ConverterRegistry registry)
            throws CompileException {
        return new CountNode<>(
                registry.convertChild(ast, "array", ValueType.sequenceOf(elementType)));
    }
}
