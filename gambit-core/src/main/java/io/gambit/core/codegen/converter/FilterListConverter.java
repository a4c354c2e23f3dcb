package io.gambit.core.codegen.converter;

import io.gambit.core.checker.TypedAst;
import io.gambit.core.codegen.ConverterRegistry;
import io.gambit.core.error.CompileException;
import io.gambit.core.runtime.Node;
import io.gambit.core.runtime.ValueType;
import io.gambit.core.runtime.node.FilterListNode;
import io.gambit.core.token.TokenKind;
import java.util.List;

/// `FilterList { array, condition }` over one element type.
///
/// @param <T> element Java type
public final class FilterListConverter<T> extends AbstractConverter<List<T>> {

    private final ValueType<T> elementType;

    public FilterListConverter(ValueType<T> elementType) {
        super(TokenKind.FILTER_LIST, ValueType.sequenceOf(elementType));
        this.elementType = elementType;
    }

    @Override
    public Node<List<T>> convert(TypedAst ast, ConverterRegistry registry)
            throws CompileException {
        Node<List<T>> array =
                registry.convertChild(ast, "array", ValueType.sequenceOf(elementType));
        Node<Boolean> condition = registry.convertChild(ast, "condition", ValueType.BOOLEAN);
        return new FilterListNode<>(array, condition);
    }
}
