package io.gambit.core.codegen.converter;

import io.gambit.core.checker.TypedAst;
import io.gambit.core.codegen.ConverterRegistry;
import io.gambit.core.runtime.Node;
import io.gambit.core.runtime.ValueType;
import io.gambit.core.runtime.node.ElementNode;
import io.gambit.core.token.TokenKind;

/// `Element`, narrowed to one element type.
///
/// @param <T> element Java type
public final class ElementConverter<T> extends AbstractConverter<T> {

    public ElementConverter(ValueType<T> elementType) {
        super(TokenKind.ELEMENT, elementType);
    }

    @Override
    public Node<T> convert(TypedAst ast, ConverterRegistry registry) {
        return new ElementNode<>(outputType());
    }
}
