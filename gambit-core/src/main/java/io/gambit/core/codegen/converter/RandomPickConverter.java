package io.gambit.core.codegen.converter;

import io.gambit.core.checker.TypedAst;
import io.gambit.core.codegen.ConverterRegistry;
import io.gambit.core.error.CompileException;
import io.gambit.core.runtime.Node;
import io.gambit.core.runtime.ValueType;
import io.gambit.core.runtime.node.RandomPickNode;
import io.gambit.core.token.TokenKind;

/// `RandomPick { array }` over one element type.
///
/// @param <T> element Java type
public final class RandomPickConverter<T> extends AbstractConverter<T> {

    public RandomPickConverter(ValueType<T> elementType) {
        super(TokenKind.RANDOM_PICK, elementType);
    }

    @Override
    public Node<T> convert(TypedAst ast, ConverterRegistry registry) throws CompileException {
        return new RandomPickNode<>(
                registry.convertChild(ast, "array", ValueType.sequenceOf(outputType())));
    }
}
