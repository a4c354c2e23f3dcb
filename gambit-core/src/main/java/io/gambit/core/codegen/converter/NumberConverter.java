package io.gambit.core.codegen.converter;

import io.gambit.core.checker.TypedAst;
import io.gambit.core.codegen.ConverterRegistry;
import io.gambit.core.error.CompileError;
import io.gambit.core.error.CompileException;
import io.gambit.core.error.ErrorKind;
import io.gambit.core.runtime.Node;
import io.gambit.core.runtime.ValueType;
import io.gambit.core.runtime.node.ConstantNode;
import io.gambit.core.token.TokenKind;

/// `Number { value }` becomes a constant of its integer literal.
public final class NumberConverter extends AbstractConverter<Integer> {

    static final String VALUE = "value";

    public NumberConverter() {
        super(TokenKind.NUMBER, ValueType.INTEGER);
    }

    @Override
    public Node<Integer> convert(TypedAst ast, ConverterRegistry registry)
            throws CompileException {
        Object value = ast.token().getAttribute(VALUE).orElse(null);
        if (!(value instanceof Integer literal)) {
            throw new CompileException(
                    CompileError.of(new ErrorKind.MissingChild(ast.kind(), VALUE), ast.token()));
        }
        return new ConstantNode<>(literal);
    }
}
