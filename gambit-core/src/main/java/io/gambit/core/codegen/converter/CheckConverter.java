package io.gambit.core.codegen.converter;

import io.gambit.core.checker.TypedAst;
import io.gambit.core.codegen.ConverterRegistry;
import io.gambit.core.error.CompileException;
import io.gambit.core.runtime.Action;
import io.gambit.core.runtime.Node;
import io.gambit.core.runtime.ValueType;
import io.gambit.core.runtime.node.CheckNode;
import io.gambit.core.token.TokenKind;

/// `Check { condition, then_action }`.
public final class CheckConverter extends AbstractConverter<Action> {

    public CheckConverter() {
        super(TokenKind.CHECK, ValueType.ACTION);
    }

    @Override
    public Node<Action> convert(TypedAst ast, ConverterRegistry registry) throws CompileException {
        Node<Boolean> condition = registry.convertChild(ast, "condition", ValueType.BOOLEAN);
        Node<Action> thenAction = registry.convertChild(ast, "then_action", ValueType.ACTION);
        return new CheckNode(condition, thenAction);
    }
}
