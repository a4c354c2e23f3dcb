package io.gambit.core.codegen.converter;

import io.gambit.core.checker.TypedAst;
import io.gambit.core.codegen.ConverterRegistry;
import io.gambit.core.error.CompileException;
import io.gambit.core.runtime.Action;
import io.gambit.core.runtime.Node;
import io.gambit.core.runtime.ValueType;
import io.gambit.core.runtime.node.StrikeNode;
import io.gambit.core.token.TokenKind;

/// `Strike { target }`.
public final class StrikeConverter extends AbstractConverter<Action> {

    public StrikeConverter() {
        super(TokenKind.STRIKE, ValueType.ACTION);
    }

    @Override
    public Node<Action> convert(TypedAst ast, ConverterRegistry registry) throws CompileException {
        return new StrikeNode(registry.convertChild(ast, "target", ValueType.CHARACTER));
    }
}
