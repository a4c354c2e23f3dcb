package io.gambit.core.codegen.converter;

import io.gambit.core.checker.TypedAst;
import io.gambit.core.codegen.ConverterRegistry;
import io.gambit.core.codegen.NumericResolver;
import io.gambit.core.error.CompileException;
import io.gambit.core.runtime.Node;
import io.gambit.core.runtime.ValueType;
import io.gambit.core.runtime.node.EqualityNode;
import io.gambit.core.token.TokenKind;
import io.gambit.core.type.Type;

/// `Eq` for one operand type. One instance is registered per comparable value type; the
/// instance matching the resolved operand type converts the token.
///
/// @param <T> operand Java type
public final class EqualityConverter<T> extends AbstractConverter<Boolean> {

    private final ValueType<T> operandType;
    private final NumericResolver resolver = new NumericResolver();

    public EqualityConverter(ValueType<T> operandType) {
        super(TokenKind.EQ, ValueType.BOOLEAN);
        this.operandType = operandType;
    }

    @Override
    public boolean canConvert(TypedAst ast) {
        var left = ast.child("left");
        var right = ast.child("right");
        if (left.isEmpty() || right.isEmpty()) {
            return false;
        }
        Type resolved = resolver.resolvePair(left.get(), right.get()).left();
        return operandType.type().equals(resolved);
    }

    @Override
    public Node<Boolean> convert(TypedAst ast, ConverterRegistry registry)
            throws CompileException {
        Node<T> left = registry.convertChild(ast, "left", operandType);
        Node<T> right = registry.convertChild(ast, "right", operandType);
        return new EqualityNode<>(operandType, left, right);
    }
}
