package io.gambit.core.codegen.converter;

import io.gambit.core.checker.TypedAst;
import io.gambit.core.codegen.ConverterRegistry;
import io.gambit.core.codegen.NumericResolver.OperandTypes;
import io.gambit.core.error.CompileError;
import io.gambit.core.error.CompileException;
import io.gambit.core.error.ErrorKind;
import io.gambit.core.runtime.Node;
import io.gambit.core.runtime.ValueType;
import io.gambit.core.runtime.node.Comparison;
import io.gambit.core.runtime.node.ComparisonNode;
import io.gambit.core.type.Type;
import java.util.function.ToIntFunction;

/// `GreaterThan` and `LessThan` over any pairing of `I32` and `CharacterHP` operands.
///
/// Abstract operands are resolved with the {@link io.gambit.core.codegen.NumericResolver}:
/// an operand of unknown representation takes its sibling's, and `I32` when neither is known.
public final class ComparisonConverter extends AbstractConverter<Boolean> {

    private final Comparison comparison;

    public ComparisonConverter(String tokenKind, Comparison comparison) {
        super(tokenKind, ValueType.BOOLEAN);
        this.comparison = comparison;
    }

    @Override
    public Node<Boolean> convert(TypedAst ast, ConverterRegistry registry)
            throws CompileException {
        OperandTypes types =
                registry.numericResolver().resolvePair(child(ast, "left"), child(ast, "right"));
        return build(
                numericValueType(ast, types.left()),
                numericValueType(ast, types.right()),
                ast,
                registry);
    }

    private <L, R> Node<Boolean> build(
            ValueType<L> leftType, ValueType<R> rightType, TypedAst ast, ConverterRegistry registry)
            throws CompileException {
        Node<L> left = registry.convertChild(ast, "left", leftType);
        Node<R> right = registry.convertChild(ast, "right", rightType);
        return new ComparisonNode<>(
                comparison, left, projection(ast, leftType), right, projection(ast, rightType));
    }

    private static ValueType<?> numericValueType(TypedAst ast, Type type) throws CompileException {
        return ValueType.forType(type)
                .filter(valueType -> valueType.numericProjection().isPresent())
                .orElseThrow(() -> noConverter(ast, type));
    }

    private static <T> ToIntFunction<T> projection(TypedAst ast, ValueType<T> type)
            throws CompileException {
        return type.numericProjection().orElseThrow(() -> noConverter(ast, type.type()));
    }

    private static CompileException noConverter(TypedAst ast, Type operandType) {
        return new CompileException(
                CompileError.of(new ErrorKind.NoConverter(ast.kind(), operandType), ast.token()));
    }
}
