package io.gambit.core.codegen.converter;

import io.gambit.core.checker.TypedAst;
import io.gambit.core.codegen.ConverterRegistry;
import io.gambit.core.error.CompileException;
import io.gambit.core.runtime.Action;
import io.gambit.core.runtime.Node;
import io.gambit.core.runtime.ValueType;
import io.gambit.core.runtime.node.HealNode;
import io.gambit.core.token.TokenKind;

/// `Heal { target }`, with the MP cost fixed at compile time.
public final class HealConverter extends AbstractConverter<Action> {

    private final int mpCost;

    /// @param mpCost MP a heal costs, not negative
    /// @throws IllegalArgumentException if `mpCost` is negative
    public HealConverter(int mpCost) {
        super(TokenKind.HEAL, ValueType.ACTION);
        if (mpCost < 0) {
            throw new IllegalArgumentException("mpCost cannot be negative: " + mpCost);
        }
        this.mpCost = mpCost;
    }

    @Override
    public Node<Action> convert(TypedAst ast, ConverterRegistry registry) throws CompileException {
        return new HealNode(registry.convertChild(ast, "target", ValueType.CHARACTER), mpCost);
    }
}
