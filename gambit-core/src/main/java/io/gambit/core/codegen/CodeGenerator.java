package io.gambit.core.codegen;

import io.gambit.core.checker.TypedAst;
import io.gambit.core.error.CompileException;
import io.gambit.core.runtime.Action;
import io.gambit.core.runtime.Node;
import io.gambit.core.runtime.ValueType;
import java.util.Optional;

/// Turns typed trees into evaluation nodes.
public class CodeGenerator {

    private final ConverterRegistry registry;

    public CodeGenerator(ConverterRegistry registry) {
        this.registry = registry;
    }

    /// Generates the node of a rule root.
    ///
    /// @param ast typed tree of type `Action`, not null
    /// @return the action node, never null
    /// @throws CompileException if some token cannot be converted
    public Node<Action> generate(TypedAst ast) throws CompileException {
        return generate(ast, ValueType.ACTION);
    }

    /// Generates a node of the requested type.
    ///
    /// @param ast typed tree, not null
    /// @param target requested output type, not null
    /// @param <T> output Java type
    /// @return the node, never null
    /// @throws CompileException if some token cannot be converted
    public <T> Node<T> generate(TypedAst ast, ValueType<T> target) throws CompileException {
        return registry.convert(ast, target);
    }

    /// Generates a node for the tree's own type, resolving abstract types first.
    ///
    /// @param ast typed tree, not null
    /// @return the node, or empty if the resolved type has no runtime representation
    /// @throws CompileException if some token cannot be converted
    public Optional<Node<?>> generateForCheckedType(TypedAst ast) throws CompileException {
        Optional<ValueType<?>> target =
                ValueType.forType(registry.numericResolver().resolve(ast));
        if (target.isEmpty()) {
            return Optional.empty();
        }
        Node<?> node = registry.convert(ast, target.get());
        return Optional.of(node);
    }

    public ConverterRegistry getRegistry() {
        return registry;
    }
}
