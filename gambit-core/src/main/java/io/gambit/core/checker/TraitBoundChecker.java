package io.gambit.core.checker;

import io.gambit.core.error.CompileError;
import io.gambit.core.error.CompileException;
import io.gambit.core.error.ErrorKind;
import io.gambit.core.error.PathSegment;
import io.gambit.core.metadata.ArgumentSpec;
import io.gambit.core.metadata.TokenMetadata;
import io.gambit.core.metadata.TokenMetadataRegistry;
import io.gambit.core.type.Type;
import io.gambit.core.type.traits.TraitRegistry;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/// Verifies the trait bounds declared by token signatures on a fully typed tree.
///
/// Runs after unification has settled every operand type. Operands are visited before the
/// token that holds them, so the deepest violation is reported.
public class TraitBoundChecker {

    private final TokenMetadataRegistry metadata;
    private final TraitRegistry traits;

    public TraitBoundChecker(TokenMetadataRegistry metadata, TraitRegistry traits) {
        this.metadata = metadata;
        this.traits = traits;
    }

    /// Checks every bound in the tree.
    ///
    /// @param ast typed tree, not null
    /// @throws CompileException with {@link ErrorKind.TraitBoundError} on the first violation
    public void check(TypedAst ast) throws CompileException {
        for (Map.Entry<String, TypedAst> child : ast.children().entrySet()) {
            try {
                check(child.getValue());
            } catch (CompileException e) {
                throw e.withContext(ast.kind(), child.getKey());
            }
        }
        Optional<TokenMetadata> signature = metadata.get(ast.kind());
        if (signature.isEmpty()) {
            return;
        }
        for (ArgumentSpec argument : signature.get().arguments()) {
            Optional<TypedAst> operand = ast.child(argument.name());
            if (operand.isEmpty() || argument.requiredTraits().isEmpty()) {
                continue;
            }
            Type bounded = boundedType(argument, operand.get().type());
            List<String> missing = traits.unsatisfiedBounds(bounded, argument.requiredTraits());
            if (!missing.isEmpty()) {
                ErrorKind kind =
                        new ErrorKind.TraitBoundError(
                                bounded, missing.get(0), List.copyOf(traits.traitsFor(bounded)));
                throw new CompileException(
                        CompileError.of(kind, operand.get().token())
                                .withContext(new PathSegment(ast.kind(), argument.name())));
            }
        }
    }

    private static Type boundedType(ArgumentSpec argument, Type operandType) {
        if (argument.boundsOnElements()) {
            return operandType.elementType().orElse(operandType);
        }
        return operandType;
    }
}
