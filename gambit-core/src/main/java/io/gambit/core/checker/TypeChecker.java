package io.gambit.core.checker;

import io.gambit.core.checker.inference.InferenceEngine;
import io.gambit.core.checker.inference.PolyType;
import io.gambit.core.error.CompileError;
import io.gambit.core.error.CompileException;
import io.gambit.core.error.ErrorKind;
import io.gambit.core.error.PathSegment;
import io.gambit.core.metadata.ArgumentSpec;
import io.gambit.core.metadata.TokenMetadata;
import io.gambit.core.metadata.TokenMetadataRegistry;
import io.gambit.core.token.Token;
import io.gambit.core.token.TokenKind;
import io.gambit.core.type.Type;
import io.gambit.core.type.traits.TraitRegistry;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.logging.Level;
import java.util.logging.Logger;

/// Turns a raw token tree into a {@link TypedAst}.
///
/// Signatures come from the {@link TokenMetadataRegistry}. Each token instantiates its
/// signature scheme with fresh type variables; every operand is checked recursively and its
/// type is unified with the slot's expected type through an {@link InferenceEngine}. Each
/// operand's constraint is solved as soon as it is added, so the first mismatched slot in
/// declaration order is reported and later operands are not checked. Output
/// types follow from the solved signature: `FilterList` passes its array type through, `Map`
/// yields `Vec` of its transform type, `RandomPick` and the extremum tokens yield the element
/// type. Trait bounds are verified by a {@link TraitBoundChecker} once the tree is typed.
///
/// ### Element binding
/// Operands declared as element contexts (`FilterList.condition`, `Map.transform`) are checked
/// with the element type of their `array` sibling pushed onto an {@link ElementScope}.
/// `Element` takes the innermost binding and fails with
/// {@link ErrorKind.UnresolvedType} outside any binding.
///
/// @implNote Stateless between calls. Every {@link #check} runs on a fresh engine and scope.
public class TypeChecker {

    private static final Logger logger = Logger.getLogger(TypeChecker.class.getName());

    static final String ELEMENT_OUTSIDE_LIST = "Element used outside of list context";

    private final TokenMetadataRegistry metadata;
    private final TraitBoundChecker traitBounds;
    private final boolean strictArguments;

    public TypeChecker(TokenMetadataRegistry metadata, TraitRegistry traits) {
        this(metadata, traits, true);
    }

    /// @param metadata token signatures, not null
    /// @param traits trait facts for the bound pass, not null
    /// @param strictArguments whether operand slots a signature does not declare are rejected
    public TypeChecker(
            TokenMetadataRegistry metadata, TraitRegistry traits, boolean strictArguments) {
        this.metadata = metadata;
        this.traitBounds = new TraitBoundChecker(metadata, traits);
        this.strictArguments = strictArguments;
    }

    /// Type-checks a token tree.
    ///
    /// @param root root token, not null
    /// @return the typed tree, never null
    /// @throws CompileException describing the first error found
    public TypedAst check(Token root) throws CompileException {
        TypedAst typed = new Pass().check(root);
        traitBounds.check(typed);
        if (logger.isLoggable(Level.FINE)) {
            logger.fine("Checked " + root.getKind() + " : " + typed.type());
        }
        return typed;
    }

    /// Type-checks a token tree and requires a particular output type.
    ///
    /// @param root root token, not null
    /// @param expected required output type, not null
    /// @param context description used if the output type does not fit, not null
    /// @return the typed tree, never null
    /// @throws CompileException describing the first error found
    public TypedAst check(Token root, Type expected, String context) throws CompileException {
        TypedAst typed = check(root);
        if (!typed.type().isCompatibleWith(expected)) {
            throw new CompileException(
                    CompileError.of(
                            new ErrorKind.TypeMismatch(expected, typed.type(), context), root));
        }
        return typed;
    }

    /// State of one check: engine, element bindings and the tokens on the current path.
    private final class Pass {
        private final InferenceEngine engine = new InferenceEngine();
        private final ElementScope scope = new ElementScope();
        private final Set<Token> path = Collections.newSetFromMap(new IdentityHashMap<>());

        TypedAst check(Token token) throws CompileException {
            if (!path.add(token)) {
                throw fail(new ErrorKind.CyclicReference(token.getKind()), token);
            }
            try {
                return TokenKind.ELEMENT.equals(token.getKind())
                        ? checkElement(token)
                        : checkSignature(token);
            } finally {
                path.remove(token);
            }
        }

        private TypedAst checkElement(Token token) throws CompileException {
            if (strictArguments && !token.getArguments().isEmpty()) {
                throw fail(
                        new ErrorKind.ArgumentCountMismatch(
                                token.getKind(), 0, token.getArguments().size()),
                        token);
            }
            Type bound =
                    scope.current()
                            .orElseThrow(
                                    () ->
                                            fail(
                                                    new ErrorKind.UnresolvedType(
                                                            ELEMENT_OUTSIDE_LIST),
                                                    token));
            return TypedAst.leaf(token, bound);
        }

        private TypedAst checkSignature(Token token) throws CompileException {
            String kind = token.getKind();
            TokenMetadata signature =
                    metadata.get(kind)
                            .orElseThrow(() -> fail(new ErrorKind.UndefinedToken(kind), token));
            checkDeclaredSlots(signature, token);
            checkLiterals(signature, token);

            PolyType.Function instance =
                    (PolyType.Function) engine.instantiate(signature.scheme());
            Map<String, TypedAst> children = new LinkedHashMap<>();
            List<ArgumentSpec> arguments = signature.arguments();
            for (int i = 0; i < arguments.size(); i++) {
                ArgumentSpec argument = arguments.get(i);
                Optional<Token> operand = token.getArgument(argument.name());
                if (operand.isEmpty()) {
                    if (argument.required()) {
                        throw fail(new ErrorKind.MissingField(kind, argument.name()), token);
                    }
                    continue;
                }
                Token child = operand.get();
                try {
                    TypedAst checked = checkOperand(signature, argument, child, children);
                    engine.addConstraint(
                            instance.parameters().get(i),
                            PolyType.of(checked.type()),
                            kind + "." + argument.name());
                    // Solve per operand so the error names this slot
                    engine.solve();
                    children.put(argument.name(), checked);
                } catch (CompileException e) {
                    throw new CompileException(
                            e.getError()
                                    .withToken(child)
                                    .withContext(new PathSegment(kind, argument.name())));
                }
            }

            PolyType output = engine.apply(instance.result());
            Type outputType =
                    output.toType()
                            .orElseThrow(
                                    () ->
                                            fail(
                                                    new ErrorKind.UnresolvedType(
                                                            "cannot infer output type of "
                                                                    + kind
                                                                    + " from "
                                                                    + output.displayName()),
                                                    token));
            return new TypedAst(token, outputType, children);
        }

        private TypedAst checkOperand(
                TokenMetadata signature,
                ArgumentSpec argument,
                Token operand,
                Map<String, TypedAst> checkedSiblings)
                throws CompileException {
            Optional<String> source = signature.elementContextSource(argument.name());
            if (source.isEmpty()) {
                return check(operand);
            }
            TypedAst sourceAst = checkedSiblings.get(source.get());
            if (sourceAst == null) {
                throw new CompileException(
                        new ErrorKind.UnresolvedType(
                                signature.kind()
                                        + "."
                                        + argument.name()
                                        + " needs "
                                        + source.get()
                                        + " to be checked first"));
            }
            Type elementType = sourceAst.type().elementType().orElse(sourceAst.type());
            scope.push(elementType);
            try {
                return check(operand);
            } finally {
                scope.pop();
            }
        }

        private void checkDeclaredSlots(TokenMetadata signature, Token token)
                throws CompileException {
            if (!strictArguments) {
                return;
            }
            for (String name : token.getArguments().keySet()) {
                if (signature.argument(name).isEmpty()) {
                    throw fail(
                            new ErrorKind.ArgumentCountMismatch(
                                    token.getKind(),
                                    signature.arguments().size(),
                                    token.getArguments().size()),
                            token);
                }
            }
        }

        private void checkLiterals(TokenMetadata signature, Token token) throws CompileException {
            for (Map.Entry<String, Type> literal : signature.literals().entrySet()) {
                Optional<Object> value = token.getAttribute(literal.getKey());
                if (value.isEmpty() || !hasLiteralType(value.get(), literal.getValue())) {
                    throw fail(
                            new ErrorKind.MissingField(token.getKind(), literal.getKey()), token);
                }
            }
        }
    }

    private static boolean hasLiteralType(Object value, Type type) {
        if (type == Type.INTEGER) {
            return value instanceof Integer;
        }
        if (type == Type.BOOLEAN) {
            return value instanceof Boolean;
        }
        if (type == Type.STRING) {
            return value instanceof String;
        }
        return false;
    }

    private static CompileException fail(ErrorKind kind, Token token) {
        return new CompileException(CompileError.of(kind, token));
    }
}
