package io.gambit.core.metadata;

import io.gambit.core.checker.inference.PolyType;
import io.gambit.core.checker.inference.TypeScheme;
import io.gambit.core.checker.inference.TypeVariable;
import io.gambit.core.type.Type;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/// Signature of one token kind.
///
/// The checker treats a signature as the scheme
/// `forall typeParameters. (arguments...) -> output`, instantiated afresh for every token.
///
/// @param kind token kind, not null
/// @param category grouping for diagnostics, not null
/// @param description one-line summary, not null
/// @param typeParameters quantified variables of the signature, not null
/// @param arguments operand slots in checking order, not null
/// @param literals inline literal fields and their types, not null
/// @param output result type, not null
/// @param elementContexts operand slots that see an element binding, mapped to the sibling
///        slot whose element type they see, not null
public record TokenMetadata(
        String kind,
        TokenCategory category,
        String description,
        List<TypeVariable> typeParameters,
        List<ArgumentSpec> arguments,
        Map<String, Type> literals,
        PolyType output,
        Map<String, String> elementContexts) {

    public TokenMetadata {
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(category, "category");
        Objects.requireNonNull(description, "description");
        typeParameters = List.copyOf(typeParameters);
        arguments = List.copyOf(arguments);
        literals = Map.copyOf(literals);
        Objects.requireNonNull(output, "output");
        elementContexts = Map.copyOf(elementContexts);
    }

    /// Returns the signature as a type scheme over a function type.
    ///
    /// @return scheme whose body is `(argument types...) -> output`, never null
    public TypeScheme scheme() {
        List<PolyType> parameters = arguments.stream().map(ArgumentSpec::type).toList();
        return new TypeScheme(typeParameters, PolyType.function(parameters, output));
    }

    public Optional<ArgumentSpec> argument(String name) {
        return arguments.stream().filter(argument -> argument.name().equals(name)).findFirst();
    }

    /// Returns the sibling slot providing the element binding for an operand slot.
    ///
    /// @param argument operand slot name, not null
    /// @return sibling slot name, or empty if the slot sees no element binding
    public Optional<String> elementContextSource(String argument) {
        return Optional.ofNullable(elementContexts.get(argument));
    }

    public static Builder builder(String kind, TokenCategory category) {
        return new Builder(kind, category);
    }

    /// Fluent builder for {@link TokenMetadata}.
    public static final class Builder {
        private final String kind;
        private final TokenCategory category;
        private String description = "";
        private final List<TypeVariable> typeParameters = new ArrayList<>();
        private final List<ArgumentSpec> arguments = new ArrayList<>();
        private final Map<String, Type> literals = new LinkedHashMap<>();
        private final Map<String, String> elementContexts = new LinkedHashMap<>();
        private PolyType output;

        private Builder(String kind, TokenCategory category) {
            this.kind = kind;
            this.category = category;
        }

        public Builder description(String description) {
            this.description = description;
            return this;
        }

        public Builder typeParameters(TypeVariable... parameters) {
            typeParameters.addAll(List.of(parameters));
            return this;
        }

        public Builder argument(ArgumentSpec argument) {
            arguments.add(argument);
            return this;
        }

        public Builder literal(String name, Type type) {
            literals.put(name, type);
            return this;
        }

        /// Declares that `argument` is checked and evaluated with the element type of
        /// `source` bound.
        public Builder elementContext(String argument, String source) {
            elementContexts.put(argument, source);
            return this;
        }

        public Builder output(PolyType output) {
            this.output = output;
            return this;
        }

        public Builder output(Type output) {
            return output(PolyType.of(output));
        }

        public TokenMetadata build() {
            return new TokenMetadata(
                    kind,
                    category,
                    description,
                    typeParameters,
                    arguments,
                    literals,
                    output,
                    elementContexts);
        }
    }
}
