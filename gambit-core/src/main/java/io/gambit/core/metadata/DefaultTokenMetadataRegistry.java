package io.gambit.core.metadata;

import io.gambit.core.checker.inference.PolyType;
import io.gambit.core.checker.inference.TypeVariable;
import io.gambit.core.token.TokenKind;
import io.gambit.core.type.Type;
import io.gambit.core.type.traits.Traits;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/// Default implementation of {@link TokenMetadataRegistry} with every built-in token kind.
///
/// Signatures over element types use the parameters `a` and `b`, e.g. `RandomPick` is
/// `forall a. (array: Vec<a>) -> a` and `Map` is `forall a b. (array: Vec<a>, transform: b)
/// -> Vec<b>`. `Map.transform` requires `Show`, which keeps actions out of lists and lists
/// at most two levels deep.
public class DefaultTokenMetadataRegistry implements TokenMetadataRegistry {

    static final TypeVariable A = TypeVariable.parameter(0, "a");
    static final TypeVariable B = TypeVariable.parameter(1, "b");

    private final Map<String, TokenMetadata> signatures = new LinkedHashMap<>();

    /// Creates a registry with all built-in signatures registered.
    public DefaultTokenMetadataRegistry() {
        registerActions();
        registerConditions();
        registerValues();
        registerArrays();
    }

    @Override
    public void register(TokenMetadata metadata) {
        Objects.requireNonNull(metadata, "metadata");
        if (TokenKind.ELEMENT.equals(metadata.kind())) {
            throw new IllegalArgumentException(
                    "Element is typed from context and has no signature");
        }
        signatures.put(metadata.kind(), metadata);
    }

    @Override
    public Optional<TokenMetadata> get(String kind) {
        return Optional.ofNullable(signatures.get(kind));
    }

    @Override
    public boolean has(String kind) {
        return signatures.containsKey(kind);
    }

    @Override
    public Collection<TokenMetadata> all() {
        return Collections.unmodifiableCollection(signatures.values());
    }

    @Override
    public Map<TokenCategory, List<String>> kindsByCategory() {
        Map<TokenCategory, List<String>> grouped = new EnumMap<>(TokenCategory.class);
        for (TokenMetadata metadata : signatures.values()) {
            grouped.computeIfAbsent(metadata.category(), category -> new ArrayList<>())
                    .add(metadata.kind());
        }
        return grouped;
    }

    private void registerActions() {
        register(
                TokenMetadata.builder(TokenKind.STRIKE, TokenCategory.ACTION)
                        .description("Attack the target if the acting character is alive")
                        .argument(ArgumentSpec.of("target", Type.CHARACTER))
                        .output(Type.ACTION)
                        .build());
        register(
                TokenMetadata.builder(TokenKind.HEAL, TokenCategory.ACTION)
                        .description("Heal the target if the acting character can pay the MP cost")
                        .argument(ArgumentSpec.of("target", Type.CHARACTER))
                        .output(Type.ACTION)
                        .build());
        register(
                TokenMetadata.builder(TokenKind.CHECK, TokenCategory.ACTION)
                        .description("Run the action only when the condition holds")
                        .argument(ArgumentSpec.of("condition", Type.BOOLEAN))
                        .argument(ArgumentSpec.of("then_action", Type.ACTION))
                        .output(Type.ACTION)
                        .build());
    }

    private void registerConditions() {
        register(
                TokenMetadata.builder(TokenKind.TRUE_OR_FALSE_RANDOM, TokenCategory.CONDITION)
                        .description("Random boolean")
                        .output(Type.BOOLEAN)
                        .build());
        for (String kind : List.of(TokenKind.GREATER_THAN, TokenKind.LESS_THAN)) {
            register(
                    TokenMetadata.builder(kind, TokenCategory.CONDITION)
                            .description("Numeric comparison")
                            .argument(ArgumentSpec.of("left", Type.NUMERIC).requiring(Traits.ORD))
                            .argument(ArgumentSpec.of("right", Type.NUMERIC).requiring(Traits.ORD))
                            .output(Type.BOOLEAN)
                            .build());
        }
        register(
                TokenMetadata.builder(TokenKind.EQ, TokenCategory.CONDITION)
                        .description("Equality of two values of the same type")
                        .typeParameters(A)
                        .argument(ArgumentSpec.of("left", PolyType.var(A)).requiring(Traits.EQ))
                        .argument(ArgumentSpec.of("right", PolyType.var(A)).requiring(Traits.EQ))
                        .output(Type.BOOLEAN)
                        .build());
    }

    private void registerValues() {
        register(
                TokenMetadata.builder(TokenKind.NUMBER, TokenCategory.VALUE)
                        .description("Integer literal")
                        .literal("value", Type.INTEGER)
                        .output(Type.INTEGER)
                        .build());
        register(
                TokenMetadata.builder(TokenKind.ACTING_CHARACTER, TokenCategory.VALUE)
                        .description("The character whose rules are being resolved")
                        .output(Type.CHARACTER)
                        .build());
        register(
                TokenMetadata.builder(TokenKind.CHARACTER_TO_HP, TokenCategory.VALUE)
                        .description("HP of a character")
                        .argument(ArgumentSpec.of("character", Type.CHARACTER))
                        .output(Type.CHARACTER_HP)
                        .build());
        register(
                TokenMetadata.builder(TokenKind.CHARACTER_HP_TO_CHARACTER, TokenCategory.VALUE)
                        .description("Owner of an HP value")
                        .argument(ArgumentSpec.of("character_hp", Type.CHARACTER_HP))
                        .output(Type.CHARACTER)
                        .build());
        register(
                TokenMetadata.builder(TokenKind.CHARACTER_TEAM, TokenCategory.VALUE)
                        .description("Side a character fights on")
                        .argument(ArgumentSpec.of("character", Type.CHARACTER))
                        .output(Type.TEAM_SIDE)
                        .build());
        register(
                TokenMetadata.builder(TokenKind.HERO, TokenCategory.VALUE)
                        .description("The player side")
                        .output(Type.TEAM_SIDE)
                        .build());
        register(
                TokenMetadata.builder(TokenKind.ENEMY, TokenCategory.VALUE)
                        .description("The enemy side")
                        .output(Type.TEAM_SIDE)
                        .build());
    }

    private void registerArrays() {
        PolyType elements = PolyType.vec(PolyType.var(A));
        register(
                TokenMetadata.builder(TokenKind.ALL_CHARACTERS, TokenCategory.ARRAY)
                        .description("Every character, player side first")
                        .output(Type.sequenceOf(Type.CHARACTER))
                        .build());
        register(
                TokenMetadata.builder(TokenKind.TEAM_MEMBERS, TokenCategory.ARRAY)
                        .description("Members of one side")
                        .argument(ArgumentSpec.of("team_side", Type.TEAM_SIDE))
                        .output(Type.sequenceOf(Type.CHARACTER))
                        .build());
        register(
                TokenMetadata.builder(TokenKind.ALL_TEAM_SIDES, TokenCategory.ARRAY)
                        .description("Both sides")
                        .output(Type.sequenceOf(Type.TEAM_SIDE))
                        .build());
        register(
                TokenMetadata.builder(TokenKind.FILTER_LIST, TokenCategory.ARRAY)
                        .description("Elements for which the condition holds")
                        .typeParameters(A)
                        .argument(ArgumentSpec.of("array", elements))
                        .argument(ArgumentSpec.of("condition", Type.BOOLEAN))
                        .elementContext("condition", "array")
                        .output(elements)
                        .build());
        register(
                TokenMetadata.builder(TokenKind.MAP, TokenCategory.ARRAY)
                        .description("Transform every element")
                        .typeParameters(A, B)
                        .argument(ArgumentSpec.of("array", elements))
                        .argument(
                                ArgumentSpec.of("transform", PolyType.var(B))
                                        .requiring(Traits.SHOW))
                        .elementContext("transform", "array")
                        .output(PolyType.vec(PolyType.var(B)))
                        .build());
        register(
                TokenMetadata.builder(TokenKind.RANDOM_PICK, TokenCategory.ARRAY)
                        .description("Uniformly random element")
                        .typeParameters(A)
                        .argument(ArgumentSpec.of("array", elements))
                        .output(PolyType.var(A))
                        .build());
        registerExtremum(TokenKind.MAX, "Largest element", Traits.ORD);
        registerExtremum(TokenKind.MIN, "Smallest element", Traits.ORD);
        registerExtremum(TokenKind.NUMERIC_MAX, "Largest numeric element", Traits.NUMERIC);
        registerExtremum(TokenKind.NUMERIC_MIN, "Smallest numeric element", Traits.NUMERIC);
        register(
                TokenMetadata.builder(TokenKind.COUNT, TokenCategory.ARRAY)
                        .description("Number of elements")
                        .typeParameters(A)
                        .argument(ArgumentSpec.of("array", elements).requiring(Traits.COLLECTION))
                        .output(Type.INTEGER)
                        .build());
    }

    private void registerExtremum(String kind, String description, String elementTrait) {
        register(
                TokenMetadata.builder(kind, TokenCategory.ARRAY)
                        .description(description)
                        .typeParameters(A)
                        .argument(
                                ArgumentSpec.of("array", PolyType.vec(PolyType.var(A)))
                                        .requiring(elementTrait)
                                        .onElements())
                        .output(PolyType.var(A))
                        .build());
    }
}
