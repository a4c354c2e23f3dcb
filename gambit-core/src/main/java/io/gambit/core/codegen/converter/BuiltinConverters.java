package io.gambit.core.codegen.converter;

import io.gambit.core.GambitConfig;
import io.gambit.core.battle.TeamSide;
import io.gambit.core.codegen.ConverterRegistry;
import io.gambit.core.runtime.ValueType;
import io.gambit.core.runtime.node.ActingCharacterNode;
import io.gambit.core.runtime.node.AllCharactersNode;
import io.gambit.core.runtime.node.CharacterHpToCharacterNode;
import io.gambit.core.runtime.node.CharacterTeamNode;
import io.gambit.core.runtime.node.CharacterToHpNode;
import io.gambit.core.runtime.node.Comparison;
import io.gambit.core.runtime.node.ConstantNode;
import io.gambit.core.runtime.node.ExtremumNode;
import io.gambit.core.runtime.node.RandomConditionNode;
import io.gambit.core.runtime.node.TeamMembersNode;
import io.gambit.core.token.TokenKind;
import java.util.List;

/// Registers the converters for every built-in token kind.
///
/// List combinators (`FilterList`, `Map`, `RandomPick`, `Element`) are registered for each of
/// {@link ValueType#elementTypes()}; `Max` and `Min` for the ordered types `I32`, `CharacterHP`
/// and `Character`; `NumericMax` and `NumericMin` for the numeric ones; `Eq` for each scalar
/// type.
public final class BuiltinConverters {

    private BuiltinConverters() {}

    /// Registers all built-in converters.
    ///
    /// @param registry target registry, not null
    /// @param config heal cost and random probability, not null
    public static void registerAll(ConverterRegistry registry, GambitConfig config) {
        registerActions(registry, config);
        registerConditions(registry, config);
        registerValues(registry);
        registerArrays(registry);
    }

    private static void registerActions(ConverterRegistry registry, GambitConfig config) {
        registry.register(new StrikeConverter());
        registry.register(new HealConverter(config.getHealCost()));
        registry.register(new CheckConverter());
    }

    private static void registerConditions(ConverterRegistry registry, GambitConfig config) {
        double probability = config.getRandomConditionProbability();
        registry.register(
                new SimpleConverter<>(
                        TokenKind.TRUE_OR_FALSE_RANDOM,
                        ValueType.BOOLEAN,
                        (ast, converters) -> new RandomConditionNode(probability)));
        registry.register(new ComparisonConverter(TokenKind.GREATER_THAN, Comparison.GREATER_THAN));
        registry.register(new ComparisonConverter(TokenKind.LESS_THAN, Comparison.LESS_THAN));
        for (ValueType<?> scalar : ValueType.scalars()) {
            registry.register(new EqualityConverter<>(scalar));
        }
    }

    private static void registerValues(ConverterRegistry registry) {
        registry.register(new NumberConverter());
        registry.register(
                new SimpleConverter<>(
                        TokenKind.ACTING_CHARACTER,
                        ValueType.CHARACTER,
                        (ast, converters) -> new ActingCharacterNode()));
        registry.register(
                new SimpleConverter<>(
                        TokenKind.CHARACTER_TO_HP,
                        ValueType.CHARACTER_HP,
                        (ast, converters) ->
                                new CharacterToHpNode(
                                        converters.convertChild(
                                                ast, "character", ValueType.CHARACTER))));
        registry.register(
                new SimpleConverter<>(
                        TokenKind.CHARACTER_HP_TO_CHARACTER,
                        ValueType.CHARACTER,
                        (ast, converters) ->
                                new CharacterHpToCharacterNode(
                                        converters.convertChild(
                                                ast, "character_hp", ValueType.CHARACTER_HP))));
        registry.register(
                new SimpleConverter<>(
                        TokenKind.CHARACTER_TEAM,
                        ValueType.TEAM_SIDE,
                        (ast, converters) ->
                                new CharacterTeamNode(
                                        converters.convertChild(
                                                ast, "character", ValueType.CHARACTER))));
        registry.register(
                new SimpleConverter<>(
                        TokenKind.HERO,
                        ValueType.TEAM_SIDE,
                        (ast, converters) -> new ConstantNode<>(TeamSide.PLAYER)));
        registry.register(
                new SimpleConverter<>(
                        TokenKind.ENEMY,
                        ValueType.TEAM_SIDE,
                        (ast, converters) -> new ConstantNode<>(TeamSide.ENEMY)));
    }

    private static void registerArrays(ConverterRegistry registry) {
        registry.register(
                new SimpleConverter<>(
                        TokenKind.ALL_CHARACTERS,
                        ValueType.sequenceOf(ValueType.CHARACTER),
                        (ast, converters) -> new AllCharactersNode()));
        registry.register(
                new SimpleConverter<>(
                        TokenKind.TEAM_MEMBERS,
                        ValueType.sequenceOf(ValueType.CHARACTER),
                        (ast, converters) ->
                                new TeamMembersNode(
                                        converters.convertChild(
                                                ast, "team_side", ValueType.TEAM_SIDE))));
        registry.register(
                new SimpleConverter<>(
                        TokenKind.ALL_TEAM_SIDES,
                        ValueType.sequenceOf(ValueType.TEAM_SIDE),
                        (ast, converters) ->
                                new ConstantNode<>(List.of(TeamSide.PLAYER, TeamSide.ENEMY))));
        for (ValueType<?> elementType : ValueType.elementTypes()) {
            registerCombinators(registry, elementType);
        }
        for (ValueType<?> ordered :
                List.of(ValueType.INTEGER, ValueType.CHARACTER_HP, ValueType.CHARACTER)) {
            registerOrdered(registry, ordered);
        }
        for (ValueType<?> numeric : List.of(ValueType.INTEGER, ValueType.CHARACTER_HP)) {
            registerNumeric(registry, numeric);
        }
        registry.register(new CountConverter());
    }

    private static <T> void registerCombinators(ConverterRegistry registry, ValueType<T> type) {
        registry.register(new FilterListConverter<>(type));
        registry.register(new MapConverter<>(type));
        registry.register(new RandomPickConverter<>(type));
        registry.register(new ElementConverter<>(type));
    }

    private static <T> void registerOrdered(ConverterRegistry registry, ValueType<T> type) {
        registry.register(new ExtremumConverter<>(TokenKind.MAX, ExtremumNode.Direction.MAX, type));
        registry.register(new ExtremumConverter<>(TokenKind.MIN, ExtremumNode.Direction.MIN, type));
    }

    private static <T> void registerNumeric(ConverterRegistry registry, ValueType<T> type) {
        registry.register(
                new ExtremumConverter<>(TokenKind.NUMERIC_MAX, ExtremumNode.Direction.MAX, type));
        registry.register(
                new ExtremumConverter<>(TokenKind.NUMERIC_MIN, ExtremumNode.Direction.MIN, type));
    }
}
