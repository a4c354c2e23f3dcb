package io.gambit.core.token;

import java.util.LinkedHashMap;
import java.util.Map;

/// Factory methods for building rule trees in code.
///
/// {@snippet :
/// Token rule = Tokens.check(
///         Tokens.greaterThan(Tokens.characterToHp(Tokens.actingCharacter()), Tokens.number(50)),
///         Tokens.strike(Tokens.randomPick(Tokens.teamMembers(Tokens.enemy()))));
/// }
public final class Tokens {

    private Tokens() {}

    public static Token strike(Token target) {
        return unary(TokenKind.STRIKE, "target", target);
    }

    public static Token heal(Token target) {
        return unary(TokenKind.HEAL, "target", target);
    }

    public static Token check(Token condition, Token thenAction) {
        return binary(TokenKind.CHECK, "condition", condition, "then_action", thenAction);
    }

    public static Token trueOrFalseRandom() {
        return Token.leaf(TokenKind.TRUE_OR_FALSE_RANDOM);
    }

    public static Token greaterThan(Token left, Token right) {
        return binary(TokenKind.GREATER_THAN, "left", left, "right", right);
    }

    public static Token lessThan(Token left, Token right) {
        return binary(TokenKind.LESS_THAN, "left", left, "right", right);
    }

    public static Token eq(Token left, Token right) {
        return binary(TokenKind.EQ, "left", left, "right", right);
    }

    public static Token number(int value) {
        return new Token(TokenKind.NUMBER, Map.of(), Map.of("value", value));
    }

    public static Token actingCharacter() {
        return Token.leaf(TokenKind.ACTING_CHARACTER);
    }

    public static Token characterToHp(Token character) {
        return unary(TokenKind.CHARACTER_TO_HP, "character", character);
    }

    public static Token characterHpToCharacter(Token characterHp) {
        return unary(TokenKind.CHARACTER_HP_TO_CHARACTER, "character_hp", characterHp);
    }

    public static Token characterTeam(Token character) {
        return unary(TokenKind.CHARACTER_TEAM, "character", character);
    }

    public static Token hero() {
        return Token.leaf(TokenKind.HERO);
    }

    public static Token enemy() {
        return Token.leaf(TokenKind.ENEMY);
    }

    public static Token allCharacters() {
        return Token.leaf(TokenKind.ALL_CHARACTERS);
    }

    public static Token teamMembers(Token teamSide) {
        return unary(TokenKind.TEAM_MEMBERS, "team_side", teamSide);
    }

    public static Token allTeamSides() {
        return Token.leaf(TokenKind.ALL_TEAM_SIDES);
    }

    public static Token filterList(Token array, Token condition) {
        return binary(TokenKind.FILTER_LIST, "array", array, "condition", condition);
    }

    public static Token map(Token array, Token transform) {
        return binary(TokenKind.MAP, "array", array, "transform", transform);
    }

    public static Token randomPick(Token array) {
        return unary(TokenKind.RANDOM_PICK, "array", array);
    }

    public static Token max(Token array) {
        return unary(TokenKind.MAX, "array", array);
    }

    public static Token min(Token array) {
        return unary(TokenKind.MIN, "array", array);
    }

    public static Token numericMax(Token array) {
        return unary(TokenKind.NUMERIC_MAX, "array", array);
    }

    public static Token numericMin(Token array) {
        return unary(TokenKind.NUMERIC_MIN, "array", array);
    }

    public static Token count(Token array) {
        return unary(TokenKind.COUNT, "array", array);
    }

    public static Token element() {
        return Token.leaf(TokenKind.ELEMENT);
    }

    private static Token unary(String kind, String name, Token child) {
        Map<String, Token> arguments = new LinkedHashMap<>();
        arguments.put(name, child);
        return new Token(kind, arguments, Map.of());
    }

    private static Token binary(
            String kind, String firstName, Token first, String secondName, Token second) {
        Map<String, Token> arguments = new LinkedHashMap<>();
        arguments.put(firstName, first);
        arguments.put(secondName, second);
        return new Token(kind, arguments, Map.of());
    }
}
