package io.gambit.core.token;

/// Built-in token kinds, spelled as they appear in rule files.
public final class TokenKind {

    // Actions
    public static final String STRIKE = "Strike";
    public static final String HEAL = "Heal";
    public static final String CHECK = "Check";

    // Conditions
    public static final String TRUE_OR_FALSE_RANDOM = "TrueOrFalseRandom";
    public static final String GREATER_THAN = "GreaterThan";
    public static final String LESS_THAN = "LessThan";
    public static final String EQ = "Eq";

    // Values
    public static final String NUMBER = "Number";
    public static final String ACTING_CHARACTER = "ActingCharacter";
    public static final String CHARACTER_TO_HP = "CharacterToHp";
    public static final String CHARACTER_HP_TO_CHARACTER = "CharacterHpToCharacter";
    public static final String CHARACTER_TEAM = "CharacterTeam";
    public static final String HERO = "Hero";
    public static final String ENEMY = "Enemy";

    // Arrays
    public static final String ALL_CHARACTERS = "AllCharacters";
    public static final String TEAM_MEMBERS = "TeamMembers";
    public static final String ALL_TEAM_SIDES = "AllTeamSides";
    public static final String FILTER_LIST = "FilterList";
    public static final String MAP = "Map";
    public static final String RANDOM_PICK = "RandomPick";
    public static final String MAX = "Max";
    public static final String MIN = "Min";
    public static final String NUMERIC_MAX = "NumericMax";
    public static final String NUMERIC_MIN = "NumericMin";
    public static final String COUNT = "Count";

    // Context
    public static final String ELEMENT = "Element";

    private TokenKind() {}
}
