package io.gambit.serialization;

import static io.gambit.core.token.Tokens.actingCharacter;
import static io.gambit.core.token.Tokens.allCharacters;
import static io.gambit.core.token.Tokens.check;
import static io.gambit.core.token.Tokens.element;
import static io.gambit.core.token.Tokens.filterList;
import static io.gambit.core.token.Tokens.greaterThan;
import static io.gambit.core.token.Tokens.number;
import static io.gambit.core.token.Tokens.randomPick;
import static io.gambit.core.token.Tokens.strike;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.fasterxml.jackson.databind.JsonNode;
import io.gambit.core.token.Token;
import java.util.LinkedHashMap;
import java.util.Map;
import org.junit.jupiter.api.Test;

class TokenJsonTest {

    @Test
    void shouldReadNestedOperandsAndLiterals() {
        // Given
        String json =
                """
                {
                  "type": "Check",
                  "condition": {
                    "type": "GreaterThan",
                    "left": {"type": "Number", "value": 3},
                    "right": {"type": "Number", "value": 2}
                  },
                  "then_action": {"type": "Strike", "target": {"type": "ActingCharacter"}}
                }
                """;

        // When
        Token token = RuleSerializer.tokenFromJson(json);

        // Then
        assertThat(token)
                .isEqualTo(check(greaterThan(number(3), number(2)), strike(actingCharacter())));
        assertThat(token.getArgument("condition").flatMap(c -> c.getArgument("left")))
                .flatMap(left -> left.getAttribute("value"))
                .contains(3);
    }

    @Test
    void shouldKeepNullOperandAsMissingSlot() {
        Token token = RuleSerializer.tokenFromJson("{\"type\": \"Strike\", \"target\": null}");

        assertThat(token.getArguments()).containsKey("target");
        assertThat(token.getArgument("target")).isEmpty();
    }

    @Test
    void shouldAcceptUnknownKinds() {
        Token token = RuleSerializer.tokenFromJson("{\"type\": \"Fireball\"}");

        assertThat(token).isEqualTo(Token.leaf("Fireball"));
    }

    @Test
    void shouldRejectMissingType() {
        assertThatThrownBy(() -> RuleSerializer.tokenFromJson("{\"target\": {\"type\": \"Hero\"}}"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageStartingWith("Failed to deserialize token")
                .hasMessageContaining("missing the \"type\" field");
    }

    @Test
    void shouldRejectMissingTypeInNestedToken() {
        assertThatThrownBy(
                        () ->
                                RuleSerializer.tokenFromJson(
                                        "{\"type\": \"Strike\", \"target\": {\"id\": 1}}"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("$.target");
    }

    @Test
    void shouldRejectArrayFields() {
        assertThatThrownBy(() -> RuleSerializer.tokenFromJson("{\"type\": \"Max\", \"array\": []}"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Unsupported value at $.array");
    }

    @Test
    void shouldWriteTypeDiscriminatorThenLiteralsThenOperands() throws Exception {
        // Given
        Token rule =
                strike(randomPick(filterList(allCharacters(), greaterThan(number(5), element()))));

        // When
        JsonNode json = RuleSerializer.createMapper().readTree(RuleSerializer.tokenToJson(rule));

        // Then
        JsonNode filter = json.get("target").get("array");
        assertThat(json.get("type").asText()).isEqualTo("Strike");
        assertThat(filter.get("type").asText()).isEqualTo("FilterList");
        assertThat(filter.get("condition").get("left").get("value").asInt()).isEqualTo(5);
        assertThat(filter.get("condition").get("right").get("type").asText())
                .isEqualTo("Element");
        assertThat(RuleSerializer.tokenFromJson(json.toString())).isEqualTo(rule);
    }

    @Test
    void shouldRefuseToWriteCyclicTree() {
        // Given
        Map<String, Token> arguments = new LinkedHashMap<>();
        Token loop = new Token("Check", arguments, Map.of());
        arguments.put("condition", loop);

        // When / Then
        assertThatThrownBy(() -> RuleSerializer.tokenToJson(loop))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Cyclic token tree at Check");
    }
}
