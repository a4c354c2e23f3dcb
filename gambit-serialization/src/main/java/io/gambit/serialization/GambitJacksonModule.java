package io.gambit.serialization;

import com.fasterxml.jackson.databind.module.SimpleModule;
import io.gambit.core.battle.BattleView;
import io.gambit.core.battle.GameCharacter;
import io.gambit.core.runtime.Action;
import io.gambit.core.token.Token;
import io.gambit.serialization.mixin.GameCharacterMixin;
import java.io.Serial;

/// Jackson `SimpleModule` that registers all Gambit serialization configuration in one place.
///
/// Custom serializer/deserializer pairs:
/// - `Token`: `TokenSerializer` / `TokenDeserializer`, discriminator `"type"`
/// - `Action`: `ActionSerializer` / `ActionDeserializer`, discriminator `"type"`
/// - `BattleView`: `BattleViewSerializer` / `BattleViewDeserializer`, which store the acting
///   character by id
///
/// `Team` and `GameCharacter` are plain records and bind through Jackson's record support;
/// `GameCharacterMixin` hides the derived `alive` property.
///
/// @see RuleSerializer for the convenience factory API
public class GambitJacksonModule extends SimpleModule {

    @Serial private static final long serialVersionUID = 4610893302517740271L;

    public GambitJacksonModule() {
        super("GambitJacksonModule");

        addSerializer(Token.class, new TokenSerializer());
        addDeserializer(Token.class, new TokenDeserializer());

        addSerializer(Action.class, new ActionSerializer());
        addDeserializer(Action.class, new ActionDeserializer());

        addSerializer(BattleView.class, new BattleViewSerializer());
        addDeserializer(BattleView.class, new BattleViewDeserializer());
    }

    /// Applies mixin annotations to core records.
    ///
    /// @param context the setup context provided by Jackson, not null
    @Override
    public void setupModule(SetupContext context) {
        super.setupModule(context);

        context.setMixInAnnotations(GameCharacter.class, GameCharacterMixin.class);
    }
}
