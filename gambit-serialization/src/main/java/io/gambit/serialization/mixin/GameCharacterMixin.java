package io.gambit.serialization.mixin;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/// Jackson mixin that keeps the derived `isAlive()` flag out of character JSON.
///
/// Applied to `GameCharacter.class` via `GambitJacksonModule.setupModule()`. Without it the
/// boolean accessor is picked up as an `alive` property and written next to the record
/// components.
///
/// @see io.gambit.serialization.GambitJacksonModule
@JsonIgnoreProperties(value = {"alive"}, ignoreUnknown = true)
public abstract class GameCharacterMixin {}
