package io.gambit.core.codegen;

import io.gambit.core.type.Type;

/// Lookup key of the converter registry.
record ConverterKey(Type outputType, String tokenKind) {}
