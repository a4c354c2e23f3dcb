package io.gambit.core.type.traits;

/// Names of the built-in traits.
public final class Traits {

    public static final String NUMERIC = "Numeric";
    public static final String EQ = "Eq";
    public static final String ORD = "Ord";
    public static final String COLLECTION = "Collection";
    public static final String SHOW = "Show";

    private Traits() {}
}
