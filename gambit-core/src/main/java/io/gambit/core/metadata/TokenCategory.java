package io.gambit.core.metadata;

/// Groups token kinds for diagnostics and documentation.
public enum TokenCategory {
    ACTION("Actions"),
    CONDITION("Conditions"),
    VALUE("Values"),
    ARRAY("Arrays"),
    CONTEXT("Context");

    private final String label;

    TokenCategory(String label) {
        this.label = label;
    }

    public String getLabel() {
        return label;
    }
}
