package com.name.suggestion.context;

/**
 * Where a candidate symbol comes from, relative to the place the unknown name was written.
 * Closer origins receive a larger ranking bonus.
 */
public enum SymbolOrigin {
    LOCAL_SCOPE(0.3),
    CURRENT_CLASS(0.2),
    CURRENT_PROJECT(0.1),
    EXTERNAL_LIBRARY(0.0);

    private final double bonus;

    SymbolOrigin(double bonus) {
        this.bonus = bonus;
    }

    public double bonus() {
        return bonus;
    }
}
