package edu.cmu.cs.lti.arcstandard.parser;

public enum Action {
    SHIFT("SH"),
    LA("LA"),
    RA("RA");

    private final String symbol;

    Action(String symbol) {
        this.symbol = symbol;
    }

    public String getSymbol() {
        return symbol;
    }

    public boolean isArc() {
        return this != SHIFT;
    }
}
