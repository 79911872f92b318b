package com.vulwitch.ast.model.preprocess;

public enum PreprocessUnaryOperator {
    NOT("!"),
    BITWISE_NOT("~"),
    MINUS("-"),
    PLUS("+");

    private final String symbol;

    PreprocessUnaryOperator(String symbol) {
        this.symbol = symbol;
    }

    public String getSymbol() {
        return symbol;
    }

    public static PreprocessUnaryOperator fromSymbol(String symbol) {
        for (PreprocessUnaryOperator operator : values()) {
            if (operator.symbol.equals(symbol)) {
                return operator;
            }
        }
        return null;
    }
}
