package com.vulwitch.ast.model.expression;

public enum UnaryOperator {
    NOT("!"),
    BITWISE_NOT("~"),
    MINUS("-"),
    PLUS("+"),
    DEREFERENCE("*"),
    ADDRESS_OF("&");

    private final String symbol;

    UnaryOperator(String symbol) {
        this.symbol = symbol;
    }

    public String getSymbol() {
        return symbol;
    }

    public static UnaryOperator fromSymbol(String symbol) {
        for (UnaryOperator operator : values()) {
            if (operator.symbol.equals(symbol)) {
                return operator;
            }
        }
        return null;
    }
}
