package com.vulwitch.ast.model.preprocess;

public enum PreprocessBinaryOperator {
    ADD("+"),
    SUBTRACT("-"),
    MULTIPLY("*"),
    DIVIDE("/"),
    MODULO("%"),
    LOGICAL_OR("||"),
    LOGICAL_AND("&&"),
    BITWISE_OR("|"),
    BITWISE_XOR("^"),
    BITWISE_AND("&"),
    EQUAL("=="),
    NOT_EQUAL("!="),
    GREATER(">"),
    GREATER_EQUAL(">="),
    LESS_EQUAL("<="),
    LESS("<"),
    LEFT_SHIFT("<<"),
    RIGHT_SHIFT(">>");

    private final String symbol;

    PreprocessBinaryOperator(String symbol) {
        this.symbol = symbol;
    }

    public String getSymbol() {
        return symbol;
    }

    public static PreprocessBinaryOperator fromSymbol(String symbol) {
        for (PreprocessBinaryOperator operator : values()) {
            if (operator.symbol.equals(symbol)) {
                return operator;
            }
        }
        return null;
    }
}
