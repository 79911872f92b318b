package com.vulwitch.ast.model.preprocess;

public enum PreprocessPrimitiveType {
    IDENTIFIER,
    NUMBER_LITERAL,
    CHAR_LITERAL;

    public static PreprocessPrimitiveType fromNodeType(String nodeType) {
        return switch (nodeType) {
            case "identifier" -> IDENTIFIER;
            case "number_literal" -> NUMBER_LITERAL;
            case "char_literal" -> CHAR_LITERAL;
            default -> null;
        };
    }
}
