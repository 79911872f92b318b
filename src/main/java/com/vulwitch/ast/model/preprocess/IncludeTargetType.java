package com.vulwitch.ast.model.preprocess;

/**
 * The four shapes an {@code #include} target can take.
 */
public enum IncludeTargetType {
    /** {@code #include <stdio.h>} */
    SYSTEM_LIB_STRING("system_lib_string"),
    /** {@code #include "local.h"} */
    STRING_LITERAL("string_literal"),
    /** {@code #include HEADER} */
    IDENTIFIER("identifier"),
    /** {@code #include MAKE_HEADER(x)} */
    CALL_EXPRESSION("call_expression");

    private final String nodeType;

    IncludeTargetType(String nodeType) {
        this.nodeType = nodeType;
    }

    public String getNodeType() {
        return nodeType;
    }

    public static IncludeTargetType fromNodeType(String nodeType) {
        return switch (nodeType) {
            case "system_lib_string" -> SYSTEM_LIB_STRING;
            case "string_literal" -> STRING_LITERAL;
            case "identifier" -> IDENTIFIER;
            case "call_expression", "preproc_call_expression" -> CALL_EXPRESSION;
            default -> null;
        };
    }
}
