package com.vulwitch.ast.model.declarator;

/**
 * Named declarators. The innermost declarator of any chain is an {@link IdentifierDeclarator}.
 */
public sealed interface Declarator extends ParameterDeclarator
        permits IdentifierDeclarator, PointerDeclarator, FunctionDeclarator, ArrayDeclarator,
        ParenthesizedDeclarator, InitDeclarator {
}
