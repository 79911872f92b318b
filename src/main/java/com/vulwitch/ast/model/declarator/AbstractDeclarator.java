package com.vulwitch.ast.model.declarator;

/**
 * Unnamed declarators, as used in type names and prototype parameters.
 */
public sealed interface AbstractDeclarator extends ParameterDeclarator
        permits AbstractPointerDeclarator, AbstractFunctionDeclarator, AbstractArrayDeclarator,
        AbstractParenthesizedDeclarator {
}
