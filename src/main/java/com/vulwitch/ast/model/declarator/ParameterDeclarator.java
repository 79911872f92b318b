package com.vulwitch.ast.model.declarator;

import com.vulwitch.ast.model.AstNode;

/**
 * What may follow the specifiers of a parameter: a named or an abstract declarator.
 */
public sealed interface ParameterDeclarator extends AstNode permits Declarator, AbstractDeclarator {
}
