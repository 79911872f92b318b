package com.vulwitch.ast.model.specifier;

import com.vulwitch.ast.model.AstNode;

/**
 * Element of a specifier-qualifier list (struct fields, type names).
 */
public sealed interface SpecifierQualifier extends AstNode permits TypeSpecifier, TypeQualifier {
}
