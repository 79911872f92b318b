package com.vulwitch.ast.model.declaration;

import com.vulwitch.ast.model.AstNode;

/**
 * Top-level C declarations.
 */
public sealed interface ExternalDeclaration extends AstNode permits Declaration, TypeDefinition {
}
