package com.vulwitch.ast.model.specifier;

import com.vulwitch.ast.model.AstNode;

/**
 * One element of a declaration-specifier sequence. C lets these appear in any order.
 */
public sealed interface DeclarationSpecifier extends AstNode
        permits StorageClassSpecifier, TypeQualifier, FunctionSpecifier, AlignmentSpecifier, TypeSpecifier,
        ExtendedDeclarationSpecifier {
}
