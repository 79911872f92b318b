package com.vulwitch.ast.model.struct;

import com.vulwitch.ast.model.AstNode;

/**
 * One item of a struct or union body: an ordinary field, a macro definition or directive that
 * sits between fields, or a conditional group of fields.
 */
public sealed interface StructDeclaration extends AstNode
        permits StructField, MacroDefStructDeclaration, MacroFunctionDefStructDeclaration,
        MacroDirectiveStructDeclaration, MacroConditionalStructDeclaration {
}
