package com.vulwitch.ast.model.struct;

import java.util.List;

import com.vulwitch.ast.model.AstNode;

/**
 * One branch of a conditional group inside a struct body.
 */
public sealed interface MacroStructDeclarationGroup extends AstNode
        permits MacroStructDeclarationOpeningGroup, MacroStructDeclarationElifGroup, MacroStructDeclarationElseGroup {

    /** Guarded fields, or {@code null} when the branch is empty. */
    List<StructDeclaration> getDeclarations();
}
