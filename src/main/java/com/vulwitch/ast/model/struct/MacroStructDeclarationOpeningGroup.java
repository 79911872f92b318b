package com.vulwitch.ast.model.struct;

public sealed interface MacroStructDeclarationOpeningGroup extends MacroStructDeclarationGroup
        permits MacroStructDeclarationIfGroup, MacroStructDeclarationIfdefGroup {
}
