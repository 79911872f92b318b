package com.vulwitch.ast.model.enumeration;

public sealed interface MacroEnumeratorOpeningGroup extends MacroEnumeratorGroup
        permits MacroEnumeratorIfGroup, MacroEnumeratorIfdefGroup {
}
