package com.vulwitch.ast.model.enumeration;

import java.util.List;

import com.vulwitch.ast.model.AstNode;

/**
 * One branch of a conditional group inside an enumerator list.
 */
public sealed interface MacroEnumeratorGroup extends AstNode
        permits MacroEnumeratorOpeningGroup, MacroEnumeratorElifGroup, MacroEnumeratorElseGroup {

    /** Guarded enumerators, or {@code null} when the branch is empty. */
    List<EnumeratorListItem> getEnumerators();
}
