package com.vulwitch.ast.model.enumeration;

import com.vulwitch.ast.model.AstNode;

/**
 * One item of an enumerator list.
 */
public sealed interface EnumeratorListItem extends AstNode
        permits Enumerator, MacroDirectiveEnumerator, MacroConditionalEnumerator {
}
