package com.vulwitch.ast.model;

import com.vulwitch.ast.location.CodeRange;

/**
 * Base of every AST node. Nodes are immutable values compared structurally; each one owns
 * the source range it was lowered from and exclusively owns its children.
 */
public interface AstNode {

    CodeRange getRange();

    <R> R accept(AstVisitor<R> visitor);
}
