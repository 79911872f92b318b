package com.vulwitch.ast.cst;

import com.vulwitch.ast.location.CodeLocation;

/**
 * Read-only view of one node of a concrete syntax tree. Any grammar engine that can expose
 * these properties can feed the lowering engine.
 */
public interface CstNode {

    /** The grammar's type tag, e.g. {@code declaration} or {@code ;}. */
    String getType();

    int getStartByte();

    int getEndByte();

    CodeLocation getStartPoint();

    CodeLocation getEndPoint();

    int getChildCount();

    CstNode getChild(int index);

    /** Whether this node's subtree contains a syntax error. */
    boolean hasError();

    /** The exact source text covered by this node. */
    String getText();
}
