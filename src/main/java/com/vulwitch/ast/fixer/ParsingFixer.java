package com.vulwitch.ast.fixer;

import com.vulwitch.ast.cst.CstCursor;
import com.vulwitch.ast.cst.SyntaxTree;

/**
 * A strategy that proposes a textual repair for a CST node whose subtree contains a
 * syntax error.
 */
public interface ParsingFixer {

    /** The CST node type this fixer is registered under. */
    String nodeType();

    boolean canFix(SyntaxTree tree, CstCursor cursor);

    CodeFix fix(SyntaxTree tree, CstCursor cursor);
}
