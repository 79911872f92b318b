package com.vulwitch.ast.model.preprocess;

import java.util.List;

import com.vulwitch.ast.model.AstNode;

/**
 * Opening group of a conditional section: {@code #if}, {@code #ifdef} or {@code #ifndef}
 * together with the items it guards.
 */
public sealed interface IfGroupDirective extends PreprocessNode permits IfDirective, IfdefDirective {

    /** Guarded items, or {@code null} when the group is empty. */
    List<AstNode> getGroup();
}
