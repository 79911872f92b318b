package com.vulwitch.ast.cst.treesitter;

import org.treesitter.TSNode;
import org.treesitter.TSPoint;

import com.vulwitch.ast.cst.CstNode;
import com.vulwitch.ast.location.CodeLocation;

/**
 * Adapts a tree-sitter {@link TSNode} to the {@link CstNode} view.
 */
final class TreeSitterCstNode implements CstNode {

    private final TSNode node;
    private final TreeSitterSyntaxTree tree;

    TreeSitterCstNode(TSNode node, TreeSitterSyntaxTree tree) {
        this.node = node;
        this.tree = tree;
    }

    @Override
    public String getType() {
        return node.getType();
    }

    @Override
    public int getStartByte() {
        return node.getStartByte();
    }

    @Override
    public int getEndByte() {
        return node.getEndByte();
    }

    @Override
    public CodeLocation getStartPoint() {
        return toLocation(node.getStartPoint());
    }

    @Override
    public CodeLocation getEndPoint() {
        return toLocation(node.getEndPoint());
    }

    @Override
    public int getChildCount() {
        return node.getChildCount();
    }

    @Override
    public CstNode getChild(int index) {
        return new TreeSitterCstNode(node.getChild(index), tree);
    }

    @Override
    public boolean hasError() {
        return node.hasError();
    }

    @Override
    public String getText() {
        return tree.slice(node.getStartByte(), node.getEndByte());
    }

    @Override
    public String toString() {
        return node.getType() + " [" + getStartPoint() + " - " + getEndPoint() + "]";
    }

    private static CodeLocation toLocation(TSPoint point) {
        return CodeLocation.of(point.getRow(), point.getColumn());
    }
}
