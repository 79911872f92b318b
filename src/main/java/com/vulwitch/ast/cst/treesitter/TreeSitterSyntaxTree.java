package com.vulwitch.ast.cst.treesitter;

import java.nio.charset.StandardCharsets;

import org.treesitter.TSTree;

import com.vulwitch.ast.cst.CstNode;
import com.vulwitch.ast.cst.SyntaxTree;

/**
 * A tree-sitter parse of one C source file.
 */
public class TreeSitterSyntaxTree implements SyntaxTree {

    private final String file;
    private final byte[] source;
    private final TSTree tree;

    TreeSitterSyntaxTree(String file, byte[] source, TSTree tree) {
        this.file = file;
        this.source = source;
        this.tree = tree;
    }

    @Override
    public String getFile() {
        return file;
    }

    @Override
    public CstNode getRootNode() {
        return new TreeSitterCstNode(tree.getRootNode(), this);
    }

    @Override
    public byte[] getSource() {
        return source.clone();
    }

    String slice(int startByte, int endByte) {
        int start = Math.max(0, Math.min(startByte, source.length));
        int end = Math.max(start, Math.min(endByte, source.length));
        return new String(source, start, end - start, StandardCharsets.UTF_8);
    }
}
