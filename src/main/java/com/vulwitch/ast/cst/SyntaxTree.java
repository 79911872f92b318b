package com.vulwitch.ast.cst;

/**
 * A parsed source file: the CST root plus the path used for diagnostics.
 */
public interface SyntaxTree {

    String getFile();

    CstNode getRootNode();

    byte[] getSource();
}
