package com.vulwitch.ast.model;

import java.util.List;

import com.vulwitch.ast.location.CodeRange;

import lombok.NonNull;
import lombok.Value;

/**
 * Root of the AST for one source file: the ordered top-level declarations and directives.
 */
@Value
public class TranslationUnit implements AstNode {
    @NonNull
    CodeRange range;
    @NonNull
    List<AstNode> nodes;

    @Override
    public <R> R accept(AstVisitor<R> visitor) {
        return visitor.visit(this);
    }
}
