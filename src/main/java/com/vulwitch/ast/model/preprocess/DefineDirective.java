package com.vulwitch.ast.model.preprocess;

import com.vulwitch.ast.location.CodeRange;
import com.vulwitch.ast.model.AstVisitor;

import lombok.NonNull;
import lombok.Value;

/**
 * Object-like macro: {@code #define NAME replacement}. The replacement is kept as raw text.
 */
@Value
public class DefineDirective implements PreprocessNode {
    @NonNull
    CodeRange range;
    @NonNull
    String identifier;
    String replacement;

    @Override
    public <R> R accept(AstVisitor<R> visitor) {
        return visitor.visit(this);
    }
}
