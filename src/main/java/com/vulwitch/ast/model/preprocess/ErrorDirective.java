package com.vulwitch.ast.model.preprocess;

import com.vulwitch.ast.location.CodeRange;
import com.vulwitch.ast.model.AstVisitor;

import lombok.NonNull;
import lombok.Value;

@Value
public class ErrorDirective implements PreprocessNode {
    @NonNull
    CodeRange range;
    String message;

    @Override
    public <R> R accept(AstVisitor<R> visitor) {
        return visitor.visit(this);
    }
}
