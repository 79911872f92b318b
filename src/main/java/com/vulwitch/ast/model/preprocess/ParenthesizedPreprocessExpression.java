package com.vulwitch.ast.model.preprocess;

import com.vulwitch.ast.location.CodeRange;
import com.vulwitch.ast.model.AstVisitor;

import lombok.NonNull;
import lombok.Value;

@Value
public class ParenthesizedPreprocessExpression implements PreprocessExpression {
    @NonNull
    CodeRange range;
    @NonNull
    PreprocessExpression expression;

    @Override
    public <R> R accept(AstVisitor<R> visitor) {
        return visitor.visit(this);
    }
}
