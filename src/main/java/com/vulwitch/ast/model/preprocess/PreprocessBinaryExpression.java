package com.vulwitch.ast.model.preprocess;

import com.vulwitch.ast.location.CodeRange;
import com.vulwitch.ast.model.AstVisitor;

import lombok.NonNull;
import lombok.Value;

@Value
public class PreprocessBinaryExpression implements PreprocessExpression {
    @NonNull
    CodeRange range;
    @NonNull
    PreprocessBinaryOperator operator;
    @NonNull
    PreprocessExpression lhs;
    @NonNull
    PreprocessExpression rhs;

    @Override
    public <R> R accept(AstVisitor<R> visitor) {
        return visitor.visit(this);
    }
}
