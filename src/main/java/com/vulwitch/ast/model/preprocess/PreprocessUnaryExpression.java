package com.vulwitch.ast.model.preprocess;

import com.vulwitch.ast.location.CodeRange;
import com.vulwitch.ast.model.AstVisitor;

import lombok.NonNull;
import lombok.Value;

@Value
public class PreprocessUnaryExpression implements PreprocessExpression {
    @NonNull
    CodeRange range;
    @NonNull
    PreprocessUnaryOperator operator;
    @NonNull
    PreprocessExpression operand;

    @Override
    public <R> R accept(AstVisitor<R> visitor) {
        return visitor.visit(this);
    }
}
