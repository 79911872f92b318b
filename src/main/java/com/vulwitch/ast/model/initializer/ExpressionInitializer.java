package com.vulwitch.ast.model.initializer;

import com.vulwitch.ast.location.CodeRange;
import com.vulwitch.ast.model.AstVisitor;
import com.vulwitch.ast.model.expression.Expression;

import lombok.NonNull;
import lombok.Value;

@Value
public class ExpressionInitializer implements Initializer {
    @NonNull
    CodeRange range;
    @NonNull
    Expression expression;

    @Override
    public <R> R accept(AstVisitor<R> visitor) {
        return visitor.visit(this);
    }
}
