package com.vulwitch.ast.model.expression;

import com.vulwitch.ast.location.CodeRange;
import com.vulwitch.ast.model.AstVisitor;

import lombok.NonNull;
import lombok.Value;

@Value
public class BinaryExpression implements Expression {
    @NonNull
    CodeRange range;
    @NonNull
    BinaryOperator operator;
    @NonNull
    Expression lhs;
    @NonNull
    Expression rhs;

    @Override
    public <R> R accept(AstVisitor<R> visitor) {
        return visitor.visit(this);
    }
}
