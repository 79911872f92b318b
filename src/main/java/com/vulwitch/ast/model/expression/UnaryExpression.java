package com.vulwitch.ast.model.expression;

import com.vulwitch.ast.location.CodeRange;
import com.vulwitch.ast.model.AstVisitor;

import lombok.NonNull;
import lombok.Value;

@Value
public class UnaryExpression implements Expression {
    @NonNull
    CodeRange range;
    @NonNull
    UnaryOperator operator;
    @NonNull
    Expression operand;

    @Override
    public <R> R accept(AstVisitor<R> visitor) {
        return visitor.visit(this);
    }
}
