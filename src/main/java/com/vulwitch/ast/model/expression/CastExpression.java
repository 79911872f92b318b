package com.vulwitch.ast.model.expression;

import com.vulwitch.ast.location.CodeRange;
import com.vulwitch.ast.model.AstVisitor;
import com.vulwitch.ast.model.declarator.TypeName;

import lombok.NonNull;
import lombok.Value;

@Value
public class CastExpression implements Expression {
    @NonNull
    CodeRange range;
    @NonNull
    TypeName typeName;
    @NonNull
    Expression operand;

    @Override
    public <R> R accept(AstVisitor<R> visitor) {
        return visitor.visit(this);
    }
}
