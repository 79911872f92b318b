package com.vulwitch.ast.model.expression;

import java.util.List;

import com.vulwitch.ast.location.CodeRange;
import com.vulwitch.ast.model.AstVisitor;

import lombok.NonNull;
import lombok.Value;

@Value
public class CallExpression implements Expression {
    @NonNull
    CodeRange range;
    @NonNull
    Expression function;
    @NonNull
    List<Expression> arguments;

    @Override
    public <R> R accept(AstVisitor<R> visitor) {
        return visitor.visit(this);
    }
}
