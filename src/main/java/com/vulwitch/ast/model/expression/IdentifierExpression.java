package com.vulwitch.ast.model.expression;

import com.vulwitch.ast.location.CodeRange;
import com.vulwitch.ast.model.AstVisitor;
import com.vulwitch.ast.model.Identifier;

import lombok.NonNull;
import lombok.Value;

@Value
public class IdentifierExpression implements Expression {
    @NonNull
    CodeRange range;
    @NonNull
    Identifier identifier;

    @Override
    public <R> R accept(AstVisitor<R> visitor) {
        return visitor.visit(this);
    }
}
