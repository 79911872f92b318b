package com.vulwitch.ast.model.expression;

import java.util.List;

import com.vulwitch.ast.location.CodeRange;
import com.vulwitch.ast.model.AstVisitor;

import lombok.NonNull;
import lombok.Value;

/**
 * One string literal or several adjacent ones ({@code "a" "b"}), each kept with its quotes
 * and prefix.
 */
@Value
public class StringLiteralExpression implements Expression {
    @NonNull
    CodeRange range;
    @NonNull
    List<String> literals;

    @Override
    public <R> R accept(AstVisitor<R> visitor) {
        return visitor.visit(this);
    }
}
