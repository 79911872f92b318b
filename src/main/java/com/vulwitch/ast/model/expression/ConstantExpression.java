package com.vulwitch.ast.model.expression;

import com.vulwitch.ast.location.CodeRange;
import com.vulwitch.ast.model.AstVisitor;

import lombok.NonNull;
import lombok.Value;

/**
 * A literal constant, kept as its source text ({@code 0x1Fu}, {@code 'a'}).
 */
@Value
public class ConstantExpression implements Expression {
    @NonNull
    CodeRange range;
    @NonNull
    Kind kind;
    @NonNull
    String text;

    @Override
    public <R> R accept(AstVisitor<R> visitor) {
        return visitor.visit(this);
    }

    public enum Kind {
        NUMBER,
        CHAR,
        TRUE,
        FALSE,
        NULL
    }
}
