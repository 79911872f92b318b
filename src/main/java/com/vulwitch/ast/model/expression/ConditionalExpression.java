package com.vulwitch.ast.model.expression;

import com.vulwitch.ast.location.CodeRange;
import com.vulwitch.ast.model.AstVisitor;

import lombok.NonNull;
import lombok.Value;

/**
 * {@code condition ? consequence : alternative}. The consequence is null for the GNU
 * {@code a ?: b} form.
 */
@Value
public class ConditionalExpression implements Expression {
    @NonNull
    CodeRange range;
    @NonNull
    Expression condition;
    Expression consequence;
    @NonNull
    Expression alternative;

    @Override
    public <R> R accept(AstVisitor<R> visitor) {
        return visitor.visit(this);
    }
}
