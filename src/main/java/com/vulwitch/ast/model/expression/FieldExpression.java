package com.vulwitch.ast.model.expression;

import com.vulwitch.ast.location.CodeRange;
import com.vulwitch.ast.model.AstVisitor;
import com.vulwitch.ast.model.Identifier;

import lombok.NonNull;
import lombok.Value;

/**
 * {@code operand.field}, or {@code operand->field} when {@code isArrow}.
 */
@Value
public class FieldExpression implements Expression {
    @NonNull
    CodeRange range;
    @NonNull
    Expression operand;
    boolean isArrow;
    @NonNull
    Identifier field;

    @Override
    public <R> R accept(AstVisitor<R> visitor) {
        return visitor.visit(this);
    }
}
