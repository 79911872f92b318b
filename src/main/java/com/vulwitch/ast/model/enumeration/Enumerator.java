package com.vulwitch.ast.model.enumeration;

import com.vulwitch.ast.location.CodeRange;
import com.vulwitch.ast.model.AstVisitor;
import com.vulwitch.ast.model.Identifier;
import com.vulwitch.ast.model.expression.Expression;

import lombok.NonNull;
import lombok.Value;

/**
 * {@code NAME} or {@code NAME = expression}.
 */
@Value
public class Enumerator implements EnumeratorListItem {
    @NonNull
    CodeRange range;
    @NonNull
    Identifier identifier;
    Expression expression;

    @Override
    public <R> R accept(AstVisitor<R> visitor) {
        return visitor.visit(this);
    }
}
