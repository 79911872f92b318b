package com.vulwitch.ast.model.initializer;

import com.vulwitch.ast.location.CodeRange;
import com.vulwitch.ast.model.AstVisitor;
import com.vulwitch.ast.model.expression.Expression;

import lombok.NonNull;
import lombok.Value;

/**
 * GNU range designator {@code [from ... to]}.
 */
@Value
public class RangeDesignator implements Designator {
    @NonNull
    CodeRange range;
    @NonNull
    Expression from;
    @NonNull
    Expression to;

    @Override
    public <R> R accept(AstVisitor<R> visitor) {
        return visitor.visit(this);
    }
}
