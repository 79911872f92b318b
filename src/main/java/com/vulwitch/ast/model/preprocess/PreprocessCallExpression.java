package com.vulwitch.ast.model.preprocess;

import java.util.List;

import com.vulwitch.ast.location.CodeRange;
import com.vulwitch.ast.model.AstVisitor;

import lombok.NonNull;
import lombok.Value;

/**
 * A macro call in a condition or include target, e.g.
 * {@code VERSION(1, 2)}. Arguments keep source order; an empty argument list is an empty list.
 */
@Value
public class PreprocessCallExpression implements PreprocessExpression {
    @NonNull
    CodeRange range;
    @NonNull
    String callee;
    @NonNull
    List<PreprocessExpression> arguments;

    @Override
    public <R> R accept(AstVisitor<R> visitor) {
        return visitor.visit(this);
    }
}
