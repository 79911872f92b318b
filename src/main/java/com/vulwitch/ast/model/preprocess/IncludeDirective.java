package com.vulwitch.ast.model.preprocess;

import com.vulwitch.ast.location.CodeRange;
import com.vulwitch.ast.model.AstVisitor;

import lombok.NonNull;
import lombok.Value;

/**
 * {@code #include} directive. For {@link IncludeTargetType#CALL_EXPRESSION} targets
 * {@code callExpression} is set and {@code target} is null; otherwise {@code target} holds the
 * raw target text, delimiters included.
 */
@Value
public class IncludeDirective implements PreprocessNode {
    @NonNull
    CodeRange range;
    @NonNull
    IncludeTargetType targetType;
    String target;
    PreprocessCallExpression callExpression;

    @Override
    public <R> R accept(AstVisitor<R> visitor) {
        return visitor.visit(this);
    }
}
