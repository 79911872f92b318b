package com.vulwitch.ast.model.preprocess;

import com.vulwitch.ast.location.CodeRange;
import com.vulwitch.ast.model.AstVisitor;

import lombok.NonNull;
import lombok.Value;

/**
 * {@code defined NAME} or {@code defined(NAME)}; both spellings lower to this node.
 */
@Value
public class PreprocessDefined implements PreprocessExpression {
    @NonNull
    CodeRange range;
    @NonNull
    String identifier;

    @Override
    public <R> R accept(AstVisitor<R> visitor) {
        return visitor.visit(this);
    }
}
