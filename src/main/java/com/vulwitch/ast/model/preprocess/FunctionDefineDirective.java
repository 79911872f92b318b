package com.vulwitch.ast.model.preprocess;

import java.util.List;

import com.vulwitch.ast.location.CodeRange;
import com.vulwitch.ast.model.AstVisitor;

import lombok.NonNull;
import lombok.Value;

/**
 * Function-like macro: {@code #define NAME(a, b, ...) replacement}.
 * {@code "..."} may only appear as the last parameter.
 */
@Value
public class FunctionDefineDirective implements PreprocessNode {
    @NonNull
    CodeRange range;
    @NonNull
    String identifier;
    @NonNull
    List<String> parameters;
    String replacement;

    public boolean isVariadic() {
        return !parameters.isEmpty() && "...".equals(parameters.get(parameters.size() - 1));
    }

    @Override
    public <R> R accept(AstVisitor<R> visitor) {
        return visitor.visit(this);
    }
}
