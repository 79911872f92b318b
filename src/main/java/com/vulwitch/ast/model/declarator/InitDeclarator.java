package com.vulwitch.ast.model.declarator;

import com.vulwitch.ast.location.CodeRange;
import com.vulwitch.ast.model.AstVisitor;
import com.vulwitch.ast.model.initializer.Initializer;

import lombok.NonNull;
import lombok.Value;

/**
 * {@code declarator = initializer}. Only ever the outermost declarator of a declaration.
 */
@Value
public class InitDeclarator implements Declarator {
    @NonNull
    CodeRange range;
    @NonNull
    Declarator declarator;
    @NonNull
    Initializer initializer;

    @Override
    public <R> R accept(AstVisitor<R> visitor) {
        return visitor.visit(this);
    }
}
