package com.vulwitch.ast.model.declarator;

import java.util.List;

import com.vulwitch.ast.location.CodeRange;
import com.vulwitch.ast.model.AstVisitor;

import lombok.NonNull;
import lombok.Value;

/**
 * {@code declarator(parameters)}. {@code f()} has no parameters; {@code f(void)} has one.
 */
@Value
public class FunctionDeclarator implements Declarator {
    @NonNull
    CodeRange range;
    @NonNull
    Declarator declarator;
    List<ParameterDeclaration> parameters;
    boolean isVariadic;

    @Override
    public <R> R accept(AstVisitor<R> visitor) {
        return visitor.visit(this);
    }
}
