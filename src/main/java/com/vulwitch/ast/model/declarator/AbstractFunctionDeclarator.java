package com.vulwitch.ast.model.declarator;

import java.util.List;

import com.vulwitch.ast.location.CodeRange;
import com.vulwitch.ast.model.AstVisitor;

import lombok.NonNull;
import lombok.Value;

@Value
public class AbstractFunctionDeclarator implements AbstractDeclarator {
    @NonNull
    CodeRange range;
    AbstractDeclarator declarator;
    List<ParameterDeclaration> parameters;
    boolean isVariadic;

    @Override
    public <R> R accept(AstVisitor<R> visitor) {
        return visitor.visit(this);
    }
}
