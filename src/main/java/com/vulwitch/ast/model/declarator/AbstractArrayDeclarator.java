package com.vulwitch.ast.model.declarator;

import com.vulwitch.ast.location.CodeRange;
import com.vulwitch.ast.model.AstVisitor;

import lombok.NonNull;
import lombok.Value;

@Value
public class AbstractArrayDeclarator implements AbstractDeclarator {
    @NonNull
    CodeRange range;
    AbstractDeclarator declarator;
    @NonNull
    ArraySize arraySize;

    @Override
    public <R> R accept(AstVisitor<R> visitor) {
        return visitor.visit(this);
    }
}
