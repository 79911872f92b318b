package com.vulwitch.ast.model.declarator;

import com.vulwitch.ast.location.CodeRange;
import com.vulwitch.ast.model.AstVisitor;

import lombok.NonNull;
import lombok.Value;

@Value
public class ArrayDeclarator implements Declarator {
    @NonNull
    CodeRange range;
    @NonNull
    Declarator declarator;
    @NonNull
    ArraySize arraySize;

    @Override
    public <R> R accept(AstVisitor<R> visitor) {
        return visitor.visit(this);
    }
}
