package com.vulwitch.ast.model;

import com.vulwitch.ast.location.CodeRange;

import lombok.NonNull;
import lombok.Value;

@Value
public class Identifier implements AstNode {
    @NonNull
    CodeRange range;
    @NonNull
    String name;

    @Override
    public <R> R accept(AstVisitor<R> visitor) {
        return visitor.visit(this);
    }
}
