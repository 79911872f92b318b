package com.vulwitch.ast.model.initializer;

import com.vulwitch.ast.location.CodeRange;
import com.vulwitch.ast.model.AstVisitor;
import com.vulwitch.ast.model.Identifier;

import lombok.NonNull;
import lombok.Value;

@Value
public class MemberDesignator implements Designator {
    @NonNull
    CodeRange range;
    @NonNull
    Identifier member;

    @Override
    public <R> R accept(AstVisitor<R> visitor) {
        return visitor.visit(this);
    }
}
