package com.vulwitch.ast.model.declarator;

import java.util.List;

import com.vulwitch.ast.location.CodeRange;
import com.vulwitch.ast.model.AstVisitor;
import com.vulwitch.ast.model.specifier.TypeQualifier;

import lombok.NonNull;
import lombok.Value;

@Value
public class AbstractPointerDeclarator implements AbstractDeclarator {
    @NonNull
    CodeRange range;
    List<TypeQualifier> qualifiers;
    AbstractDeclarator declarator;

    @Override
    public <R> R accept(AstVisitor<R> visitor) {
        return visitor.visit(this);
    }
}
