package com.vulwitch.ast.model.declarator;

import java.util.List;

import com.vulwitch.ast.location.CodeRange;
import com.vulwitch.ast.model.AstVisitor;
import com.vulwitch.ast.model.specifier.TypeQualifier;

import lombok.NonNull;
import lombok.Value;

/**
 * {@code * qualifiers declarator}. {@code int *const *p} is two of these nested.
 */
@Value
public class PointerDeclarator implements Declarator {
    @NonNull
    CodeRange range;
    List<TypeQualifier> qualifiers;
    @NonNull
    Declarator declarator;

    @Override
    public <R> R accept(AstVisitor<R> visitor) {
        return visitor.visit(this);
    }
}
