package com.vulwitch.ast.model.struct;

import java.util.List;

import com.vulwitch.ast.location.CodeRange;
import com.vulwitch.ast.model.AstVisitor;
import com.vulwitch.ast.model.specifier.Attribute;
import com.vulwitch.ast.model.specifier.SpecifierQualifier;

import lombok.NonNull;
import lombok.Value;

/**
 * An ordinary field declaration such as {@code unsigned int a : 3, *b;}.
 * {@code declarators} is null for an anonymous struct or union member.
 */
@Value
public class StructField implements StructDeclaration {
    @NonNull
    CodeRange range;
    @NonNull
    List<SpecifierQualifier> specifierQualifiers;
    List<StructDeclarator> declarators;
    Attribute attribute;

    @Override
    public <R> R accept(AstVisitor<R> visitor) {
        return visitor.visit(this);
    }
}
