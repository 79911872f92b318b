package com.vulwitch.ast.model.declaration;

import java.util.List;

import com.vulwitch.ast.location.CodeRange;
import com.vulwitch.ast.model.AstVisitor;
import com.vulwitch.ast.model.declarator.Declarator;
import com.vulwitch.ast.model.specifier.SpecifierQualifier;

import lombok.NonNull;
import lombok.Value;

/**
 * {@code typedef qualifiers type qualifiers declarator, declarator;}.
 */
@Value
public class TypeDefinition implements ExternalDeclaration {
    @NonNull
    CodeRange range;
    @NonNull
    List<SpecifierQualifier> specifiers;
    @NonNull
    List<Declarator> declarators;

    @Override
    public <R> R accept(AstVisitor<R> visitor) {
        return visitor.visit(this);
    }
}
