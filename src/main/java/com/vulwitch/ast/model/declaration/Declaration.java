package com.vulwitch.ast.model.declaration;

import java.util.List;

import com.vulwitch.ast.location.CodeRange;
import com.vulwitch.ast.model.AstVisitor;
import com.vulwitch.ast.model.declarator.Declarator;
import com.vulwitch.ast.model.specifier.DeclarationSpecifier;

import lombok.NonNull;
import lombok.Value;

/**
 * {@code specifiers declarator, declarator;}. A declaration that only introduces a tag, such
 * as {@code struct S {...};}, has no declarators.
 */
@Value
public class Declaration implements ExternalDeclaration {
    @NonNull
    CodeRange range;
    @NonNull
    List<DeclarationSpecifier> specifiers;
    List<Declarator> declarators;

    @Override
    public <R> R accept(AstVisitor<R> visitor) {
        return visitor.visit(this);
    }
}
