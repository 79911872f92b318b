package com.vulwitch.ast.model.declarator;

import java.util.List;

import com.vulwitch.ast.location.CodeRange;
import com.vulwitch.ast.model.AstNode;
import com.vulwitch.ast.model.AstVisitor;
import com.vulwitch.ast.model.specifier.Attribute;
import com.vulwitch.ast.model.specifier.DeclarationSpecifier;

import lombok.NonNull;
import lombok.Value;

/**
 * One parameter of a function declarator. The declarator is named, abstract, or absent
 * ({@code void}, {@code int}).
 */
@Value
public class ParameterDeclaration implements AstNode {
    @NonNull
    CodeRange range;
    @NonNull
    List<DeclarationSpecifier> specifiers;
    ParameterDeclarator declarator;
    List<Attribute> attributes;

    @Override
    public <R> R accept(AstVisitor<R> visitor) {
        return visitor.visit(this);
    }
}
