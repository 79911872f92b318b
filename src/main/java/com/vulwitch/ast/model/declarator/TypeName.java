package com.vulwitch.ast.model.declarator;

import java.util.List;

import com.vulwitch.ast.location.CodeRange;
import com.vulwitch.ast.model.AstNode;
import com.vulwitch.ast.model.AstVisitor;
import com.vulwitch.ast.model.specifier.SpecifierQualifier;

import lombok.NonNull;
import lombok.Value;

/**
 * A type written without a name, as in casts, {@code sizeof} and {@code _Alignas}.
 */
@Value
public class TypeName implements AstNode {
    @NonNull
    CodeRange range;
    @NonNull
    List<SpecifierQualifier> specifierQualifiers;
    AbstractDeclarator declarator;

    @Override
    public <R> R accept(AstVisitor<R> visitor) {
        return visitor.visit(this);
    }
}
