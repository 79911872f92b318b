package com.vulwitch.ast.model.specifier;

import com.vulwitch.ast.location.CodeRange;
import com.vulwitch.ast.model.AstVisitor;

import lombok.NonNull;
import lombok.Value;

/**
 * A compiler extension appearing among declaration specifiers.
 */
@Value
public class ExtendedDeclarationSpecifier implements DeclarationSpecifier {
    @NonNull
    CodeRange range;
    @NonNull
    Attribute attribute;

    @Override
    public <R> R accept(AstVisitor<R> visitor) {
        return visitor.visit(this);
    }
}
