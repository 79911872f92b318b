package com.vulwitch.ast.model.specifier;

import com.vulwitch.ast.location.CodeRange;
import com.vulwitch.ast.model.AstVisitor;
import com.vulwitch.ast.model.Identifier;
import com.vulwitch.ast.model.declarator.TypeName;

import lombok.NonNull;
import lombok.Value;

/**
 * A macro applied to a type name, e.g. {@code LIST_OF(int)}.
 */
@Value
public class MacroTypeSpecifier implements TypeSpecifier {
    @NonNull
    CodeRange range;
    @NonNull
    Identifier identifier;
    @NonNull
    TypeName typeName;

    @Override
    public <R> R accept(AstVisitor<R> visitor) {
        return visitor.visit(this);
    }
}
