package com.vulwitch.ast.model.specifier;

import java.util.List;

import com.vulwitch.ast.location.CodeRange;
import com.vulwitch.ast.model.AstVisitor;
import com.vulwitch.ast.model.Identifier;
import com.vulwitch.ast.model.struct.StructDeclaration;

import lombok.NonNull;
import lombok.Value;

/**
 * {@code struct} or {@code union}, with a tag, a body, or both. {@code declarations} is null
 * for a forward reference such as {@code struct S} and empty for a body {@code {}}.
 */
@Value
public class StructOrUnionSpecifier implements TypeSpecifier {
    @NonNull
    CodeRange range;
    boolean isStruct;
    Identifier identifier;
    List<StructDeclaration> declarations;

    @Override
    public <R> R accept(AstVisitor<R> visitor) {
        return visitor.visit(this);
    }
}
