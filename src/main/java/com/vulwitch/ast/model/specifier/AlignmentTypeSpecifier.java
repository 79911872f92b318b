package com.vulwitch.ast.model.specifier;

import com.vulwitch.ast.location.CodeRange;
import com.vulwitch.ast.model.AstVisitor;
import com.vulwitch.ast.model.declarator.TypeName;

import lombok.NonNull;
import lombok.Value;

@Value
public class AlignmentTypeSpecifier implements AlignmentSpecifier {
    @NonNull
    CodeRange range;
    @NonNull
    TypeName typeName;

    @Override
    public <R> R accept(AstVisitor<R> visitor) {
        return visitor.visit(this);
    }
}
