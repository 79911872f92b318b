package com.vulwitch.ast.model.struct;

import java.util.List;

import com.vulwitch.ast.location.CodeRange;
import com.vulwitch.ast.model.AstVisitor;

import lombok.NonNull;
import lombok.Value;

@Value
public class MacroStructDeclarationElseGroup implements MacroStructDeclarationGroup {
    @NonNull
    CodeRange range;
    List<StructDeclaration> declarations;

    @Override
    public <R> R accept(AstVisitor<R> visitor) {
        return visitor.visit(this);
    }
}
