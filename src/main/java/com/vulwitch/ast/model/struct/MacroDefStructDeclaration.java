package com.vulwitch.ast.model.struct;

import com.vulwitch.ast.location.CodeRange;
import com.vulwitch.ast.model.AstVisitor;
import com.vulwitch.ast.model.preprocess.DefineDirective;

import lombok.NonNull;
import lombok.Value;

@Value
public class MacroDefStructDeclaration implements StructDeclaration {
    @NonNull
    CodeRange range;
    @NonNull
    DefineDirective define;

    @Override
    public <R> R accept(AstVisitor<R> visitor) {
        return visitor.visit(this);
    }
}
