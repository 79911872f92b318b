package com.vulwitch.ast.model.struct;

import java.util.List;

import com.vulwitch.ast.location.CodeRange;
import com.vulwitch.ast.model.AstVisitor;
import com.vulwitch.ast.model.preprocess.PreprocessExpression;

import lombok.NonNull;
import lombok.Value;

@Value
public class MacroStructDeclarationIfGroup implements MacroStructDeclarationOpeningGroup {
    @NonNull
    CodeRange range;
    @NonNull
    PreprocessExpression condition;
    List<StructDeclaration> declarations;

    @Override
    public <R> R accept(AstVisitor<R> visitor) {
        return visitor.visit(this);
    }
}
