package com.vulwitch.ast.model.struct;

import com.vulwitch.ast.location.CodeRange;
import com.vulwitch.ast.model.AstVisitor;
import com.vulwitch.ast.model.preprocess.PreprocessNode;

import lombok.NonNull;
import lombok.Value;

/**
 * {@code #undef}, {@code #pragma}, {@code #error} or {@code #line} between fields.
 */
@Value
public class MacroDirectiveStructDeclaration implements StructDeclaration {
    @NonNull
    CodeRange range;
    @NonNull
    PreprocessNode directive;

    @Override
    public <R> R accept(AstVisitor<R> visitor) {
        return visitor.visit(this);
    }
}
