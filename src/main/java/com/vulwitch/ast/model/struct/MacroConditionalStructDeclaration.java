package com.vulwitch.ast.model.struct;

import java.util.List;

import com.vulwitch.ast.location.CodeRange;
import com.vulwitch.ast.model.AstVisitor;

import lombok.NonNull;
import lombok.Value;

/**
 * {@code #if}/{@code #ifdef}/{@code #ifndef} ... {@code #endif} around struct fields.
 */
@Value
public class MacroConditionalStructDeclaration implements StructDeclaration {
    @NonNull
    CodeRange range;
    @NonNull
    MacroStructDeclarationOpeningGroup ifGroup;
    List<MacroStructDeclarationElifGroup> elifGroups;
    MacroStructDeclarationElseGroup elseGroup;

    @Override
    public <R> R accept(AstVisitor<R> visitor) {
        return visitor.visit(this);
    }
}
