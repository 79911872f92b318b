package com.vulwitch.ast.model.enumeration;

import java.util.List;

import com.vulwitch.ast.location.CodeRange;
import com.vulwitch.ast.model.AstVisitor;
import com.vulwitch.ast.model.Identifier;

import lombok.NonNull;
import lombok.Value;

@Value
public class MacroEnumeratorIfdefGroup implements MacroEnumeratorOpeningGroup {
    @NonNull
    CodeRange range;
    @NonNull
    Identifier identifier;
    boolean isIfndef;
    List<EnumeratorListItem> enumerators;

    @Override
    public <R> R accept(AstVisitor<R> visitor) {
        return visitor.visit(this);
    }
}
