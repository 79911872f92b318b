package com.vulwitch.ast.model.enumeration;

import java.util.List;

import com.vulwitch.ast.location.CodeRange;
import com.vulwitch.ast.model.AstVisitor;

import lombok.NonNull;
import lombok.Value;

@Value
public class MacroEnumeratorElseGroup implements MacroEnumeratorGroup {
    @NonNull
    CodeRange range;
    List<EnumeratorListItem> enumerators;

    @Override
    public <R> R accept(AstVisitor<R> visitor) {
        return visitor.visit(this);
    }
}
