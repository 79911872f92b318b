package com.vulwitch.ast.model.enumeration;

import java.util.List;

import com.vulwitch.ast.location.CodeRange;
import com.vulwitch.ast.model.AstVisitor;

import lombok.NonNull;
import lombok.Value;

@Value
public class MacroConditionalEnumerator implements EnumeratorListItem {
    @NonNull
    CodeRange range;
    @NonNull
    MacroEnumeratorOpeningGroup ifGroup;
    List<MacroEnumeratorElifGroup> elifGroups;
    MacroEnumeratorElseGroup elseGroup;

    @Override
    public <R> R accept(AstVisitor<R> visitor) {
        return visitor.visit(this);
    }
}
