package com.vulwitch.ast.model.enumeration;

import com.vulwitch.ast.location.CodeRange;
import com.vulwitch.ast.model.AstVisitor;
import com.vulwitch.ast.model.preprocess.PreprocessNode;

import lombok.NonNull;
import lombok.Value;

@Value
public class MacroDirectiveEnumerator implements EnumeratorListItem {
    @NonNull
    CodeRange range;
    @NonNull
    PreprocessNode directive;

    @Override
    public <R> R accept(AstVisitor<R> visitor) {
        return visitor.visit(this);
    }
}
