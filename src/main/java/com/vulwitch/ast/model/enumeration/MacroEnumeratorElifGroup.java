package com.vulwitch.ast.model.enumeration;

import java.util.List;

import com.vulwitch.ast.location.CodeRange;
import com.vulwitch.ast.model.AstVisitor;
import com.vulwitch.ast.model.preprocess.PreprocessExpression;

import lombok.NonNull;
import lombok.Value;

@Value
public class MacroEnumeratorElifGroup implements MacroEnumeratorGroup {
    @NonNull
    CodeRange range;
    @NonNull
    PreprocessExpression condition;
    List<EnumeratorListItem> enumerators;

    @Override
    public <R> R accept(AstVisitor<R> visitor) {
        return visitor.visit(this);
    }
}
