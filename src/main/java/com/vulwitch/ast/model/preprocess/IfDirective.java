package com.vulwitch.ast.model.preprocess;

import java.util.List;

import com.vulwitch.ast.location.CodeRange;
import com.vulwitch.ast.model.AstNode;
import com.vulwitch.ast.model.AstVisitor;

import lombok.NonNull;
import lombok.Value;

@Value
public class IfDirective implements IfGroupDirective {
    @NonNull
    CodeRange range;
    @NonNull
    PreprocessExpression condition;
    List<AstNode> group;

    @Override
    public <R> R accept(AstVisitor<R> visitor) {
        return visitor.visit(this);
    }
}
