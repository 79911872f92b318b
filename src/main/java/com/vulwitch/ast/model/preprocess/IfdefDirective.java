package com.vulwitch.ast.model.preprocess;

import java.util.List;

import com.vulwitch.ast.location.CodeRange;
import com.vulwitch.ast.model.AstNode;
import com.vulwitch.ast.model.AstVisitor;

import lombok.NonNull;
import lombok.Value;

/**
 * {@code #ifdef NAME} or, with {@code isIfndef}, {@code #ifndef NAME}.
 */
@Value
public class IfdefDirective implements IfGroupDirective {
    @NonNull
    CodeRange range;
    @NonNull
    String identifier;
    boolean isIfndef;
    List<AstNode> group;

    @Override
    public <R> R accept(AstVisitor<R> visitor) {
        return visitor.visit(this);
    }
}
