package com.vulwitch.ast.model.initializer;

import java.util.List;

import com.vulwitch.ast.location.CodeRange;
import com.vulwitch.ast.model.AstNode;
import com.vulwitch.ast.model.AstVisitor;

import lombok.NonNull;
import lombok.Value;

/**
 * One entry of a brace initializer, with its designator chain when it has one:
 * {@code .a[2].b = 1} has three designators.
 */
@Value
public class InitializerListItem implements AstNode {
    @NonNull
    CodeRange range;
    List<Designator> designators;
    @NonNull
    Initializer initializer;

    @Override
    public <R> R accept(AstVisitor<R> visitor) {
        return visitor.visit(this);
    }
}
