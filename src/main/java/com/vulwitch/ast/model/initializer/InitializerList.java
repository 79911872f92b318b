package com.vulwitch.ast.model.initializer;

import java.util.List;

import com.vulwitch.ast.location.CodeRange;
import com.vulwitch.ast.model.AstVisitor;

import lombok.NonNull;
import lombok.Value;

/**
 * A brace-enclosed initializer. {@code {}} has an empty item list.
 */
@Value
public class InitializerList implements Initializer {
    @NonNull
    CodeRange range;
    @NonNull
    List<InitializerListItem> items;

    @Override
    public <R> R accept(AstVisitor<R> visitor) {
        return visitor.visit(this);
    }
}
