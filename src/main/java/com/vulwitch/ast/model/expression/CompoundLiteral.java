package com.vulwitch.ast.model.expression;

import java.util.List;

import com.vulwitch.ast.location.CodeRange;
import com.vulwitch.ast.model.AstVisitor;
import com.vulwitch.ast.model.declarator.TypeName;
import com.vulwitch.ast.model.initializer.InitializerListItem;

import lombok.NonNull;
import lombok.Value;

/**
 * {@code (type) { items }}.
 */
@Value
public class CompoundLiteral implements Expression {
    @NonNull
    CodeRange range;
    @NonNull
    TypeName typeName;
    @NonNull
    List<InitializerListItem> items;

    @Override
    public <R> R accept(AstVisitor<R> visitor) {
        return visitor.visit(this);
    }
}
