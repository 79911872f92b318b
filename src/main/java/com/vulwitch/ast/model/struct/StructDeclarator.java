package com.vulwitch.ast.model.struct;

import com.vulwitch.ast.location.CodeRange;
import com.vulwitch.ast.model.AstNode;
import com.vulwitch.ast.model.AstVisitor;
import com.vulwitch.ast.model.declarator.Declarator;
import com.vulwitch.ast.model.expression.Expression;

import lombok.NonNull;
import lombok.Value;

/**
 * A field declarator with an optional bit width. Unnamed bit-fields ({@code int : 3;}) have no
 * declarator; at least one of the two is always present.
 */
@Value
public class StructDeclarator implements AstNode {
    @NonNull
    CodeRange range;
    Declarator declarator;
    Expression bitWidth;

    public StructDeclarator(@NonNull CodeRange range, Declarator declarator, Expression bitWidth) {
        if (declarator == null && bitWidth == null) {
            throw new IllegalArgumentException("a struct declarator needs a declarator or a bit width");
        }
        this.range = range;
        this.declarator = declarator;
        this.bitWidth = bitWidth;
    }

    @Override
    public <R> R accept(AstVisitor<R> visitor) {
        return visitor.visit(this);
    }
}
