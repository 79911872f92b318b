package com.vulwitch.ast.model.declarator;

import java.util.List;

import com.vulwitch.ast.location.CodeRange;
import com.vulwitch.ast.model.AstNode;
import com.vulwitch.ast.model.AstVisitor;
import com.vulwitch.ast.model.expression.Expression;
import com.vulwitch.ast.model.specifier.TypeQualifier;

import lombok.NonNull;
import lombok.Value;

/**
 * The bracketed part of an array declarator. The range covers the brackets.
 * An expression is present exactly for the kinds that carry one.
 */
@Value
public class ArraySize implements AstNode {
    @NonNull
    CodeRange range;
    @NonNull
    ArraySizeKind kind;
    List<TypeQualifier> qualifiers;
    Expression expression;

    public ArraySize(@NonNull CodeRange range, @NonNull ArraySizeKind kind, List<TypeQualifier> qualifiers,
            Expression expression) {
        if (kind.hasExpression() != (expression != null)) {
            throw new IllegalArgumentException("array size of kind " + kind
                    + (expression == null ? " requires" : " does not take") + " an expression");
        }
        this.range = range;
        this.kind = kind;
        this.qualifiers = qualifiers;
        this.expression = expression;
    }

    @Override
    public <R> R accept(AstVisitor<R> visitor) {
        return visitor.visit(this);
    }
}
