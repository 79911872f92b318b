package com.vulwitch.ast.model.specifier;

import java.util.List;

import com.vulwitch.ast.location.CodeRange;
import com.vulwitch.ast.model.AstNode;
import com.vulwitch.ast.model.AstVisitor;
import com.vulwitch.ast.model.expression.Expression;

import lombok.NonNull;
import lombok.Value;

/**
 * GNU {@code __attribute__((...))}. Each entry between the inner parentheses is one argument,
 * e.g. {@code packed} or {@code aligned(8)}.
 */
@Value
public class Attribute implements AstNode {
    @NonNull
    CodeRange range;
    List<Expression> arguments;

    @Override
    public <R> R accept(AstVisitor<R> visitor) {
        return visitor.visit(this);
    }
}
