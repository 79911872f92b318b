package com.vulwitch.ast.model.expression;

import com.vulwitch.ast.location.CodeRange;
import com.vulwitch.ast.model.AstVisitor;
import com.vulwitch.ast.model.declarator.TypeName;

import lombok.NonNull;
import lombok.Value;

/**
 * {@code sizeof(type)} or {@code sizeof operand}; exactly one of the two is set.
 * {@code sizeof(x)} where {@code x} is not a type is an operand wrapped in parentheses.
 */
@Value
public class SizeofExpression implements Expression {
    @NonNull
    CodeRange range;
    TypeName typeName;
    Expression operand;

    public SizeofExpression(@NonNull CodeRange range, TypeName typeName, Expression operand) {
        if ((typeName == null) == (operand == null)) {
            throw new IllegalArgumentException("sizeof takes either a type name or an operand");
        }
        this.range = range;
        this.typeName = typeName;
        this.operand = operand;
    }

    @Override
    public <R> R accept(AstVisitor<R> visitor) {
        return visitor.visit(this);
    }
}
