package com.vulwitch.ast.model;

import java.util.ArrayList;
import java.util.List;

import org.junit.jupiter.api.Test;

import com.vulwitch.ast.location.CodeLocation;
import com.vulwitch.ast.location.CodeRange;
import com.vulwitch.ast.model.declarator.ArraySize;
import com.vulwitch.ast.model.declarator.ArraySizeKind;
import com.vulwitch.ast.model.declarator.IdentifierDeclarator;
import com.vulwitch.ast.model.expression.BinaryExpression;
import com.vulwitch.ast.model.expression.BinaryOperator;
import com.vulwitch.ast.model.expression.ConstantExpression;
import com.vulwitch.ast.model.expression.IdentifierExpression;
import com.vulwitch.ast.model.expression.SizeofExpression;
import com.vulwitch.ast.model.struct.StructDeclarator;

import static org.assertj.core.api.Assertions.*;

/**
 * Tests for node invariants enforced at construction and for the depth-first walker.
 */
class AstModelTest {

    private static final CodeRange RANGE = new CodeRange("m.c", CodeLocation.of(0, 0), CodeLocation.of(0, 1));

    private static ConstantExpression one() {
        return new ConstantExpression(RANGE, ConstantExpression.Kind.NUMBER, "1");
    }

    @Test
    void testArraySizeExpressionMatchesKind() {
        assertThatThrownBy(() -> new ArraySize(RANGE, ArraySizeKind.STATIC_EXPRESSION, null, null))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("requires");
        assertThatThrownBy(() -> new ArraySize(RANGE, ArraySizeKind.UNKNOWN, null, one()))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("does not take");
        assertThat(new ArraySize(RANGE, ArraySizeKind.VARIABLE_EXPRESSION, null, one()).getExpression())
                .isNotNull();
    }

    @Test
    void testStructDeclaratorNeedsDeclaratorOrWidth() {
        assertThatThrownBy(() -> new StructDeclarator(RANGE, null, null))
                .isInstanceOf(IllegalArgumentException.class);
        assertThat(new StructDeclarator(RANGE, null, one()).getDeclarator()).isNull();
    }

    @Test
    void testSizeofTakesExactlyOneForm() {
        assertThatThrownBy(() -> new SizeofExpression(RANGE, null, null))
                .isInstanceOf(IllegalArgumentException.class);
        assertThat(new SizeofExpression(RANGE, null, one()).getTypeName()).isNull();
    }

    @Test
    void testNodesCompareStructurally() {
        Identifier a = new Identifier(RANGE, "a");

        assertThat(new IdentifierDeclarator(RANGE, a)).isEqualTo(new IdentifierDeclarator(RANGE, new Identifier(RANGE, "a")));
        assertThat(a).isNotEqualTo(new Identifier(RANGE, "b"));
    }

    @Test
    void testWalkerVisitsChildrenInSourceOrder() {
        BinaryExpression sum = new BinaryExpression(RANGE, BinaryOperator.ADD,
                new IdentifierExpression(RANGE, new Identifier(RANGE, "x")), one());
        List<String> visited = new ArrayList<>();

        new DepthFirstAstWalker() {
            @Override
            protected void enter(AstNode node) {
                visited.add(node.getClass().getSimpleName());
            }
        }.walk(sum);

        assertThat(visited).containsExactly("BinaryExpression", "IdentifierExpression", "Identifier",
                "ConstantExpression");
    }
}
