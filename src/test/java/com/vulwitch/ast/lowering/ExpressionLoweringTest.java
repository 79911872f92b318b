package com.vulwitch.ast.lowering;

import static com.vulwitch.ast.lowering.LoweringFixtures.*;
import static org.assertj.core.api.Assertions.*;

import org.junit.jupiter.api.Test;

import com.vulwitch.ast.error.NotYetSupportedError;
import com.vulwitch.ast.model.Identifier;
import com.vulwitch.ast.model.declarator.AbstractPointerDeclarator;
import com.vulwitch.ast.model.expression.BinaryExpression;
import com.vulwitch.ast.model.expression.BinaryOperator;
import com.vulwitch.ast.model.expression.CallExpression;
import com.vulwitch.ast.model.expression.CastExpression;
import com.vulwitch.ast.model.expression.CompoundLiteral;
import com.vulwitch.ast.model.expression.ConditionalExpression;
import com.vulwitch.ast.model.expression.ConstantExpression;
import com.vulwitch.ast.model.expression.Expression;
import com.vulwitch.ast.model.expression.FieldExpression;
import com.vulwitch.ast.model.expression.IdentifierExpression;
import com.vulwitch.ast.model.expression.ParenthesizedExpression;
import com.vulwitch.ast.model.expression.SizeofExpression;
import com.vulwitch.ast.model.expression.StringLiteralExpression;
import com.vulwitch.ast.model.expression.SubscriptExpression;
import com.vulwitch.ast.model.expression.UnaryExpression;
import com.vulwitch.ast.model.expression.UnaryOperator;

class ExpressionLoweringTest {

    private static IdentifierExpression name(String name) {
        return new IdentifierExpression(anyRange(), new Identifier(anyRange(), name));
    }

    private static ConstantExpression number(String text) {
        return new ConstantExpression(anyRange(), ConstantExpression.Kind.NUMBER, text);
    }

    @Test
    void testBinaryAndParenthesized() {
        Expression expected = new BinaryExpression(anyRange(), BinaryOperator.MULTIPLY,
                new ParenthesizedExpression(anyRange(),
                        new BinaryExpression(anyRange(), BinaryOperator.ADD, name("a"), number("1"))),
                number("0x10"));

        assertThat(initializerOf("int v = (a + 1) * 0x10;"))
                .usingRecursiveComparison()
                .ignoringFieldsMatchingRegexes(RANGE_FIELDS)
                .isEqualTo(expected);
    }

    @Test
    void testOperatorPrecedenceFollowsTheTree() {
        BinaryExpression or = (BinaryExpression) initializerOf("int v = a && b || c << 2 != d;");

        assertThat(or.getOperator()).isEqualTo(BinaryOperator.LOGICAL_OR);
        assertThat(((BinaryExpression) or.getLhs()).getOperator()).isEqualTo(BinaryOperator.LOGICAL_AND);
        BinaryExpression notEqual = (BinaryExpression) or.getRhs();
        assertThat(notEqual.getOperator()).isEqualTo(BinaryOperator.NOT_EQUAL);
        assertThat(((BinaryExpression) notEqual.getLhs()).getOperator()).isEqualTo(BinaryOperator.LEFT_SHIFT);
    }

    @Test
    void testConditional() {
        ConditionalExpression conditional = (ConditionalExpression) initializerOf("int v = a > b ? a : b;");

        assertThat(conditional.getCondition()).isInstanceOf(BinaryExpression.class);
        assertThat(conditional.getConsequence())
                .usingRecursiveComparison()
                .ignoringFieldsMatchingRegexes(RANGE_FIELDS)
                .isEqualTo(name("a"));
        assertThat(conditional.getAlternative()).isNotNull();
    }

    @Test
    void testSizeofTypeAndOperand() {
        SizeofExpression ofType = (SizeofExpression) initializerOf("unsigned long v = sizeof(struct record *);");
        assertThat(ofType.getOperand()).isNull();
        assertThat(ofType.getTypeName().getSpecifierQualifiers()).hasSize(1);
        assertThat(ofType.getTypeName().getDeclarator()).isInstanceOf(AbstractPointerDeclarator.class);

        SizeofExpression ofOperand = (SizeofExpression) initializerOf("unsigned long v = sizeof buffer;");
        assertThat(ofOperand.getTypeName()).isNull();
        assertThat(ofOperand.getOperand())
                .usingRecursiveComparison()
                .ignoringFieldsMatchingRegexes(RANGE_FIELDS)
                .isEqualTo(name("buffer"));
    }

    @Test
    void testCastOfAddress() {
        CastExpression cast = (CastExpression) initializerOf("char *p = (char *)&value;");

        assertThat(cast.getTypeName().getDeclarator()).isInstanceOf(AbstractPointerDeclarator.class);
        assertThat(cast.getOperand())
                .usingRecursiveComparison()
                .ignoringFieldsMatchingRegexes(RANGE_FIELDS)
                .isEqualTo(new UnaryExpression(anyRange(), UnaryOperator.ADDRESS_OF, name("value")));
    }

    @Test
    void testPostfixChain() {
        CallExpression call = (CallExpression) initializerOf("int v = table[i].ops->run(ctx, 2);");

        assertThat(call.getArguments()).hasSize(2);
        FieldExpression run = (FieldExpression) call.getFunction();
        assertThat(run.isArrow()).isTrue();
        assertThat(run.getField().getName()).isEqualTo("run");
        FieldExpression ops = (FieldExpression) run.getOperand();
        assertThat(ops.isArrow()).isFalse();
        assertThat(ops.getOperand()).isInstanceOf(SubscriptExpression.class);
    }

    @Test
    void testCallWithoutArguments() {
        CallExpression call = (CallExpression) initializerOf("int v = next();");

        assertThat(call.getArguments()).isEmpty();
    }

    @Test
    void testConcatenatedStrings() {
        StringLiteralExpression string = (StringLiteralExpression) initializerOf("""
                const char *s = "ab" "cd";
                """);

        assertThat(string.getLiterals()).containsExactly("\"ab\"", "\"cd\"");
    }

    @Test
    void testMacroInsideConcatenatedStringIsNotYetSupported() {
        assertThatThrownBy(() -> lower("const char *s = \"id: \" PRIu64;"))
                .isInstanceOf(NotYetSupportedError.class);
    }

    @Test
    void testConstantKinds() {
        assertThat(((ConstantExpression) initializerOf("_Bool b = true;")).getKind())
                .isEqualTo(ConstantExpression.Kind.TRUE);
        assertThat(((ConstantExpression) initializerOf("void *p = NULL;")).getKind())
                .isEqualTo(ConstantExpression.Kind.NULL);
        ConstantExpression c = (ConstantExpression) initializerOf("char c = 'x';");
        assertThat(c.getKind()).isEqualTo(ConstantExpression.Kind.CHAR);
        assertThat(c.getText()).isEqualTo("'x'");
    }

    @Test
    void testCompoundLiteral() {
        UnaryExpression address = (UnaryExpression) initializerOf("struct point *p = &(struct point){1, 2};");
        CompoundLiteral literal = (CompoundLiteral) address.getOperand();

        assertThat(literal.getItems()).hasSize(2);
        assertThat(literal.getTypeName().getDeclarator()).isNull();
    }

    @Test
    void testUnaryOperators() {
        UnaryExpression not = (UnaryExpression) initializerOf("int v = !~x;");

        assertThat(not.getOperator()).isEqualTo(UnaryOperator.NOT);
        assertThat(((UnaryExpression) not.getOperand()).getOperator()).isEqualTo(UnaryOperator.BITWISE_NOT);
    }

    @Test
    void testUpdateExpressionIsNotYetSupported() {
        assertThatThrownBy(() -> lower("int v = x++;"))
                .isInstanceOfSatisfying(NotYetSupportedError.class,
                        error -> assertThat(error.getProduction()).isEqualTo("update_expression"));
    }

    @Test
    void testExpressionRange() {
        Expression expression = initializerOf("int v = a + b;");

        assertThat(expression.getRange().getStart()).isEqualTo(at(0, 8));
        assertThat(expression.getRange().getEnd()).isEqualTo(at(0, 13));
    }
}
