package com.vulwitch.ast.lowering;

import java.util.ArrayList;
import java.util.List;

import com.vulwitch.ast.error.Unreachable;
import com.vulwitch.ast.location.CodeRange;
import com.vulwitch.ast.model.declarator.TypeName;
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
import com.vulwitch.ast.model.preprocess.ParenthesizedPreprocessExpression;
import com.vulwitch.ast.model.preprocess.PreprocessBinaryExpression;
import com.vulwitch.ast.model.preprocess.PreprocessBinaryOperator;
import com.vulwitch.ast.model.preprocess.PreprocessCallExpression;
import com.vulwitch.ast.model.preprocess.PreprocessDefined;
import com.vulwitch.ast.model.preprocess.PreprocessExpression;
import com.vulwitch.ast.model.preprocess.PreprocessPrimitive;
import com.vulwitch.ast.model.preprocess.PreprocessPrimitiveType;
import com.vulwitch.ast.model.preprocess.PreprocessUnaryExpression;
import com.vulwitch.ast.model.preprocess.PreprocessUnaryOperator;

/**
 * Lowers C expressions and the expressions of {@code #if} and {@code #elif} conditions.
 * Precedence is already resolved by the grammar, so both are a plain dispatch on node type.
 * C expressions outside the supported subset raise a not-yet-supported error.
 */
final class ExpressionLowerer {

    private final LoweringContext context;
    private final LoweringCursor cursor;

    ExpressionLowerer(LoweringContext context) {
        this.context = context;
        this.cursor = context.getCursor();
    }

    Expression lowerExpression() {
        String type = cursor.type();
        if (type == null) {
            throw cursor.error("expected an expression but found " + cursor.describe());
        }
        CodeRange range = cursor.range();
        return switch (type) {
            case "identifier" -> new IdentifierExpression(range, cursor.consumeIdentifier());
            case "number_literal" -> constant(range, ConstantExpression.Kind.NUMBER);
            case "char_literal" -> constant(range, ConstantExpression.Kind.CHAR);
            case "true" -> constant(range, ConstantExpression.Kind.TRUE);
            case "false" -> constant(range, ConstantExpression.Kind.FALSE);
            case "null" -> constant(range, ConstantExpression.Kind.NULL);
            case "string_literal" -> new StringLiteralExpression(range, List.of(cursor.consumeText()));
            case "concatenated_string" -> lowerConcatenatedString(range);
            case "parenthesized_expression" -> lowerParenthesized(range);
            case "unary_expression", "pointer_expression" -> lowerUnary(range);
            case "binary_expression" -> lowerBinary(range);
            case "conditional_expression" -> lowerConditional(range);
            case "cast_expression" -> lowerCast(range);
            case "sizeof_expression" -> lowerSizeof(range);
            case "call_expression" -> lowerCall(range);
            case "subscript_expression" -> lowerSubscript(range);
            case "field_expression" -> lowerField(range);
            case "compound_literal_expression" -> lowerCompoundLiteral(range);
            default -> throw cursor.notYetSupported(type);
        };
    }

    /**
     * Lowers {@code (a, b, c)} as found after a callee or inside {@code __attribute__}.
     * Returns an empty list for {@code ()}.
     */
    List<Expression> lowerArgumentList() {
        if (!cursor.is("argument_list")) {
            throw cursor.error("expected an argument list but found " + cursor.describe());
        }
        cursor.enter();
        cursor.consume("(");
        List<Expression> arguments = new ArrayList<>();
        while (!cursor.isAtEnd() && !cursor.is(")")) {
            arguments.add(lowerExpression());
            if (!cursor.consumeIf(",")) {
                break;
            }
        }
        cursor.consume(")");
        cursor.expectEnd("argument list");
        cursor.leave();
        return List.copyOf(arguments);
    }

    private ConstantExpression constant(CodeRange range, ConstantExpression.Kind kind) {
        return new ConstantExpression(range, kind, cursor.consumeText());
    }

    private StringLiteralExpression lowerConcatenatedString(CodeRange range) {
        cursor.enter();
        List<String> literals = new ArrayList<>();
        while (!cursor.isAtEnd()) {
            if (cursor.is("identifier")) {
                throw cursor.notYetSupported("macro inside a concatenated string");
            }
            if (!cursor.is("string_literal")) {
                throw cursor.error("unexpected " + cursor.describe() + " in concatenated string");
            }
            literals.add(cursor.consumeText());
        }
        cursor.leave();
        return new StringLiteralExpression(range, List.copyOf(literals));
    }

    private ParenthesizedExpression lowerParenthesized(CodeRange range) {
        cursor.enter();
        cursor.consume("(");
        Expression expression = lowerExpression();
        cursor.consume(")");
        cursor.expectEnd("parenthesized expression");
        cursor.leave();
        return new ParenthesizedExpression(range, expression);
    }

    private UnaryExpression lowerUnary(CodeRange range) {
        cursor.enter();
        UnaryOperator operator = UnaryOperator.fromSymbol(cursor.type());
        if (operator == null) {
            throw cursor.notYetSupported("unary operator " + cursor.describe());
        }
        cursor.advance();
        Expression operand = lowerExpression();
        cursor.expectEnd("unary expression");
        cursor.leave();
        return new UnaryExpression(range, operator, operand);
    }

    private BinaryExpression lowerBinary(CodeRange range) {
        cursor.enter();
        Expression lhs = lowerExpression();
        BinaryOperator operator = BinaryOperator.fromSymbol(cursor.type());
        if (operator == null) {
            throw cursor.error("unknown binary operator " + cursor.describe());
        }
        cursor.advance();
        Expression rhs = lowerExpression();
        cursor.expectEnd("binary expression");
        cursor.leave();
        return new BinaryExpression(range, operator, lhs, rhs);
    }

    private ConditionalExpression lowerConditional(CodeRange range) {
        cursor.enter();
        Expression condition = lowerExpression();
        cursor.consume("?");
        // GNU `a ?: b` leaves out the middle operand
        Expression consequence = cursor.is(":") ? null : lowerExpression();
        cursor.consume(":");
        Expression alternative = lowerExpression();
        cursor.expectEnd("conditional expression");
        cursor.leave();
        return new ConditionalExpression(range, condition, consequence, alternative);
    }

    private CastExpression lowerCast(CodeRange range) {
        cursor.enter();
        cursor.consume("(");
        TypeName typeName = context.getDeclarators().lowerTypeName();
        cursor.consume(")");
        Expression operand = lowerExpression();
        cursor.expectEnd("cast expression");
        cursor.leave();
        return new CastExpression(range, typeName, operand);
    }

    private SizeofExpression lowerSizeof(CodeRange range) {
        cursor.enter();
        cursor.consume("sizeof");
        SizeofExpression sizeof;
        if (cursor.consumeIf("(")) {
            TypeName typeName = context.getDeclarators().lowerTypeName();
            cursor.consume(")");
            sizeof = new SizeofExpression(range, typeName, null);
        } else {
            sizeof = new SizeofExpression(range, null, lowerExpression());
        }
        cursor.expectEnd("sizeof expression");
        cursor.leave();
        return sizeof;
    }

    private CallExpression lowerCall(CodeRange range) {
        cursor.enter();
        Expression function = lowerExpression();
        List<Expression> arguments = lowerArgumentList();
        cursor.expectEnd("call expression");
        cursor.leave();
        return new CallExpression(range, function, arguments);
    }

    private SubscriptExpression lowerSubscript(CodeRange range) {
        cursor.enter();
        Expression array = lowerExpression();
        cursor.consume("[");
        Expression index = lowerExpression();
        cursor.consume("]");
        cursor.expectEnd("subscript expression");
        cursor.leave();
        return new SubscriptExpression(range, array, index);
    }

    private FieldExpression lowerField(CodeRange range) {
        cursor.enter();
        Expression operand = lowerExpression();
        boolean isArrow = cursor.is("->");
        cursor.consume(isArrow ? "->" : ".");
        FieldExpression field = new FieldExpression(range, operand, isArrow, cursor.consumeIdentifier());
        cursor.expectEnd("field expression");
        cursor.leave();
        return field;
    }

    private CompoundLiteral lowerCompoundLiteral(CodeRange range) {
        cursor.enter();
        cursor.consume("(");
        TypeName typeName = context.getDeclarators().lowerTypeName();
        cursor.consume(")");
        if (!cursor.is("initializer_list")) {
            throw cursor.error("expected an initializer list but found " + cursor.describe());
        }
        CompoundLiteral literal = new CompoundLiteral(range, typeName, context.getDeclarators().lowerInitializerList());
        cursor.expectEnd("compound literal");
        cursor.leave();
        return literal;
    }

    /**
     * Lowers the condition of {@code #if} or {@code #elif}. The grammar reports these nodes
     * either under their {@code preproc_} names or aliased to the C expression names.
     */
    PreprocessExpression lowerPreprocessExpression() {
        String type = cursor.type();
        if (type == null) {
            throw cursor.error("expected a preprocessor expression but found " + cursor.describe());
        }
        CodeRange range = cursor.range();
        PreprocessPrimitiveType primitive = PreprocessPrimitiveType.fromNodeType(type);
        if (primitive != null) {
            return new PreprocessPrimitive(range, primitive, cursor.consumeText());
        }
        return switch (type) {
            case "preproc_defined" -> lowerDefined(range);
            case "unary_expression", "preproc_unary_expression" -> lowerPreprocessUnary(range);
            case "binary_expression", "preproc_binary_expression" -> lowerPreprocessBinary(range);
            case "parenthesized_expression", "preproc_parenthesized_expression" -> {
                cursor.enter();
                cursor.consume("(");
                PreprocessExpression expression = lowerPreprocessExpression();
                cursor.consume(")");
                cursor.expectEnd("parenthesized expression");
                cursor.leave();
                yield new ParenthesizedPreprocessExpression(range, expression);
            }
            case "call_expression", "preproc_call_expression" -> lowerPreprocessCall(range);
            default -> throw cursor.error("unsupported preprocessor expression: " + type);
        };
    }

    PreprocessCallExpression lowerPreprocessCall(CodeRange range) {
        cursor.enter();
        String callee = cursor.consumeIdentifier().getName();
        if (!cursor.isAny("argument_list", "preproc_argument_list")) {
            throw cursor.error("expected an argument list but found " + cursor.describe());
        }
        cursor.enter();
        cursor.consume("(");
        List<PreprocessExpression> arguments = new ArrayList<>();
        while (!cursor.isAtEnd() && !cursor.is(")")) {
            arguments.add(lowerPreprocessExpression());
            if (!cursor.consumeIf(",")) {
                break;
            }
        }
        cursor.consume(")");
        cursor.expectEnd("argument list");
        cursor.leave();
        cursor.expectEnd("call expression");
        cursor.leave();
        return new PreprocessCallExpression(range, callee, List.copyOf(arguments));
    }

    private PreprocessDefined lowerDefined(CodeRange range) {
        cursor.enter();
        cursor.consume("defined");
        boolean parenthesized = cursor.consumeIf("(");
        String identifier = cursor.consumeIdentifier().getName();
        if (parenthesized) {
            cursor.consume(")");
        }
        cursor.expectEnd("defined");
        cursor.leave();
        return new PreprocessDefined(range, identifier);
    }

    private PreprocessUnaryExpression lowerPreprocessUnary(CodeRange range) {
        cursor.enter();
        PreprocessUnaryOperator operator = PreprocessUnaryOperator.fromSymbol(cursor.type());
        if (operator == null) {
            throw cursor.error("unknown unary operator " + cursor.describe() + " in preprocessor expression");
        }
        cursor.advance();
        PreprocessExpression operand = lowerPreprocessExpression();
        cursor.expectEnd("unary expression");
        cursor.leave();
        return new PreprocessUnaryExpression(range, operator, operand);
    }

    private PreprocessBinaryExpression lowerPreprocessBinary(CodeRange range) {
        cursor.enter();
        PreprocessExpression lhs = lowerPreprocessExpression();
        if (cursor.isAtEnd()) {
            throw Unreachable.unreachable("binary expression without operator");
        }
        PreprocessBinaryOperator operator = PreprocessBinaryOperator.fromSymbol(cursor.type());
        if (operator == null) {
            throw cursor.error("unknown binary operator " + cursor.describe() + " in preprocessor expression");
        }
        cursor.advance();
        PreprocessExpression rhs = lowerPreprocessExpression();
        cursor.expectEnd("binary expression");
        cursor.leave();
        return new PreprocessBinaryExpression(range, operator, lhs, rhs);
    }
}
