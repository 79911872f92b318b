package com.vulwitch.ast.model.expression;

import com.vulwitch.ast.model.AstNode;

/**
 * The C expressions the lowering engine understands. Other expression kinds (assignments,
 * increments, comma expressions, statement expressions and so on) are reported as not yet
 * supported.
 */
public sealed interface Expression extends AstNode
        permits IdentifierExpression, ConstantExpression, StringLiteralExpression, ParenthesizedExpression,
        UnaryExpression, BinaryExpression, ConditionalExpression, CastExpression, SizeofExpression,
        CallExpression, SubscriptExpression, FieldExpression, CompoundLiteral {
}
