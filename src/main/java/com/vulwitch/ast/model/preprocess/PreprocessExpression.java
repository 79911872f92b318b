package com.vulwitch.ast.model.preprocess;

/**
 * Expressions of {@code #if} and {@code #elif} conditions. They are never evaluated.
 */
public sealed interface PreprocessExpression extends PreprocessNode
        permits PreprocessPrimitive, PreprocessDefined, PreprocessUnaryExpression, PreprocessBinaryExpression,
        ParenthesizedPreprocessExpression, PreprocessCallExpression {
}
