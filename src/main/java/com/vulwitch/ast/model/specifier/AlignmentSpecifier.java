package com.vulwitch.ast.model.specifier;

/**
 * {@code _Alignas(type)} or {@code _Alignas(expression)}.
 */
public sealed interface AlignmentSpecifier extends DeclarationSpecifier
        permits AlignmentTypeSpecifier, AlignmentExpressionSpecifier {
}
