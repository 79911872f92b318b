package com.vulwitch.ast.model.preprocess;

import com.vulwitch.ast.model.AstNode;

/**
 * Preprocessor directives and the expressions used in their conditions.
 */
public sealed interface PreprocessNode extends AstNode
        permits DefineDirective, FunctionDefineDirective, UndefineDirective, IncludeDirective,
        IfSectionDirective, IfGroupDirective, ElifDirective, ElseDirective, EndIfDirective,
        ErrorDirective, PragmaDirective, LineDirective, PreprocessExpression {
}
