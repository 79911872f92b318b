package com.vulwitch.ast.lowering;

import lombok.Getter;

/**
 * Everything one lowering session shares: the cursor and the production lowerers, which call
 * each other recursively through this context.
 */
@Getter
final class LoweringContext {

    private final LoweringCursor cursor;
    private final CAstLowerer topLevel;
    private final PreprocessorLowerer preprocessor;
    private final MacroConditionalLowerer conditionals;
    private final SpecifierLowerer specifiers;
    private final DeclaratorLowerer declarators;
    private final ExpressionLowerer expressions;

    LoweringContext(LoweringCursor cursor, CAstLowerer topLevel) {
        this.cursor = cursor;
        this.topLevel = topLevel;
        this.preprocessor = new PreprocessorLowerer(this);
        this.conditionals = new MacroConditionalLowerer(this);
        this.specifiers = new SpecifierLowerer(this);
        this.declarators = new DeclaratorLowerer(this);
        this.expressions = new ExpressionLowerer(this);
    }
}
