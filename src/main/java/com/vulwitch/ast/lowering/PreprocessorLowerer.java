package com.vulwitch.ast.lowering;

import java.util.ArrayList;
import java.util.List;

import com.vulwitch.ast.error.CodeError;
import com.vulwitch.ast.location.CodeRange;
import com.vulwitch.ast.model.preprocess.DefineDirective;
import com.vulwitch.ast.model.preprocess.ErrorDirective;
import com.vulwitch.ast.model.preprocess.FunctionDefineDirective;
import com.vulwitch.ast.model.preprocess.IncludeDirective;
import com.vulwitch.ast.model.preprocess.IncludeTargetType;
import com.vulwitch.ast.model.preprocess.LineDirective;
import com.vulwitch.ast.model.preprocess.PragmaDirective;
import com.vulwitch.ast.model.preprocess.PreprocessCallExpression;
import com.vulwitch.ast.model.preprocess.PreprocessNode;
import com.vulwitch.ast.model.preprocess.UndefineDirective;

/**
 * Lowers the preprocessing directives that are not conditionals. Replacement lists are kept as
 * raw text; nothing is expanded.
 */
final class PreprocessorLowerer {

    private final LoweringContext context;
    private final LoweringCursor cursor;

    PreprocessorLowerer(LoweringContext context) {
        this.context = context;
        this.cursor = context.getCursor();
    }

    DefineDirective lowerDefine() {
        CodeRange range = cursor.range();
        cursor.enter();
        cursor.consume("#define");
        String identifier = cursor.consumeIdentifier().getName();
        String replacement = lowerReplacement();
        cursor.consumeIf("\n");
        cursor.expectEnd("#define");
        cursor.leave();
        return new DefineDirective(range, identifier, replacement);
    }

    FunctionDefineDirective lowerFunctionDefine() {
        CodeRange range = cursor.range();
        cursor.enter();
        cursor.consume("#define");
        String identifier = cursor.consumeIdentifier().getName();
        List<String> parameters = lowerMacroParameters();
        String replacement = lowerReplacement();
        cursor.consumeIf("\n");
        cursor.expectEnd("#define");
        cursor.leave();
        return new FunctionDefineDirective(range, identifier, parameters, replacement);
    }

    IncludeDirective lowerInclude() {
        CodeRange range = cursor.range();
        cursor.enter();
        cursor.consume("#include");
        IncludeTargetType targetType = cursor.isAtEnd() ? null : IncludeTargetType.fromNodeType(cursor.type());
        if (targetType == null) {
            throw cursor.error("unsupported #include target " + cursor.describe());
        }
        String target = cursor.text();
        PreprocessCallExpression callExpression = null;
        if (targetType == IncludeTargetType.CALL_EXPRESSION) {
            callExpression = context.getExpressions().lowerPreprocessCall(cursor.range());
        } else {
            cursor.advance();
        }
        cursor.consumeIf("\n");
        cursor.expectEnd("#include");
        cursor.leave();
        return new IncludeDirective(range, targetType, target, callExpression);
    }

    /**
     * Lowers the directives the grammar lumps together as {@code preproc_call}:
     * {@code #undef}, {@code #error}, {@code #pragma} and {@code #line}.
     */
    PreprocessNode lowerDirective() {
        CodeRange range = cursor.range();
        cursor.enter();
        if (!cursor.is("preproc_directive")) {
            throw cursor.error("expected a directive name but found " + cursor.describe());
        }
        String name = cursor.consumeText().substring(1).strip();
        String argument = lowerReplacement();
        cursor.consumeIf("\n");
        cursor.expectEnd("#" + name);
        cursor.leave();

        switch (name) {
            case "undef":
                if (argument == null || !argument.matches("[A-Za-z_][A-Za-z0-9_]*")) {
                    throw new CodeError("#undef needs exactly one identifier", range);
                }
                return new UndefineDirective(range, argument);
            case "error":
                return new ErrorDirective(range, argument);
            case "pragma":
                return new PragmaDirective(range, argument);
            case "line":
                if (argument == null) {
                    throw new CodeError("#line needs a line number", range);
                }
                return new LineDirective(range, argument);
            default:
                throw new CodeError("unsupported preprocessing directive `#" + name + "`", range);
        }
    }

    private String lowerReplacement() {
        if (!cursor.is("preproc_arg")) {
            return null;
        }
        String text = cursor.consumeText().strip();
        return text.isEmpty() ? null : text;
    }

    private List<String> lowerMacroParameters() {
        if (!cursor.is("preproc_params")) {
            throw cursor.error("expected macro parameters but found " + cursor.describe());
        }
        cursor.enter();
        cursor.consume("(");
        List<String> parameters = new ArrayList<>();
        while (!cursor.isAtEnd() && !cursor.is(")")) {
            if (!parameters.isEmpty() && "...".equals(parameters.get(parameters.size() - 1))) {
                throw cursor.error("`...` must be the last macro parameter");
            }
            if (cursor.is("...")) {
                parameters.add(cursor.consumeText());
            } else {
                parameters.add(cursor.consumeIdentifier().getName());
            }
            if (!cursor.consumeIf(",")) {
                break;
            }
        }
        cursor.consume(")");
        cursor.expectEnd("macro parameters");
        cursor.leave();
        return List.copyOf(parameters);
    }
}
