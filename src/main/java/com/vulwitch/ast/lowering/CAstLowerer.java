package com.vulwitch.ast.lowering;

import java.util.ArrayList;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.vulwitch.ast.cst.CstNode;
import com.vulwitch.ast.cst.SyntaxTree;
import com.vulwitch.ast.location.CodeLocation;
import com.vulwitch.ast.location.CodeRange;
import com.vulwitch.ast.model.AstNode;
import com.vulwitch.ast.model.TranslationUnit;
import com.vulwitch.ast.model.declaration.Declaration;
import com.vulwitch.ast.model.declaration.TypeDefinition;
import com.vulwitch.ast.model.declarator.Declarator;
import com.vulwitch.ast.model.specifier.DeclarationSpecifier;
import com.vulwitch.ast.model.specifier.SpecifierQualifier;
import com.vulwitch.ast.model.specifier.TypeSpecifier;

/**
 * Lowers the CST of one C translation unit into a {@link TranslationUnit}.
 *
 * An instance owns the cursor over one tree and is not thread-safe. {@link #reset(SyntaxTree)}
 * re-targets it at another tree; {@link #parseModule()} may be called repeatedly and always
 * starts from the root.
 *
 * Errors are not recovered from: the first {@link com.vulwitch.ast.error.CodeError} or
 * {@link com.vulwitch.ast.error.NotYetSupportedError} aborts the whole unit.
 */
public class CAstLowerer {
    private static final Logger log = LoggerFactory.getLogger(CAstLowerer.class);

    private final LoweringCursor cursor;
    private final LoweringContext context;

    public CAstLowerer(SyntaxTree tree) {
        this(tree, LoweringConfig.defaults());
    }

    public CAstLowerer(SyntaxTree tree, LoweringConfig config) {
        this.cursor = new LoweringCursor(tree, config);
        this.context = new LoweringContext(cursor, this);
    }

    public void reset(SyntaxTree tree) {
        cursor.reset(tree);
    }

    public TranslationUnit parseModule() {
        cursor.reset(cursor.tree());
        CstNode root = cursor.node();
        CodeRange range = cursor.rangeOf(root);
        if (!"translation_unit".equals(root.getType())) {
            throw cursor.error("expected `translation_unit` at the root but found `" + root.getType() + "`");
        }
        if (root.getChildCount() == 0) {
            log.debug("Empty translation unit {}", cursor.file());
            return new TranslationUnit(range, List.of());
        }

        List<AstNode> nodes = new ArrayList<>();
        cursor.enter();
        while (!cursor.isAtEnd()) {
            cursor.checkSyntax();
            nodes.add(lowerTopLevelItem());
        }

        log.debug("Lowered {} top-level nodes from {}", nodes.size(), cursor.file());
        return new TranslationUnit(range, List.copyOf(nodes));
    }

    /**
     * Lowers one item of the translation unit or of a top-level conditional group.
     */
    AstNode lowerTopLevelItem() {
        String type = cursor.type();
        if (MacroConditionalLowerer.isSection(type)) {
            return context.getConditionals().lowerTopLevelSection();
        }
        if (context.getSpecifiers().isTypeSpecifier()) {
            return lowerEmptyDeclaration();
        }
        PreprocessorLowerer preprocessor = context.getPreprocessor();
        return switch (type) {
            case "preproc_include" -> preprocessor.lowerInclude();
            case "preproc_def" -> preprocessor.lowerDefine();
            case "preproc_function_def" -> preprocessor.lowerFunctionDefine();
            case "preproc_call" -> preprocessor.lowerDirective();
            case "declaration" -> lowerDeclaration();
            case "type_definition" -> lowerTypeDefinition();
            case "function_definition", "linkage_specification", "attributed_statement", "expression_statement" ->
                throw cursor.notYetSupported(type);
            default -> throw cursor.error("unsupported node type: " + type);
        };
    }

    private Declaration lowerDeclaration() {
        CodeRange range = cursor.range();
        cursor.enter();
        List<DeclarationSpecifier> specifiers = context.getSpecifiers().lowerDeclarationSpecifiers();
        if (specifiers.isEmpty()) {
            throw cursor.error("expected a declaration specifier but found " + cursor.describe());
        }

        List<Declarator> declarators = new ArrayList<>();
        while (!cursor.isAtEnd() && !cursor.is(";")) {
            declarators.add(context.getDeclarators().lowerDeclarator());
            if (!cursor.consumeIf(",")) {
                break;
            }
        }
        cursor.consume(";");
        cursor.expectEnd("declaration");
        cursor.leave();
        return new Declaration(range, List.copyOf(specifiers),
                declarators.isEmpty() ? null : List.copyOf(declarators));
    }

    /**
     * {@code struct S { ... };} at file scope: the grammar leaves the type specifier and the
     * semicolon as two siblings.
     */
    private Declaration lowerEmptyDeclaration() {
        CodeLocation start = cursor.start();
        TypeSpecifier specifier = context.getSpecifiers().lowerTypeSpecifier();
        if (!cursor.is(";")) {
            throw cursor.error("expected `;` after a type specifier but found " + cursor.describe());
        }
        CodeLocation end = cursor.end();
        cursor.advance();
        return new Declaration(cursor.rangeBetween(start, end), List.of(specifier), null);
    }

    private TypeDefinition lowerTypeDefinition() {
        CodeRange range = cursor.range();
        cursor.enter();
        if (cursor.is("__extension__")) {
            throw cursor.error("`__extension__` is not supported");
        }
        cursor.consume("typedef");
        List<SpecifierQualifier> specifiers = context.getSpecifiers().lowerTypedefSpecifiers();

        List<Declarator> declarators = new ArrayList<>();
        do {
            declarators.add(context.getDeclarators().lowerDeclarator());
        } while (cursor.consumeIf(","));
        if (cursor.is("attribute_specifier")) {
            throw cursor.error("attributes on a type definition are not supported");
        }
        cursor.consume(";");
        cursor.expectEnd("type definition");
        cursor.leave();
        return new TypeDefinition(range, specifiers, List.copyOf(declarators));
    }
}
