package com.vulwitch.ast.lowering;

import java.util.ArrayList;
import java.util.List;

import com.vulwitch.ast.location.CodeLocation;
import com.vulwitch.ast.location.CodeRange;
import com.vulwitch.ast.model.AstNode;
import com.vulwitch.ast.model.Identifier;
import com.vulwitch.ast.model.enumeration.EnumeratorListItem;
import com.vulwitch.ast.model.enumeration.MacroConditionalEnumerator;
import com.vulwitch.ast.model.enumeration.MacroEnumeratorElifGroup;
import com.vulwitch.ast.model.enumeration.MacroEnumeratorElseGroup;
import com.vulwitch.ast.model.enumeration.MacroEnumeratorIfGroup;
import com.vulwitch.ast.model.enumeration.MacroEnumeratorIfdefGroup;
import com.vulwitch.ast.model.enumeration.MacroEnumeratorOpeningGroup;
import com.vulwitch.ast.model.preprocess.ElifDirective;
import com.vulwitch.ast.model.preprocess.ElseDirective;
import com.vulwitch.ast.model.preprocess.EndIfDirective;
import com.vulwitch.ast.model.preprocess.IfDirective;
import com.vulwitch.ast.model.preprocess.IfGroupDirective;
import com.vulwitch.ast.model.preprocess.IfSectionDirective;
import com.vulwitch.ast.model.preprocess.IfdefDirective;
import com.vulwitch.ast.model.preprocess.PreprocessExpression;
import com.vulwitch.ast.model.struct.MacroConditionalStructDeclaration;
import com.vulwitch.ast.model.struct.MacroStructDeclarationElifGroup;
import com.vulwitch.ast.model.struct.MacroStructDeclarationElseGroup;
import com.vulwitch.ast.model.struct.MacroStructDeclarationIfGroup;
import com.vulwitch.ast.model.struct.MacroStructDeclarationIfdefGroup;
import com.vulwitch.ast.model.struct.MacroStructDeclarationOpeningGroup;
import com.vulwitch.ast.model.struct.StructDeclaration;

/**
 * Lowers {@code #if}/{@code #ifdef}/{@code #ifndef} sections at the top level, inside struct
 * bodies and inside enumerator lists. The three share one routine; a {@link Flavor} decides how
 * each context lowers its items and builds its groups.
 *
 * The grammar nests every {@code #elif} and {@code #else} inside the group before it. The
 * routine flattens that chain into a list of elif groups and an optional else group.
 * Inside field and enumerator lists the grammar reports the same constructs under
 * context-specific names ({@code preproc_if_in_field_declaration_list}) or aliases them back to
 * the plain names; both spellings are accepted.
 */
final class MacroConditionalLowerer {

    static final String IF = "preproc_if";
    static final String IFDEF = "preproc_ifdef";
    static final String ELIF = "preproc_elif";
    static final String ELIFDEF = "preproc_elifdef";
    static final String ELSE = "preproc_else";

    private final LoweringContext context;
    private final LoweringCursor cursor;

    MacroConditionalLowerer(LoweringContext context) {
        this.context = context;
        this.cursor = context.getCursor();
    }

    /**
     * Maps a node type to the conditional construct it stands for, or {@code null} when it is not
     * one, e.g. {@code preproc_else_in_enumerator_list} to {@code preproc_else}.
     */
    static String conditionalKind(String type) {
        if (type == null || !type.startsWith("preproc_")) {
            return null;
        }
        int contextSuffix = type.indexOf("_in_");
        String base = contextSuffix < 0 ? type : type.substring(0, contextSuffix);
        return switch (base) {
            case IF, IFDEF, ELIF, ELIFDEF, ELSE -> base;
            default -> null;
        };
    }

    static boolean isSection(String type) {
        String kind = conditionalKind(type);
        return IF.equals(kind) || IFDEF.equals(kind);
    }

    IfSectionDirective lowerTopLevelSection() {
        return lowerSection(new TopLevelFlavor());
    }

    MacroConditionalStructDeclaration lowerStructSection() {
        return lowerSection(new StructFlavor());
    }

    MacroConditionalEnumerator lowerEnumeratorSection() {
        return lowerSection(new EnumeratorFlavor());
    }

    private <I extends AstNode, O, E, L, S> S lowerSection(Flavor<I, O, E, L, S> flavor) {
        CodeRange range = cursor.range();
        String kind = conditionalKind(cursor.type());
        cursor.enter();

        O ifGroup = IF.equals(kind) ? lowerIfHead(flavor) : lowerIfdefHead(flavor);
        List<E> elifGroups = new ArrayList<>();
        L elseGroup = lowerAlternatives(flavor, elifGroups);

        if (cursor.isAtEnd()) {
            throw cursor.error("missing #endif");
        }
        CodeRange endifRange = cursor.range();
        cursor.consume("#endif");
        cursor.expectEnd("conditional section");
        cursor.leave();

        return flavor.section(range, ifGroup, elifGroups.isEmpty() ? null : List.copyOf(elifGroups), elseGroup,
                endifRange);
    }

    private <I extends AstNode, O, E, L, S> O lowerIfHead(Flavor<I, O, E, L, S> flavor) {
        CodeLocation start = cursor.start();
        cursor.consume("#if");
        CodeLocation conditionEnd = cursor.end();
        PreprocessExpression condition = context.getExpressions().lowerPreprocessExpression();
        cursor.consumeIf("\n");
        List<I> items = lowerItems(flavor);
        return flavor.ifGroup(groupRange(start, conditionEnd, items), condition, items);
    }

    private <I extends AstNode, O, E, L, S> O lowerIfdefHead(Flavor<I, O, E, L, S> flavor) {
        CodeLocation start = cursor.start();
        boolean isIfndef = cursor.is("#ifndef");
        cursor.consume(isIfndef ? "#ifndef" : "#ifdef");
        Identifier identifier = cursor.consumeIdentifier();
        cursor.consumeIf("\n");
        List<I> items = lowerItems(flavor);
        return flavor.ifdefGroup(groupRange(start, identifier.getRange().getEnd(), items), identifier, isIfndef,
                items);
    }

    /**
     * Lowers the alternatives following a group, descending into nested ones, and returns the
     * final {@code #else} group if there is one.
     */
    private <I extends AstNode, O, E, L, S> L lowerAlternatives(Flavor<I, O, E, L, S> flavor, List<E> elifGroups) {
        while (true) {
            String kind = conditionalKind(cursor.type());
            if (ELIFDEF.equals(kind)) {
                throw cursor.error("#elifdef and #elifndef are not supported");
            }
            if (ELIF.equals(kind)) {
                cursor.enter();
                CodeLocation start = cursor.start();
                cursor.consume("#elif");
                CodeLocation conditionEnd = cursor.end();
                PreprocessExpression condition = context.getExpressions().lowerPreprocessExpression();
                cursor.consumeIf("\n");
                List<I> items = lowerItems(flavor);
                elifGroups.add(flavor.elifGroup(groupRange(start, conditionEnd, items), condition, items));

                L nested = lowerAlternatives(flavor, elifGroups);
                cursor.expectEnd("#elif group");
                cursor.leave();
                if (nested != null) {
                    return nested;
                }
            } else if (ELSE.equals(kind)) {
                CodeRange range = cursor.range();
                cursor.enter();
                cursor.consume("#else");
                List<I> items = lowerItems(flavor);
                cursor.expectEnd("#else group");
                cursor.leave();
                return flavor.elseGroup(range, items);
            } else {
                return null;
            }
        }
    }

    private <I extends AstNode> List<I> lowerItems(Flavor<I, ?, ?, ?, ?> flavor) {
        List<I> items = new ArrayList<>();
        while (!cursor.isAtEnd() && !isGroupBoundary()) {
            if (flavor.isSeparator(cursor.type())) {
                cursor.advance();
                continue;
            }
            cursor.checkSyntax();
            items.add(flavor.lowerItem());
        }
        return items.isEmpty() ? null : List.copyOf(items);
    }

    private boolean isGroupBoundary() {
        if (cursor.is("#endif")) {
            return true;
        }
        String kind = conditionalKind(cursor.type());
        return ELIF.equals(kind) || ELIFDEF.equals(kind) || ELSE.equals(kind);
    }

    private CodeRange groupRange(CodeLocation start, CodeLocation emptyEnd, List<? extends AstNode> items) {
        CodeLocation end = items == null ? emptyEnd : items.get(items.size() - 1).getRange().getEnd();
        return cursor.rangeBetween(start, end);
    }

    /**
     * How one context lowers its guarded items and assembles its group nodes.
     *
     * @param <I> guarded item
     * @param <O> opening ({@code #if}/{@code #ifdef}) group
     * @param <E> {@code #elif} group
     * @param <L> {@code #else} group
     * @param <S> whole section
     */
    private interface Flavor<I extends AstNode, O, E, L, S> {

        I lowerItem();

        default boolean isSeparator(String type) {
            return false;
        }

        O ifGroup(CodeRange range, PreprocessExpression condition, List<I> items);

        O ifdefGroup(CodeRange range, Identifier identifier, boolean isIfndef, List<I> items);

        E elifGroup(CodeRange range, PreprocessExpression condition, List<I> items);

        L elseGroup(CodeRange range, List<I> items);

        S section(CodeRange range, O ifGroup, List<E> elifGroups, L elseGroup, CodeRange endifRange);
    }

    private final class TopLevelFlavor
            implements Flavor<AstNode, IfGroupDirective, ElifDirective, ElseDirective, IfSectionDirective> {

        @Override
        public AstNode lowerItem() {
            return context.getTopLevel().lowerTopLevelItem();
        }

        @Override
        public IfGroupDirective ifGroup(CodeRange range, PreprocessExpression condition, List<AstNode> items) {
            return new IfDirective(range, condition, items);
        }

        @Override
        public IfGroupDirective ifdefGroup(CodeRange range, Identifier identifier, boolean isIfndef,
                List<AstNode> items) {
            return new IfdefDirective(range, identifier.getName(), isIfndef, items);
        }

        @Override
        public ElifDirective elifGroup(CodeRange range, PreprocessExpression condition, List<AstNode> items) {
            return new ElifDirective(range, condition, items);
        }

        @Override
        public ElseDirective elseGroup(CodeRange range, List<AstNode> items) {
            return new ElseDirective(range, items);
        }

        @Override
        public IfSectionDirective section(CodeRange range, IfGroupDirective ifGroup, List<ElifDirective> elifGroups,
                ElseDirective elseGroup, CodeRange endifRange) {
            return new IfSectionDirective(range, ifGroup, elifGroups, elseGroup, new EndIfDirective(endifRange));
        }
    }

    private final class StructFlavor implements Flavor<StructDeclaration, MacroStructDeclarationOpeningGroup,
            MacroStructDeclarationElifGroup, MacroStructDeclarationElseGroup, MacroConditionalStructDeclaration> {

        @Override
        public StructDeclaration lowerItem() {
            return context.getSpecifiers().lowerStructDeclaration();
        }

        @Override
        public MacroStructDeclarationOpeningGroup ifGroup(CodeRange range, PreprocessExpression condition,
                List<StructDeclaration> items) {
            return new MacroStructDeclarationIfGroup(range, condition, items);
        }

        @Override
        public MacroStructDeclarationOpeningGroup ifdefGroup(CodeRange range, Identifier identifier,
                boolean isIfndef, List<StructDeclaration> items) {
            return new MacroStructDeclarationIfdefGroup(range, identifier, isIfndef, items);
        }

        @Override
        public MacroStructDeclarationElifGroup elifGroup(CodeRange range, PreprocessExpression condition,
                List<StructDeclaration> items) {
            return new MacroStructDeclarationElifGroup(range, condition, items);
        }

        @Override
        public MacroStructDeclarationElseGroup elseGroup(CodeRange range, List<StructDeclaration> items) {
            return new MacroStructDeclarationElseGroup(range, items);
        }

        @Override
        public MacroConditionalStructDeclaration section(CodeRange range, MacroStructDeclarationOpeningGroup ifGroup,
                List<MacroStructDeclarationElifGroup> elifGroups, MacroStructDeclarationElseGroup elseGroup,
                CodeRange endifRange) {
            return new MacroConditionalStructDeclaration(range, ifGroup, elifGroups, elseGroup);
        }
    }

    private final class EnumeratorFlavor implements Flavor<EnumeratorListItem, MacroEnumeratorOpeningGroup,
            MacroEnumeratorElifGroup, MacroEnumeratorElseGroup, MacroConditionalEnumerator> {

        @Override
        public EnumeratorListItem lowerItem() {
            return context.getSpecifiers().lowerEnumeratorListItem();
        }

        @Override
        public boolean isSeparator(String type) {
            return ",".equals(type);
        }

        @Override
        public MacroEnumeratorOpeningGroup ifGroup(CodeRange range, PreprocessExpression condition,
                List<EnumeratorListItem> items) {
            return new MacroEnumeratorIfGroup(range, condition, items);
        }

        @Override
        public MacroEnumeratorOpeningGroup ifdefGroup(CodeRange range, Identifier identifier, boolean isIfndef,
                List<EnumeratorListItem> items) {
            return new MacroEnumeratorIfdefGroup(range, identifier, isIfndef, items);
        }

        @Override
        public MacroEnumeratorElifGroup elifGroup(CodeRange range, PreprocessExpression condition,
                List<EnumeratorListItem> items) {
            return new MacroEnumeratorElifGroup(range, condition, items);
        }

        @Override
        public MacroEnumeratorElseGroup elseGroup(CodeRange range, List<EnumeratorListItem> items) {
            return new MacroEnumeratorElseGroup(range, items);
        }

        @Override
        public MacroConditionalEnumerator section(CodeRange range, MacroEnumeratorOpeningGroup ifGroup,
                List<MacroEnumeratorElifGroup> elifGroups, MacroEnumeratorElseGroup elseGroup, CodeRange endifRange) {
            return new MacroConditionalEnumerator(range, ifGroup, elifGroups, elseGroup);
        }
    }
}
