package com.vulwitch.ast.lowering;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.vulwitch.ast.error.CodeError;
import com.vulwitch.ast.error.Unreachable;
import com.vulwitch.ast.location.CodeLocation;
import com.vulwitch.ast.location.CodeRange;
import com.vulwitch.ast.model.Identifier;
import com.vulwitch.ast.model.declarator.Declarator;
import com.vulwitch.ast.model.declarator.TypeName;
import com.vulwitch.ast.model.enumeration.Enumerator;
import com.vulwitch.ast.model.enumeration.EnumeratorListItem;
import com.vulwitch.ast.model.enumeration.MacroDirectiveEnumerator;
import com.vulwitch.ast.model.expression.Expression;
import com.vulwitch.ast.model.specifier.AlignmentExpressionSpecifier;
import com.vulwitch.ast.model.specifier.AlignmentSpecifier;
import com.vulwitch.ast.model.specifier.AlignmentTypeSpecifier;
import com.vulwitch.ast.model.specifier.Attribute;
import com.vulwitch.ast.model.specifier.DeclarationSpecifier;
import com.vulwitch.ast.model.specifier.EnumSpecifier;
import com.vulwitch.ast.model.specifier.ExtendedDeclarationSpecifier;
import com.vulwitch.ast.model.specifier.FunctionSpecifier;
import com.vulwitch.ast.model.specifier.MacroTypeSpecifier;
import com.vulwitch.ast.model.specifier.PrimitiveTypeSpecifier;
import com.vulwitch.ast.model.specifier.SpecifierQualifier;
import com.vulwitch.ast.model.specifier.StorageClassSpecifier;
import com.vulwitch.ast.model.specifier.StructOrUnionSpecifier;
import com.vulwitch.ast.model.specifier.TypeQualifier;
import com.vulwitch.ast.model.specifier.TypeSpecifier;
import com.vulwitch.ast.model.specifier.TypedefName;
import com.vulwitch.ast.model.struct.MacroDefStructDeclaration;
import com.vulwitch.ast.model.struct.MacroDirectiveStructDeclaration;
import com.vulwitch.ast.model.struct.MacroFunctionDefStructDeclaration;
import com.vulwitch.ast.model.struct.StructDeclaration;
import com.vulwitch.ast.model.struct.StructDeclarator;
import com.vulwitch.ast.model.struct.StructField;

/**
 * Lowers declaration specifiers, type specifiers and the bodies of struct, union and enum
 * specifiers.
 */
final class SpecifierLowerer {
    private static final Logger log = LoggerFactory.getLogger(SpecifierLowerer.class);

    static final Set<String> TYPE_SPECIFIER_TYPES = Set.of(
            "primitive_type",
            "sized_type_specifier",
            "type_identifier",
            "struct_specifier",
            "union_specifier",
            "enum_specifier",
            "macro_type_specifier");

    private static final Set<String> MODIFIER_TYPES = Set.of(
            "storage_class_specifier",
            "type_qualifier",
            "alignas_qualifier",
            "attribute_specifier",
            "attribute_declaration",
            "ms_declspec_modifier");

    private static final Set<String> SIZE_KEYWORDS = Set.of("signed", "unsigned", "long", "short");

    private final LoweringContext context;
    private final LoweringCursor cursor;

    SpecifierLowerer(LoweringContext context) {
        this.context = context;
        this.cursor = context.getCursor();
    }

    boolean isTypeSpecifier() {
        return cursor.isIn(TYPE_SPECIFIER_TYPES);
    }

    boolean isDeclarationSpecifier() {
        return isTypeSpecifier() || cursor.isIn(MODIFIER_TYPES);
    }

    /**
     * Consumes the specifiers in front of a declarator. The grammar does not mark where the
     * specifiers end, so the loop is greedy and bounded by the number of remaining siblings;
     * a sized type run such as {@code unsigned long long} is one sibling.
     */
    List<DeclarationSpecifier> lowerDeclarationSpecifiers() {
        int atMost = cursor.remainingSiblings();
        List<DeclarationSpecifier> specifiers = new ArrayList<>();
        int count = 0;
        while (count < atMost && isDeclarationSpecifier()) {
            if (cursor.is("sized_type_specifier")) {
                specifiers.addAll(lowerSizedTypeSpecifier());
            } else {
                specifiers.add(lowerDeclarationSpecifier());
            }
            count++;
        }
        return specifiers;
    }

    /**
     * Consumes a run of specifiers where only type specifiers and qualifiers are legal, such as
     * a field declaration or a type name.
     */
    List<SpecifierQualifier> lowerSpecifierQualifiers(String production) {
        List<SpecifierQualifier> result = new ArrayList<>();
        for (DeclarationSpecifier specifier : lowerDeclarationSpecifiers()) {
            if (!(specifier instanceof SpecifierQualifier qualifier)) {
                throw new CodeError(describeSpecifier(specifier) + " is not allowed in " + production,
                        specifier.getRange());
            }
            result.add(qualifier);
        }
        if (result.isEmpty()) {
            throw cursor.error("expected a type specifier in " + production + " but found " + cursor.describe());
        }
        return List.copyOf(result);
    }

    /**
     * Consumes {@code qualifiers type qualifiers} as written after {@code typedef}: exactly one
     * type specifier node, which may still be a sized run.
     */
    List<SpecifierQualifier> lowerTypedefSpecifiers() {
        List<SpecifierQualifier> result = new ArrayList<>();
        while (cursor.is("type_qualifier")) {
            result.add(lowerTypeQualifier());
        }
        if (!isTypeSpecifier()) {
            throw cursor.error("expected a type specifier in type definition but found " + cursor.describe());
        }
        if (cursor.is("sized_type_specifier")) {
            for (DeclarationSpecifier fragment : lowerSizedTypeSpecifier()) {
                result.add((SpecifierQualifier) fragment);
            }
        } else {
            result.add(lowerTypeSpecifier());
        }
        while (cursor.is("type_qualifier")) {
            result.add(lowerTypeQualifier());
        }
        return List.copyOf(result);
    }

    DeclarationSpecifier lowerDeclarationSpecifier() {
        String type = cursor.type();
        if (TYPE_SPECIFIER_TYPES.contains(type)) {
            return lowerTypeSpecifier();
        }
        return switch (type) {
            case "storage_class_specifier" -> lowerStorageClassSpecifier();
            case "type_qualifier" -> lowerQualifierPosition();
            case "alignas_qualifier" -> lowerAlignmentSpecifier();
            case "attribute_specifier" -> {
                CodeRange range = cursor.range();
                yield new ExtendedDeclarationSpecifier(range, lowerAttribute());
            }
            case "attribute_declaration" -> throw cursor.error("`[[...]]` attributes are not supported");
            case "ms_declspec_modifier" -> throw cursor.error("`__declspec` is not supported");
            default -> throw Unreachable.unreachable("not a declaration specifier: " + type);
        };
    }

    TypeSpecifier lowerTypeSpecifier() {
        String type = cursor.type();
        if (type == null) {
            throw cursor.error("expected a type specifier but found " + cursor.describe());
        }
        return switch (type) {
            case "primitive_type" -> lowerPrimitiveType();
            case "type_identifier" -> {
                CodeRange range = cursor.range();
                yield new TypedefName(range, cursor.consumeText());
            }
            case "struct_specifier", "union_specifier" -> lowerStructOrUnionSpecifier();
            case "enum_specifier" -> lowerEnumSpecifier();
            case "macro_type_specifier" -> lowerMacroTypeSpecifier();
            case "sized_type_specifier" ->
                throw Unreachable.unreachable("a sized type specifier lowers to several specifiers");
            default -> throw cursor.error("expected a type specifier but found `" + type + "`");
        };
    }

    TypeQualifier lowerTypeQualifier() {
        if (!cursor.is("type_qualifier")) {
            throw cursor.error("expected a type qualifier but found " + cursor.describe());
        }
        CodeRange range = cursor.range();
        String keyword = cursor.text();
        TypeQualifier.Kind kind = TypeQualifier.Kind.fromKeyword(keyword);
        if (kind == null) {
            throw cursor.error("unsupported type qualifier `" + keyword + "`");
        }
        cursor.advance();
        return new TypeQualifier(range, kind);
    }

    /**
     * Consumes {@code type_qualifier} nodes until something else shows up, or returns
     * {@code null} when there are none.
     */
    List<TypeQualifier> lowerTypeQualifierList() {
        List<TypeQualifier> qualifiers = new ArrayList<>();
        while (cursor.is("type_qualifier")) {
            qualifiers.add(lowerTypeQualifier());
        }
        return qualifiers.isEmpty() ? null : List.copyOf(qualifiers);
    }

    Attribute lowerAttribute() {
        CodeRange range = cursor.range();
        cursor.enter();
        cursor.consume("__attribute__");
        cursor.consume("(");
        List<Expression> arguments = context.getExpressions().lowerArgumentList();
        cursor.consume(")");
        cursor.expectEnd("attribute");
        cursor.leave();
        return new Attribute(range, arguments.isEmpty() ? null : arguments);
    }

    // The grammar files `_Noreturn` and `alignas` under type qualifiers.
    private DeclarationSpecifier lowerQualifierPosition() {
        if ("alignas_qualifier".equals(cursor.firstChildType())) {
            cursor.enter();
            AlignmentSpecifier alignment = lowerAlignmentSpecifier();
            cursor.expectEnd("type qualifier");
            cursor.leave();
            return alignment;
        }
        FunctionSpecifier.Kind function = FunctionSpecifier.Kind.fromKeyword(cursor.text());
        if (function != null) {
            CodeRange range = cursor.range();
            cursor.advance();
            return new FunctionSpecifier(range, function);
        }
        return lowerTypeQualifier();
    }

    private DeclarationSpecifier lowerStorageClassSpecifier() {
        CodeRange range = cursor.range();
        String keyword = cursor.text();
        StorageClassSpecifier.Kind storage = StorageClassSpecifier.Kind.fromKeyword(keyword);
        FunctionSpecifier.Kind function = FunctionSpecifier.Kind.fromKeyword(keyword);
        if (storage == null && function == null) {
            throw cursor.error("unsupported storage class `" + keyword + "`");
        }
        cursor.advance();
        return storage != null ? new StorageClassSpecifier(range, storage) : new FunctionSpecifier(range, function);
    }

    private AlignmentSpecifier lowerAlignmentSpecifier() {
        CodeRange range = cursor.range();
        cursor.enter();
        if (!cursor.consumeIf("alignas")) {
            cursor.consume("_Alignas");
        }
        cursor.consume("(");
        AlignmentSpecifier specifier;
        if (cursor.is("type_descriptor")) {
            specifier = new AlignmentTypeSpecifier(range, context.getDeclarators().lowerTypeName());
        } else {
            specifier = new AlignmentExpressionSpecifier(range, context.getExpressions().lowerExpression());
        }
        cursor.consume(")");
        cursor.expectEnd("alignment specifier");
        cursor.leave();
        return specifier;
    }

    private TypeSpecifier lowerPrimitiveType() {
        CodeRange range = cursor.range();
        String keyword = cursor.consumeText();
        PrimitiveTypeSpecifier.Kind kind = PrimitiveTypeSpecifier.Kind.fromKeyword(keyword);
        return kind == null ? new TypedefName(range, keyword) : new PrimitiveTypeSpecifier(range, kind);
    }

    /**
     * Expands {@code unsigned long int} and friends into one specifier per keyword. Qualifiers the
     * grammar folds into the run come back as qualifiers.
     */
    List<DeclarationSpecifier> lowerSizedTypeSpecifier() {
        cursor.enter();
        List<DeclarationSpecifier> fragments = new ArrayList<>();
        while (!cursor.isAtEnd()) {
            CodeRange range = cursor.range();
            String type = cursor.type();
            if (SIZE_KEYWORDS.contains(type)) {
                cursor.advance();
                fragments.add(new PrimitiveTypeSpecifier(range, PrimitiveTypeSpecifier.Kind.fromKeyword(type)));
            } else if ("primitive_type".equals(type)) {
                fragments.add(lowerPrimitiveType());
            } else if ("type_identifier".equals(type)) {
                fragments.add(new TypedefName(range, cursor.consumeText()));
            } else if ("type_qualifier".equals(type)) {
                fragments.add(lowerTypeQualifier());
            } else {
                throw cursor.error("unexpected `" + type + "` in sized type specifier");
            }
        }
        cursor.leave();
        return fragments;
    }

    private MacroTypeSpecifier lowerMacroTypeSpecifier() {
        CodeRange range = cursor.range();
        cursor.enter();
        Identifier identifier = cursor.consumeIdentifier();
        cursor.consume("(");
        TypeName typeName = context.getDeclarators().lowerTypeName();
        cursor.consume(")");
        cursor.expectEnd("macro type specifier");
        cursor.leave();
        return new MacroTypeSpecifier(range, identifier, typeName);
    }

    private StructOrUnionSpecifier lowerStructOrUnionSpecifier() {
        CodeRange range = cursor.range();
        cursor.enter();
        boolean isStruct = cursor.is("struct");
        cursor.consume(isStruct ? "struct" : "union");
        if (cursor.isAny("attribute_specifier", "ms_declspec_modifier", "attribute_declaration")) {
            throw cursor.error("attributes before a " + (isStruct ? "struct" : "union") + " tag are not supported");
        }

        Identifier identifier = cursor.is("type_identifier") ? cursor.consumeIdentifier() : null;
        List<StructDeclaration> declarations = null;
        if (cursor.is("field_declaration_list")) {
            declarations = lowerFieldDeclarationList();
        }
        if (identifier == null && declarations == null) {
            throw new CodeError("a " + (isStruct ? "struct" : "union") + " needs a tag or a body", range);
        }
        if (cursor.isAny("attribute_specifier", "attribute_declaration")) {
            throw cursor.error("attributes after a " + (isStruct ? "struct" : "union") + " body are not supported");
        }
        cursor.expectEnd(isStruct ? "struct specifier" : "union specifier");
        cursor.leave();

        log.debug("Lowered {} {} with {} declarations", isStruct ? "struct" : "union",
                identifier == null ? "<anonymous>" : identifier.getName(),
                declarations == null ? "no" : declarations.size());
        return new StructOrUnionSpecifier(range, isStruct, identifier, declarations);
    }

    private List<StructDeclaration> lowerFieldDeclarationList() {
        cursor.enter();
        cursor.consume("{");
        List<StructDeclaration> declarations = new ArrayList<>();
        while (!cursor.isAtEnd() && !cursor.is("}")) {
            cursor.checkSyntax();
            declarations.add(lowerStructDeclaration());
        }
        cursor.consume("}");
        cursor.expectEnd("field declaration list");
        cursor.leave();
        return List.copyOf(declarations);
    }

    StructDeclaration lowerStructDeclaration() {
        String type = cursor.type();
        if (MacroConditionalLowerer.isSection(type)) {
            return context.getConditionals().lowerStructSection();
        }
        CodeRange range = cursor.range();
        return switch (type) {
            case "field_declaration" -> lowerFieldDeclaration();
            case "preproc_def" -> new MacroDefStructDeclaration(range, context.getPreprocessor().lowerDefine());
            case "preproc_function_def" ->
                new MacroFunctionDefStructDeclaration(range, context.getPreprocessor().lowerFunctionDefine());
            case "preproc_call" -> new MacroDirectiveStructDeclaration(range, context.getPreprocessor().lowerDirective());
            default -> throw cursor.error("unsupported node type in struct body: " + type);
        };
    }

    private StructField lowerFieldDeclaration() {
        CodeRange range = cursor.range();
        cursor.enter();
        List<SpecifierQualifier> specifierQualifiers = lowerSpecifierQualifiers("field declaration");

        List<StructDeclarator> declarators = new ArrayList<>();
        while (!cursor.isAtEnd() && !cursor.isAny(";", "attribute_specifier")) {
            declarators.add(lowerStructDeclarator());
            if (!cursor.consumeIf(",")) {
                break;
            }
        }
        Attribute attribute = cursor.is("attribute_specifier") ? lowerAttribute() : null;
        cursor.consume(";");
        cursor.expectEnd("field declaration");
        cursor.leave();
        return new StructField(range, specifierQualifiers, declarators.isEmpty() ? null : List.copyOf(declarators),
                attribute);
    }

    private StructDeclarator lowerStructDeclarator() {
        CodeLocation start = cursor.start();
        CodeLocation end = null;
        Declarator declarator = null;
        if (!cursor.is("bitfield_clause")) {
            declarator = context.getDeclarators().lowerDeclarator();
            end = declarator.getRange().getEnd();
        }
        Expression bitWidth = null;
        if (cursor.is("bitfield_clause")) {
            end = cursor.end();
            cursor.enter();
            cursor.consume(":");
            bitWidth = context.getExpressions().lowerExpression();
            cursor.expectEnd("bit-field clause");
            cursor.leave();
        }
        return new StructDeclarator(cursor.rangeBetween(start, end), declarator, bitWidth);
    }

    private EnumSpecifier lowerEnumSpecifier() {
        CodeRange range = cursor.range();
        cursor.enter();
        cursor.consume("enum");
        if (cursor.isAny("attribute_specifier", "ms_declspec_modifier", "attribute_declaration")) {
            throw cursor.error("attributes before an enum tag are not supported");
        }
        Identifier identifier = cursor.is("type_identifier") ? cursor.consumeIdentifier() : null;
        if (cursor.is(":")) {
            throw cursor.error("enums with a fixed underlying type are not supported");
        }
        List<EnumeratorListItem> enumerators = null;
        if (cursor.is("enumerator_list")) {
            enumerators = lowerEnumeratorList();
        }
        if (identifier == null && enumerators == null) {
            throw new CodeError("an enum needs a tag or a body", range);
        }
        cursor.expectEnd("enum specifier");
        cursor.leave();

        log.debug("Lowered enum {} with {} enumerators",
                identifier == null ? "<anonymous>" : identifier.getName(),
                enumerators == null ? "no" : enumerators.size());
        return new EnumSpecifier(range, identifier, enumerators);
    }

    private List<EnumeratorListItem> lowerEnumeratorList() {
        cursor.enter();
        cursor.consume("{");
        List<EnumeratorListItem> enumerators = new ArrayList<>();
        while (!cursor.isAtEnd() && !cursor.is("}")) {
            if (cursor.consumeIf(",")) {
                continue;
            }
            cursor.checkSyntax();
            enumerators.add(lowerEnumeratorListItem());
        }
        cursor.consume("}");
        cursor.expectEnd("enumerator list");
        cursor.leave();
        return List.copyOf(enumerators);
    }

    EnumeratorListItem lowerEnumeratorListItem() {
        String type = cursor.type();
        if (MacroConditionalLowerer.isSection(type)) {
            return context.getConditionals().lowerEnumeratorSection();
        }
        if ("enumerator".equals(type)) {
            CodeRange range = cursor.range();
            cursor.enter();
            Identifier identifier = cursor.consumeIdentifier();
            Expression value = null;
            if (cursor.consumeIf("=")) {
                value = context.getExpressions().lowerExpression();
            }
            cursor.expectEnd("enumerator");
            cursor.leave();
            return new Enumerator(range, identifier, value);
        }
        if ("preproc_call".equals(type)) {
            CodeRange range = cursor.range();
            return new MacroDirectiveEnumerator(range, context.getPreprocessor().lowerDirective());
        }
        throw cursor.error("unsupported node type in enumerator list: " + type);
    }

    private static String describeSpecifier(DeclarationSpecifier specifier) {
        if (specifier instanceof StorageClassSpecifier storage) {
            return "storage class `" + storage.getKind() + "`";
        }
        if (specifier instanceof FunctionSpecifier function) {
            return "function specifier `" + function.getKind() + "`";
        }
        if (specifier instanceof AlignmentSpecifier) {
            return "an alignment specifier";
        }
        return "an attribute";
    }
}
