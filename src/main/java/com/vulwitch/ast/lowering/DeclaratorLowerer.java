package com.vulwitch.ast.lowering;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

import com.vulwitch.ast.location.CodeLocation;
import com.vulwitch.ast.location.CodeRange;
import com.vulwitch.ast.model.Identifier;
import com.vulwitch.ast.model.declarator.AbstractArrayDeclarator;
import com.vulwitch.ast.model.declarator.AbstractDeclarator;
import com.vulwitch.ast.model.declarator.AbstractFunctionDeclarator;
import com.vulwitch.ast.model.declarator.AbstractParenthesizedDeclarator;
import com.vulwitch.ast.model.declarator.AbstractPointerDeclarator;
import com.vulwitch.ast.model.declarator.ArrayDeclarator;
import com.vulwitch.ast.model.declarator.ArraySize;
import com.vulwitch.ast.model.declarator.ArraySizeKind;
import com.vulwitch.ast.model.declarator.Declarator;
import com.vulwitch.ast.model.declarator.FunctionDeclarator;
import com.vulwitch.ast.model.declarator.IdentifierDeclarator;
import com.vulwitch.ast.model.declarator.InitDeclarator;
import com.vulwitch.ast.model.declarator.ParameterDeclaration;
import com.vulwitch.ast.model.declarator.ParameterDeclarator;
import com.vulwitch.ast.model.declarator.ParenthesizedDeclarator;
import com.vulwitch.ast.model.declarator.PointerDeclarator;
import com.vulwitch.ast.model.declarator.TypeName;
import com.vulwitch.ast.model.expression.Expression;
import com.vulwitch.ast.model.initializer.Designator;
import com.vulwitch.ast.model.initializer.ExpressionInitializer;
import com.vulwitch.ast.model.initializer.IndexDesignator;
import com.vulwitch.ast.model.initializer.Initializer;
import com.vulwitch.ast.model.initializer.InitializerList;
import com.vulwitch.ast.model.initializer.InitializerListItem;
import com.vulwitch.ast.model.initializer.MemberDesignator;
import com.vulwitch.ast.model.initializer.RangeDesignator;
import com.vulwitch.ast.model.specifier.Attribute;
import com.vulwitch.ast.model.specifier.DeclarationSpecifier;
import com.vulwitch.ast.model.specifier.SpecifierQualifier;
import com.vulwitch.ast.model.specifier.TypeQualifier;

/**
 * Lowers named and abstract declarators, parameter lists, type names and initializers.
 * Named declarators in field declarations end in a {@code field_identifier}, those in type
 * definitions in a {@code type_identifier}; all leaves become an {@link IdentifierDeclarator}.
 */
final class DeclaratorLowerer {

    private static final Set<String> LEAF_TYPES = Set.of(
            "identifier", "field_identifier", "type_identifier", "primitive_type");

    private static final Set<String> DECLARATOR_TYPES = Set.of(
            "identifier",
            "field_identifier",
            "type_identifier",
            "pointer_declarator",
            "function_declarator",
            "array_declarator",
            "parenthesized_declarator",
            "init_declarator",
            "attributed_declarator");

    private static final Set<String> ABSTRACT_DECLARATOR_TYPES = Set.of(
            "abstract_pointer_declarator",
            "abstract_function_declarator",
            "abstract_array_declarator",
            "abstract_parenthesized_declarator");

    private final LoweringContext context;
    private final LoweringCursor cursor;

    DeclaratorLowerer(LoweringContext context) {
        this.context = context;
        this.cursor = context.getCursor();
    }

    boolean isDeclarator() {
        return cursor.isIn(DECLARATOR_TYPES);
    }

    boolean isAbstractDeclarator() {
        return cursor.isIn(ABSTRACT_DECLARATOR_TYPES);
    }

    Declarator lowerDeclarator() {
        String type = cursor.type();
        if (type == null) {
            throw cursor.error("expected a declarator but found " + cursor.describe());
        }
        if (LEAF_TYPES.contains(type)) {
            return lowerIdentifierDeclarator();
        }
        return switch (type) {
            case "pointer_declarator" -> lowerPointerDeclarator();
            case "function_declarator" -> lowerFunctionDeclarator();
            case "array_declarator" -> lowerArrayDeclarator();
            case "parenthesized_declarator" -> lowerParenthesizedDeclarator();
            case "init_declarator" -> lowerInitDeclarator();
            case "attributed_declarator" -> throw cursor.error("attributed declarators are not supported");
            default -> throw cursor.error("unsupported declarator: " + type);
        };
    }

    AbstractDeclarator lowerAbstractDeclarator() {
        String type = cursor.type();
        if (type == null) {
            throw cursor.error("expected an abstract declarator but found " + cursor.describe());
        }
        return switch (type) {
            case "abstract_pointer_declarator" -> lowerAbstractPointerDeclarator();
            case "abstract_function_declarator" -> lowerAbstractFunctionDeclarator();
            case "abstract_array_declarator" -> lowerAbstractArrayDeclarator();
            case "abstract_parenthesized_declarator" -> lowerAbstractParenthesizedDeclarator();
            default -> throw cursor.error("unsupported abstract declarator: " + type);
        };
    }

    private IdentifierDeclarator lowerIdentifierDeclarator() {
        CodeRange range = cursor.range();
        if (cursor.is("primitive_type")) {
            // `typedef int int32;` style redefinitions of names the grammar knows as primitives
            return new IdentifierDeclarator(range, new Identifier(range, cursor.consumeText()));
        }
        return new IdentifierDeclarator(range, cursor.consumeIdentifier());
    }

    private PointerDeclarator lowerPointerDeclarator() {
        CodeRange range = cursor.range();
        cursor.enter();
        rejectMicrosoftModifier("ms_based_modifier");
        cursor.consume("*");
        rejectMicrosoftModifier("ms_pointer_modifier");
        List<TypeQualifier> qualifiers = context.getSpecifiers().lowerTypeQualifierList();
        Declarator declarator = lowerDeclarator();
        cursor.expectEnd("pointer declarator");
        cursor.leave();
        return new PointerDeclarator(range, qualifiers, declarator);
    }

    private FunctionDeclarator lowerFunctionDeclarator() {
        CodeRange range = cursor.range();
        cursor.enter();
        Declarator declarator = lowerDeclarator();
        ParameterList parameters = lowerParameterList();
        // GNU attributes after the parameter list are dropped
        while (cursor.is("attribute_specifier")) {
            context.getSpecifiers().lowerAttribute();
        }
        if (cursor.isAny("gnu_asm_expression", "attribute_declaration")) {
            throw cursor.error("`" + cursor.type() + "` after a function declarator is not supported");
        }
        cursor.expectEnd("function declarator");
        cursor.leave();
        return new FunctionDeclarator(range, declarator, parameters.declarations, parameters.isVariadic);
    }

    private ArrayDeclarator lowerArrayDeclarator() {
        CodeRange range = cursor.range();
        cursor.enter();
        Declarator declarator = lowerDeclarator();
        ArraySize size = lowerArraySize();
        cursor.expectEnd("array declarator");
        cursor.leave();
        return new ArrayDeclarator(range, declarator, size);
    }

    private ParenthesizedDeclarator lowerParenthesizedDeclarator() {
        CodeRange range = cursor.range();
        cursor.enter();
        cursor.consume("(");
        rejectMicrosoftModifier("ms_call_modifier");
        Declarator declarator = lowerDeclarator();
        cursor.consume(")");
        cursor.expectEnd("parenthesized declarator");
        cursor.leave();
        return new ParenthesizedDeclarator(range, declarator);
    }

    private InitDeclarator lowerInitDeclarator() {
        CodeRange range = cursor.range();
        cursor.enter();
        Declarator declarator = lowerDeclarator();
        if (cursor.is("argument_list")) {
            throw cursor.error("constructor-style initializers are not supported");
        }
        cursor.consume("=");
        Initializer initializer = lowerInitializer();
        cursor.expectEnd("init declarator");
        cursor.leave();
        return new InitDeclarator(range, declarator, initializer);
    }

    private AbstractPointerDeclarator lowerAbstractPointerDeclarator() {
        CodeRange range = cursor.range();
        cursor.enter();
        cursor.consume("*");
        rejectMicrosoftModifier("ms_pointer_modifier");
        List<TypeQualifier> qualifiers = context.getSpecifiers().lowerTypeQualifierList();
        AbstractDeclarator declarator = isAbstractDeclarator() ? lowerAbstractDeclarator() : null;
        cursor.expectEnd("abstract pointer declarator");
        cursor.leave();
        return new AbstractPointerDeclarator(range, qualifiers, declarator);
    }

    private AbstractFunctionDeclarator lowerAbstractFunctionDeclarator() {
        CodeRange range = cursor.range();
        cursor.enter();
        AbstractDeclarator declarator = isAbstractDeclarator() ? lowerAbstractDeclarator() : null;
        ParameterList parameters = lowerParameterList();
        cursor.expectEnd("abstract function declarator");
        cursor.leave();
        return new AbstractFunctionDeclarator(range, declarator, parameters.declarations, parameters.isVariadic);
    }

    private AbstractArrayDeclarator lowerAbstractArrayDeclarator() {
        CodeRange range = cursor.range();
        cursor.enter();
        AbstractDeclarator declarator = isAbstractDeclarator() ? lowerAbstractDeclarator() : null;
        ArraySize size = lowerArraySize();
        cursor.expectEnd("abstract array declarator");
        cursor.leave();
        return new AbstractArrayDeclarator(range, declarator, size);
    }

    private AbstractParenthesizedDeclarator lowerAbstractParenthesizedDeclarator() {
        CodeRange range = cursor.range();
        cursor.enter();
        cursor.consume("(");
        rejectMicrosoftModifier("ms_call_modifier");
        AbstractDeclarator declarator = lowerAbstractDeclarator();
        cursor.consume(")");
        cursor.expectEnd("abstract parenthesized declarator");
        cursor.leave();
        return new AbstractParenthesizedDeclarator(range, declarator);
    }

    /**
     * Lowers the bracketed tail of a named or abstract array declarator, from {@code [} to
     * {@code ]}. The cursor is left past the closing bracket.
     */
    ArraySize lowerArraySize() {
        CodeLocation start = cursor.start();
        cursor.consume("[");

        ArraySizeKind kind;
        List<TypeQualifier> qualifiers = null;
        Expression expression = null;
        if (cursor.consumeIf("*")) {
            // a bare `*` child only appears as `[*]`; multiplications are binary expressions
            kind = ArraySizeKind.VARIABLE_UNKNOWN;
        } else if (cursor.consumeIf("static")) {
            qualifiers = context.getSpecifiers().lowerTypeQualifierList();
            expression = context.getExpressions().lowerExpression();
            kind = ArraySizeKind.STATIC_EXPRESSION;
        } else if (cursor.is("type_qualifier")) {
            qualifiers = context.getSpecifiers().lowerTypeQualifierList();
            if (cursor.consumeIf("static")) {
                expression = context.getExpressions().lowerExpression();
                kind = ArraySizeKind.STATIC_EXPRESSION;
            } else if (cursor.consumeIf("*")) {
                kind = ArraySizeKind.VARIABLE_UNKNOWN;
            } else if (cursor.is("]")) {
                kind = ArraySizeKind.UNKNOWN;
            } else {
                expression = context.getExpressions().lowerExpression();
                kind = ArraySizeKind.VARIABLE_EXPRESSION;
            }
        } else if (cursor.is("]")) {
            kind = ArraySizeKind.UNKNOWN;
        } else {
            expression = context.getExpressions().lowerExpression();
            kind = ArraySizeKind.VARIABLE_EXPRESSION;
        }

        CodeLocation end = cursor.end();
        cursor.consume("]");
        return new ArraySize(cursor.rangeBetween(start, end), kind, qualifiers, expression);
    }

    /**
     * Lowers a {@code type_descriptor}: the type of a cast, a {@code sizeof}, a compound literal
     * or an alignment specifier.
     */
    TypeName lowerTypeName() {
        CodeRange range = cursor.range();
        cursor.enter();
        List<SpecifierQualifier> specifierQualifiers =
                context.getSpecifiers().lowerSpecifierQualifiers("type name");
        AbstractDeclarator declarator = isAbstractDeclarator() ? lowerAbstractDeclarator() : null;
        cursor.expectEnd("type name");
        cursor.leave();
        return new TypeName(range, specifierQualifiers, declarator);
    }

    private ParameterList lowerParameterList() {
        if (!cursor.is("parameter_list")) {
            throw cursor.error("expected a parameter list but found " + cursor.describe());
        }
        cursor.enter();
        cursor.consume("(");
        List<ParameterDeclaration> declarations = new ArrayList<>();
        boolean isVariadic = false;
        while (!cursor.isAtEnd() && !cursor.is(")")) {
            if (isVariadic) {
                throw cursor.error("`...` must be the last parameter");
            }
            if (cursor.isAny("variadic_parameter", "...")) {
                cursor.advance();
                isVariadic = true;
            } else if (cursor.is("parameter_declaration")) {
                declarations.add(lowerParameterDeclaration());
            } else {
                throw cursor.error("unsupported node type in parameter list: " + cursor.type());
            }
            if (!cursor.consumeIf(",")) {
                break;
            }
        }
        cursor.consume(")");
        cursor.expectEnd("parameter list");
        cursor.leave();
        return new ParameterList(declarations.isEmpty() ? null : List.copyOf(declarations), isVariadic);
    }

    private ParameterDeclaration lowerParameterDeclaration() {
        CodeRange range = cursor.range();
        cursor.enter();
        List<DeclarationSpecifier> specifiers = context.getSpecifiers().lowerDeclarationSpecifiers();
        if (specifiers.isEmpty()) {
            throw cursor.error("expected a declaration specifier in parameter but found " + cursor.describe());
        }
        ParameterDeclarator declarator = null;
        if (isDeclarator()) {
            declarator = lowerDeclarator();
        } else if (isAbstractDeclarator()) {
            declarator = lowerAbstractDeclarator();
        }
        List<Attribute> attributes = new ArrayList<>();
        while (cursor.is("attribute_specifier")) {
            attributes.add(context.getSpecifiers().lowerAttribute());
        }
        cursor.expectEnd("parameter declaration");
        cursor.leave();
        return new ParameterDeclaration(range, List.copyOf(specifiers), declarator,
                attributes.isEmpty() ? null : List.copyOf(attributes));
    }

    Initializer lowerInitializer() {
        if (cursor.is("initializer_list")) {
            CodeRange range = cursor.range();
            return new InitializerList(range, lowerInitializerList());
        }
        CodeRange range = cursor.range();
        return new ExpressionInitializer(range, context.getExpressions().lowerExpression());
    }

    /**
     * Lowers the items of a brace-enclosed initializer list, trailing comma allowed.
     */
    List<InitializerListItem> lowerInitializerList() {
        cursor.enter();
        cursor.consume("{");
        List<InitializerListItem> items = new ArrayList<>();
        while (!cursor.isAtEnd() && !cursor.is("}")) {
            items.add(lowerInitializerListItem());
            if (!cursor.consumeIf(",")) {
                break;
            }
        }
        cursor.consume("}");
        cursor.expectEnd("initializer list");
        cursor.leave();
        return List.copyOf(items);
    }

    private InitializerListItem lowerInitializerListItem() {
        CodeRange range = cursor.range();
        if (!cursor.is("initializer_pair")) {
            return new InitializerListItem(range, null, lowerInitializer());
        }
        cursor.enter();
        List<Designator> designators = new ArrayList<>();
        if (cursor.is("field_identifier")) {
            // GNU `member: value`
            Identifier member = cursor.consumeIdentifier();
            designators.add(new MemberDesignator(member.getRange(), member));
            cursor.consume(":");
        } else {
            while (!cursor.isAtEnd() && !cursor.is("=")) {
                designators.add(lowerDesignator());
            }
            cursor.consume("=");
        }
        Initializer initializer = lowerInitializer();
        cursor.expectEnd("initializer pair");
        cursor.leave();
        return new InitializerListItem(range, List.copyOf(designators), initializer);
    }

    private Designator lowerDesignator() {
        CodeRange range = cursor.range();
        String type = cursor.type();
        cursor.enter();
        Designator designator = switch (type) {
            case "subscript_designator" -> {
                cursor.consume("[");
                Expression index = context.getExpressions().lowerExpression();
                cursor.consume("]");
                yield new IndexDesignator(range, index);
            }
            case "field_designator" -> {
                cursor.consume(".");
                yield new MemberDesignator(range, cursor.consumeIdentifier());
            }
            case "subscript_range_designator" -> {
                cursor.consume("[");
                Expression from = context.getExpressions().lowerExpression();
                cursor.consume("...");
                Expression to = context.getExpressions().lowerExpression();
                cursor.consume("]");
                yield new RangeDesignator(range, from, to);
            }
            default -> throw cursor.error("unsupported designator: " + type);
        };
        cursor.expectEnd(type);
        cursor.leave();
        return designator;
    }

    private void rejectMicrosoftModifier(String type) {
        if (cursor.is(type)) {
            throw cursor.error("`" + type + "` is not supported");
        }
    }

    private static final class ParameterList {
        private final List<ParameterDeclaration> declarations;
        private final boolean isVariadic;

        private ParameterList(List<ParameterDeclaration> declarations, boolean isVariadic) {
            this.declarations = declarations;
            this.isVariadic = isVariadic;
        }
    }
}
