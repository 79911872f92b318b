package com.vulwitch.ast.lowering;

import static com.vulwitch.ast.lowering.LoweringFixtures.*;
import static org.assertj.core.api.Assertions.*;

import java.util.List;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import com.vulwitch.ast.model.Identifier;
import com.vulwitch.ast.model.declaration.Declaration;
import com.vulwitch.ast.model.declarator.AbstractArrayDeclarator;
import com.vulwitch.ast.model.declarator.AbstractFunctionDeclarator;
import com.vulwitch.ast.model.declarator.AbstractParenthesizedDeclarator;
import com.vulwitch.ast.model.declarator.AbstractPointerDeclarator;
import com.vulwitch.ast.model.declarator.ArrayDeclarator;
import com.vulwitch.ast.model.declarator.ArraySize;
import com.vulwitch.ast.model.declarator.ArraySizeKind;
import com.vulwitch.ast.model.declarator.FunctionDeclarator;
import com.vulwitch.ast.model.declarator.IdentifierDeclarator;
import com.vulwitch.ast.model.declarator.InitDeclarator;
import com.vulwitch.ast.model.declarator.ParameterDeclaration;
import com.vulwitch.ast.model.declarator.ParenthesizedDeclarator;
import com.vulwitch.ast.model.declarator.PointerDeclarator;
import com.vulwitch.ast.model.expression.ConstantExpression;
import com.vulwitch.ast.model.initializer.ExpressionInitializer;
import com.vulwitch.ast.model.initializer.IndexDesignator;
import com.vulwitch.ast.model.initializer.InitializerList;
import com.vulwitch.ast.model.initializer.InitializerListItem;
import com.vulwitch.ast.model.initializer.MemberDesignator;
import com.vulwitch.ast.model.initializer.RangeDesignator;
import com.vulwitch.ast.model.specifier.PrimitiveTypeSpecifier;
import com.vulwitch.ast.model.specifier.TypeQualifier;

class DeclaratorLoweringTest {

    private static IdentifierDeclarator named(String name) {
        return new IdentifierDeclarator(anyRange(), new Identifier(anyRange(), name));
    }

    private static ConstantExpression number(String text) {
        return new ConstantExpression(anyRange(), ConstantExpression.Kind.NUMBER, text);
    }

    private static PrimitiveTypeSpecifier primitive(PrimitiveTypeSpecifier.Kind kind) {
        return new PrimitiveTypeSpecifier(anyRange(), kind);
    }

    @Test
    void testNestedPointers() {
        PointerDeclarator expected = new PointerDeclarator(anyRange(), null,
                new PointerDeclarator(anyRange(), null, named("p")));

        assertThat(firstDeclarator("int **p;"))
                .usingRecursiveComparison()
                .ignoringFieldsMatchingRegexes(RANGE_FIELDS)
                .isEqualTo(expected);
    }

    @Test
    void testPointerQualifiersAndRange() {
        PointerDeclarator pointer = (PointerDeclarator) firstDeclarator("char *const restrict s;");

        assertThat(pointer.getQualifiers()).extracting(TypeQualifier::getKind)
                .containsExactly(TypeQualifier.Kind.CONST, TypeQualifier.Kind.RESTRICT);
        assertThat(pointer.getRange().getStart()).isEqualTo(at(0, 5));
        assertThat(pointer.getRange().getEnd()).isEqualTo(at(0, 22));
    }

    @ParameterizedTest
    @CsvSource(delimiter = '|', value = {
            "int a[];         | UNKNOWN             | false | false",
            "int a[10];       | VARIABLE_EXPRESSION | false | true",
            "int a[static 10];| STATIC_EXPRESSION   | false | true",
            "int a[*];        | VARIABLE_UNKNOWN    | false | false",
            "int a[const];    | UNKNOWN             | true  | false",
            "int a[const 5];  | VARIABLE_EXPRESSION | true  | true",
    })
    void testArraySizes(String source, ArraySizeKind kind, boolean qualified, boolean sized) {
        ArraySize size = ((ArrayDeclarator) firstDeclarator(source)).getArraySize();

        assertThat(size.getKind()).isEqualTo(kind);
        assertThat(size.getQualifiers() != null).isEqualTo(qualified);
        assertThat(size.getExpression() != null).isEqualTo(sized);
        assertThat(size.getRange().getStart()).isEqualTo(at(0, 5));
    }

    @Test
    void testStaticSizeWithQualifier() {
        ArraySize size = ((ArrayDeclarator) firstDeclarator("int a[static const 4 * 2];")).getArraySize();

        assertThat(size.getKind()).isEqualTo(ArraySizeKind.STATIC_EXPRESSION);
        assertThat(size.getQualifiers()).extracting(TypeQualifier::getKind)
                .containsExactly(TypeQualifier.Kind.CONST);
        assertThat(size.getExpression()).isNotNull();
    }

    @Test
    void testSeveralDeclaratorsInOneDeclaration() {
        Declaration declaration = declaration("int a, *b = 0;");

        assertThat(declaration.getDeclarators()).hasSize(2);
        assertThat(declaration.getDeclarators().get(0))
                .usingRecursiveComparison()
                .ignoringFieldsMatchingRegexes(RANGE_FIELDS)
                .isEqualTo(named("a"));
        InitDeclarator init = (InitDeclarator) declaration.getDeclarators().get(1);
        assertThat(init.getDeclarator()).isInstanceOf(PointerDeclarator.class);
        assertThat(init.getInitializer())
                .usingRecursiveComparison()
                .ignoringFieldsMatchingRegexes(RANGE_FIELDS)
                .isEqualTo(new ExpressionInitializer(anyRange(), number("0")));
    }

    @Test
    void testVariadicFunction() {
        FunctionDeclarator function = (FunctionDeclarator) firstDeclarator("int printf(const char *fmt, ...);");

        assertThat(function.isVariadic()).isTrue();
        assertThat(function.getDeclarator())
                .usingRecursiveComparison()
                .ignoringFieldsMatchingRegexes(RANGE_FIELDS)
                .isEqualTo(named("printf"));
        ParameterDeclaration format = function.getParameters().get(0);
        assertThat(format.getSpecifiers())
                .usingRecursiveFieldByFieldElementComparatorIgnoringFields("range")
                .containsExactly(new TypeQualifier(anyRange(), TypeQualifier.Kind.CONST),
                        primitive(PrimitiveTypeSpecifier.Kind.CHAR));
        assertThat(format.getDeclarator())
                .usingRecursiveComparison()
                .ignoringFieldsMatchingRegexes(RANGE_FIELDS)
                .isEqualTo(new PointerDeclarator(anyRange(), null, named("fmt")));
        assertThat(format.getAttributes()).isNull();
    }

    @Test
    void testVoidParameterListIsOneParameter() {
        FunctionDeclarator function = (FunctionDeclarator) firstDeclarator("void f(void);");

        assertThat(function.isVariadic()).isFalse();
        assertThat(function.getParameters()).singleElement().satisfies(parameter -> {
            assertThat(parameter.getDeclarator()).isNull();
            assertThat(parameter.getSpecifiers())
                    .usingRecursiveFieldByFieldElementComparatorIgnoringFields("range")
                    .containsExactly(primitive(PrimitiveTypeSpecifier.Kind.VOID));
        });
    }

    @Test
    void testEmptyParameterList() {
        FunctionDeclarator function = (FunctionDeclarator) firstDeclarator("int g();");

        assertThat(function.getParameters()).isNull();
        assertThat(function.isVariadic()).isFalse();
    }

    @Test
    void testTrailingAttributeAfterFunctionDeclaratorIsDropped() {
        FunctionDeclarator function =
                (FunctionDeclarator) firstDeclarator("void fail(const char *why) __attribute__((noreturn));");

        assertThat(function.getDeclarator())
                .usingRecursiveComparison()
                .ignoringFieldsMatchingRegexes(RANGE_FIELDS)
                .isEqualTo(named("fail"));
        assertThat(function.getParameters()).hasSize(1);
        assertThat(function.isVariadic()).isFalse();
    }

    @Test
    void testSizedRunCountsOnceTowardTheSpecifierBound() {
        // a parameter has no trailing `;`, so counting each keyword would stop before `const`
        FunctionDeclarator function = (FunctionDeclarator) firstDeclarator("void f(unsigned long long const x);");

        ParameterDeclaration parameter = function.getParameters().get(0);
        assertThat(parameter.getSpecifiers())
                .usingRecursiveFieldByFieldElementComparatorIgnoringFields("range")
                .containsExactly(primitive(PrimitiveTypeSpecifier.Kind.UNSIGNED),
                        primitive(PrimitiveTypeSpecifier.Kind.LONG),
                        primitive(PrimitiveTypeSpecifier.Kind.LONG),
                        new TypeQualifier(anyRange(), TypeQualifier.Kind.CONST));
        assertThat(parameter.getDeclarator())
                .usingRecursiveComparison()
                .ignoringFieldsMatchingRegexes(RANGE_FIELDS)
                .isEqualTo(named("x"));
    }

    @Test
    void testAbstractDeclaratorsInParameters() {
        FunctionDeclarator function =
                (FunctionDeclarator) firstDeclarator("void h(int *, int [], int (*)(void));");
        List<ParameterDeclaration> parameters = function.getParameters();

        assertThat(parameters).hasSize(3);
        assertThat(parameters.get(0).getDeclarator())
                .usingRecursiveComparison()
                .ignoringFieldsMatchingRegexes(RANGE_FIELDS)
                .isEqualTo(new AbstractPointerDeclarator(anyRange(), null, null));
        assertThat(parameters.get(1).getDeclarator())
                .usingRecursiveComparison()
                .ignoringFieldsMatchingRegexes(RANGE_FIELDS)
                .isEqualTo(new AbstractArrayDeclarator(anyRange(), null,
                        new ArraySize(anyRange(), ArraySizeKind.UNKNOWN, null, null)));

        AbstractFunctionDeclarator callback = (AbstractFunctionDeclarator) parameters.get(2).getDeclarator();
        assertThat(callback.getDeclarator())
                .usingRecursiveComparison()
                .ignoringFieldsMatchingRegexes(RANGE_FIELDS)
                .isEqualTo(new AbstractParenthesizedDeclarator(anyRange(),
                        new AbstractPointerDeclarator(anyRange(), null, null)));
        assertThat(callback.getParameters()).hasSize(1);
        assertThat(callback.isVariadic()).isFalse();
    }

    @Test
    void testFunctionPointerDeclarator() {
        FunctionDeclarator function = (FunctionDeclarator) firstDeclarator("int (*handler)(int, char **);");

        assertThat(function.getParameters()).hasSize(2);
        assertThat(function.getDeclarator())
                .usingRecursiveComparison()
                .ignoringFieldsMatchingRegexes(RANGE_FIELDS)
                .isEqualTo(new ParenthesizedDeclarator(anyRange(),
                        new PointerDeclarator(anyRange(), null, named("handler"))));
    }

    @Test
    void testIndexAndRangeDesignators() {
        InitDeclarator init = (InitDeclarator) firstDeclarator("int a[] = {1, [2] = 3, [4 ... 5] = 6};");
        List<InitializerListItem> items = ((InitializerList) init.getInitializer()).getItems();

        assertThat(items).hasSize(3);
        assertThat(items.get(0).getDesignators()).isNull();
        assertThat(items.get(1))
                .usingRecursiveComparison()
                .ignoringFieldsMatchingRegexes(RANGE_FIELDS)
                .isEqualTo(new InitializerListItem(anyRange(),
                        List.of(new IndexDesignator(anyRange(), number("2"))),
                        new ExpressionInitializer(anyRange(), number("3"))));
        assertThat(items.get(2).getDesignators())
                .usingRecursiveFieldByFieldElementComparatorIgnoringFields("range", "from.range", "to.range")
                .containsExactly(new RangeDesignator(anyRange(), number("4"), number("5")));
    }

    @Test
    void testMemberDesignatorsAndNestedLists() {
        InitDeclarator init =
                (InitDeclarator) firstDeclarator("struct point p = {.x = 1, .rest = {2, 3}, };");
        List<InitializerListItem> items = ((InitializerList) init.getInitializer()).getItems();

        assertThat(items).hasSize(2);
        MemberDesignator x = (MemberDesignator) items.get(0).getDesignators().get(0);
        assertThat(x.getMember().getName()).isEqualTo("x");
        InitializerList nested = (InitializerList) items.get(1).getInitializer();
        assertThat(nested.getItems()).hasSize(2)
                .allSatisfy(item -> assertThat(item.getDesignators()).isNull());
    }

    @Test
    void testEmptyInitializerList() {
        InitDeclarator init = (InitDeclarator) firstDeclarator("int a[4] = {};");

        assertThat(((InitializerList) init.getInitializer()).getItems()).isEmpty();
    }
}
