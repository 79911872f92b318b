package com.vulwitch.ast.lowering;

import static com.vulwitch.ast.lowering.LoweringFixtures.*;
import static org.assertj.core.api.Assertions.*;

import java.util.List;

import org.junit.jupiter.api.Test;

import com.vulwitch.ast.error.CodeError;
import com.vulwitch.ast.model.declaration.Declaration;
import com.vulwitch.ast.model.declaration.TypeDefinition;
import com.vulwitch.ast.model.declarator.FunctionDeclarator;
import com.vulwitch.ast.model.declarator.ParenthesizedDeclarator;
import com.vulwitch.ast.model.declarator.PointerDeclarator;
import com.vulwitch.ast.model.enumeration.Enumerator;
import com.vulwitch.ast.model.expression.BinaryExpression;
import com.vulwitch.ast.model.expression.IdentifierExpression;
import com.vulwitch.ast.model.specifier.DeclarationSpecifier;
import com.vulwitch.ast.model.specifier.EnumSpecifier;
import com.vulwitch.ast.model.specifier.ExtendedDeclarationSpecifier;
import com.vulwitch.ast.model.specifier.FunctionSpecifier;
import com.vulwitch.ast.model.specifier.PrimitiveTypeSpecifier;
import com.vulwitch.ast.model.specifier.StorageClassSpecifier;
import com.vulwitch.ast.model.specifier.StructOrUnionSpecifier;
import com.vulwitch.ast.model.specifier.TypeQualifier;
import com.vulwitch.ast.model.specifier.TypedefName;
import com.vulwitch.ast.model.struct.StructDeclarator;
import com.vulwitch.ast.model.struct.StructField;

class SpecifierLoweringTest {

    private static PrimitiveTypeSpecifier primitive(PrimitiveTypeSpecifier.Kind kind) {
        return new PrimitiveTypeSpecifier(anyRange(), kind);
    }

    private static List<DeclarationSpecifier> specifiersOf(String source) {
        return declaration(source).getSpecifiers();
    }

    @Test
    void testSizedRunsExpandToOneSpecifierPerKeyword() {
        assertThat(specifiersOf("unsigned long long x;"))
                .usingRecursiveFieldByFieldElementComparatorIgnoringFields("range")
                .containsExactly(primitive(PrimitiveTypeSpecifier.Kind.UNSIGNED),
                        primitive(PrimitiveTypeSpecifier.Kind.LONG),
                        primitive(PrimitiveTypeSpecifier.Kind.LONG));
        assertThat(specifiersOf("unsigned int x;"))
                .usingRecursiveFieldByFieldElementComparatorIgnoringFields("range")
                .containsExactly(primitive(PrimitiveTypeSpecifier.Kind.UNSIGNED),
                        primitive(PrimitiveTypeSpecifier.Kind.INT));
        assertThat(specifiersOf("long double x;"))
                .usingRecursiveFieldByFieldElementComparatorIgnoringFields("range")
                .containsExactly(primitive(PrimitiveTypeSpecifier.Kind.LONG),
                        primitive(PrimitiveTypeSpecifier.Kind.DOUBLE));
    }

    @Test
    void testSizedRunKeepsKeywordRanges() {
        List<DeclarationSpecifier> specifiers = specifiersOf("unsigned short s;");

        assertThat(specifiers.get(0).getRange().getStart()).isEqualTo(at(0, 0));
        assertThat(specifiers.get(0).getRange().getEnd()).isEqualTo(at(0, 8));
        assertThat(specifiers.get(1).getRange().getStart()).isEqualTo(at(0, 9));
    }

    @Test
    void testStorageClassesAndQualifiers() {
        assertThat(specifiersOf("static const volatile int x;"))
                .usingRecursiveFieldByFieldElementComparatorIgnoringFields("range")
                .containsExactly(new StorageClassSpecifier(anyRange(), StorageClassSpecifier.Kind.STATIC),
                        new TypeQualifier(anyRange(), TypeQualifier.Kind.CONST),
                        new TypeQualifier(anyRange(), TypeQualifier.Kind.VOLATILE),
                        primitive(PrimitiveTypeSpecifier.Kind.INT));
    }

    @Test
    void testInlineIsAFunctionSpecifier() {
        Declaration declaration = declaration("extern inline int f(void);");

        assertThat(declaration.getSpecifiers())
                .usingRecursiveFieldByFieldElementComparatorIgnoringFields("range")
                .containsExactly(new StorageClassSpecifier(anyRange(), StorageClassSpecifier.Kind.EXTERN),
                        new FunctionSpecifier(anyRange(), FunctionSpecifier.Kind.INLINE),
                        primitive(PrimitiveTypeSpecifier.Kind.INT));
        assertThat(declaration.getDeclarators().get(0)).isInstanceOf(FunctionDeclarator.class);
    }

    @Test
    void testTypedefNames() {
        assertThat(specifiersOf("my_t v;"))
                .usingRecursiveFieldByFieldElementComparatorIgnoringFields("range")
                .containsExactly(new TypedefName(anyRange(), "my_t"));
        // the grammar reports common library typedefs as primitive types
        assertThat(specifiersOf("size_t n;"))
                .usingRecursiveFieldByFieldElementComparatorIgnoringFields("range")
                .containsExactly(new TypedefName(anyRange(), "size_t"));
    }

    @Test
    void testAttributeSpecifier() {
        List<DeclarationSpecifier> specifiers = specifiersOf("__attribute__((unused)) static int x;");

        assertThat(specifiers).hasSize(3);
        ExtendedDeclarationSpecifier extended = (ExtendedDeclarationSpecifier) specifiers.get(0);
        assertThat(extended.getAttribute().getArguments()).singleElement()
                .isInstanceOfSatisfying(IdentifierExpression.class,
                        argument -> assertThat(argument.getIdentifier().getName()).isEqualTo("unused"));
    }

    @Test
    void testTypedefOfSizedType() {
        TypeDefinition typedef = only("typedef unsigned int uint;", TypeDefinition.class);

        assertThat(typedef.getSpecifiers())
                .usingRecursiveFieldByFieldElementComparatorIgnoringFields("range")
                .containsExactly(primitive(PrimitiveTypeSpecifier.Kind.UNSIGNED),
                        primitive(PrimitiveTypeSpecifier.Kind.INT));
        assertThat(typedef.getDeclarators()).hasSize(1);
    }

    @Test
    void testTypedefOfStructWithSeveralNames() {
        TypeDefinition typedef = only("""
                typedef struct node {
                    int value;
                    struct node *next;
                } node_t, *node_ptr;
                """, TypeDefinition.class);

        StructOrUnionSpecifier struct = (StructOrUnionSpecifier) typedef.getSpecifiers().get(0);
        assertThat(struct.isStruct()).isTrue();
        assertThat(struct.getIdentifier().getName()).isEqualTo("node");
        assertThat(struct.getDeclarations()).hasSize(2);
        assertThat(typedef.getDeclarators()).hasSize(2);
        assertThat(typedef.getDeclarators().get(1)).isInstanceOf(PointerDeclarator.class);
        assertThat(typedef.getRange().getEnd()).isEqualTo(at(3, 20));
    }

    @Test
    void testTypedefOfFunctionPointer() {
        TypeDefinition typedef = only("typedef int (*cmp_fn)(const void *, const void *);", TypeDefinition.class);

        FunctionDeclarator function = (FunctionDeclarator) typedef.getDeclarators().get(0);
        assertThat(function.getDeclarator()).isInstanceOf(ParenthesizedDeclarator.class);
        assertThat(function.getParameters()).hasSize(2);
    }

    @Test
    void testStructFieldsAndBitWidths() {
        StructOrUnionSpecifier struct = (StructOrUnionSpecifier) specifiersOf("""
                struct flags {
                    unsigned int ready : 1;
                    int lo, hi;
                    const char *name;
                };
                """).get(0);

        StructField ready = (StructField) struct.getDeclarations().get(0);
        assertThat(ready.getSpecifierQualifiers()).hasSize(2);
        assertThat(ready.getDeclarators()).singleElement()
                .satisfies(declarator -> assertThat(declarator.getBitWidth()).isNotNull());
        StructField pair = (StructField) struct.getDeclarations().get(1);
        assertThat(pair.getDeclarators()).hasSize(2);
        StructField name = (StructField) struct.getDeclarations().get(2);
        StructDeclarator declarator = name.getDeclarators().get(0);
        assertThat(declarator.getBitWidth()).isNull();
        assertThat(declarator.getDeclarator()).isInstanceOf(PointerDeclarator.class);
    }

    @Test
    void testUnionAndForwardReference() {
        StructOrUnionSpecifier union = (StructOrUnionSpecifier) specifiersOf("union value { int i; float f; } v;")
                .get(0);
        assertThat(union.isStruct()).isFalse();
        assertThat(union.getDeclarations()).hasSize(2);

        StructOrUnionSpecifier forward = (StructOrUnionSpecifier) specifiersOf("struct opaque *handle;").get(0);
        assertThat(forward.getIdentifier().getName()).isEqualTo("opaque");
        assertThat(forward.getDeclarations()).isNull();
    }

    @Test
    void testEmptyStructBodyIsEmptyList() {
        Declaration declaration = declaration("struct empty {};");

        StructOrUnionSpecifier struct = (StructOrUnionSpecifier) declaration.getSpecifiers().get(0);
        assertThat(struct.getDeclarations()).isEmpty();
        assertThat(declaration.getDeclarators()).isNull();
    }

    @Test
    void testStorageClassInFieldIsRejected() {
        assertThatThrownBy(() -> lower("struct s { static int x; };"))
                .isInstanceOf(CodeError.class)
                .hasMessageContaining("storage class `STATIC` is not allowed in field declaration");
    }

    @Test
    void testEnumerators() {
        EnumSpecifier enumSpecifier = (EnumSpecifier) specifiersOf("enum color { RED, GREEN = 2, BLUE = GREEN << 1, };")
                .get(0);

        assertThat(enumSpecifier.getIdentifier().getName()).isEqualTo("color");
        assertThat(enumSpecifier.getEnumerators()).hasSize(3)
                .allSatisfy(item -> assertThat(item).isInstanceOf(Enumerator.class));
        Enumerator red = (Enumerator) enumSpecifier.getEnumerators().get(0);
        Enumerator blue = (Enumerator) enumSpecifier.getEnumerators().get(2);
        assertThat(red.getExpression()).isNull();
        assertThat(blue.getExpression()).isInstanceOf(BinaryExpression.class);
    }

    @Test
    void testAnonymousEnumAndEmptyEnumerators() {
        EnumSpecifier anonymous = (EnumSpecifier) specifiersOf("enum { ONLY } e;").get(0);
        assertThat(anonymous.getIdentifier()).isNull();
        assertThat(anonymous.getEnumerators()).hasSize(1);

        EnumSpecifier forward = (EnumSpecifier) specifiersOf("enum mode m;").get(0);
        assertThat(forward.getEnumerators()).isNull();
    }

    @Test
    void testEnumWithUnderlyingTypeIsRejected() {
        assertThatThrownBy(() -> lower("enum E : int { A };"))
                .isInstanceOf(CodeError.class);
    }

    @Test
    void testStructWithoutTagOrBodyIsRejected() {
        assertThatThrownBy(() -> lower("struct;"))
                .isInstanceOf(CodeError.class);
    }
}
