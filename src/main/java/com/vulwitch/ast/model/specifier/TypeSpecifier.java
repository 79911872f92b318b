package com.vulwitch.ast.model.specifier;

public sealed interface TypeSpecifier extends DeclarationSpecifier, SpecifierQualifier
        permits PrimitiveTypeSpecifier, TypedefName, StructOrUnionSpecifier, EnumSpecifier, MacroTypeSpecifier {
}
