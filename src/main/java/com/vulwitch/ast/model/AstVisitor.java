package com.vulwitch.ast.model;

import com.vulwitch.ast.model.declaration.Declaration;
import com.vulwitch.ast.model.declaration.TypeDefinition;
import com.vulwitch.ast.model.declarator.AbstractArrayDeclarator;
import com.vulwitch.ast.model.declarator.AbstractFunctionDeclarator;
import com.vulwitch.ast.model.declarator.AbstractParenthesizedDeclarator;
import com.vulwitch.ast.model.declarator.AbstractPointerDeclarator;
import com.vulwitch.ast.model.declarator.ArrayDeclarator;
import com.vulwitch.ast.model.declarator.ArraySize;
import com.vulwitch.ast.model.declarator.FunctionDeclarator;
import com.vulwitch.ast.model.declarator.IdentifierDeclarator;
import com.vulwitch.ast.model.declarator.InitDeclarator;
import com.vulwitch.ast.model.declarator.ParameterDeclaration;
import com.vulwitch.ast.model.declarator.ParenthesizedDeclarator;
import com.vulwitch.ast.model.declarator.PointerDeclarator;
import com.vulwitch.ast.model.declarator.TypeName;
import com.vulwitch.ast.model.enumeration.Enumerator;
import com.vulwitch.ast.model.enumeration.MacroConditionalEnumerator;
import com.vulwitch.ast.model.enumeration.MacroDirectiveEnumerator;
import com.vulwitch.ast.model.enumeration.MacroEnumeratorElifGroup;
import com.vulwitch.ast.model.enumeration.MacroEnumeratorElseGroup;
import com.vulwitch.ast.model.enumeration.MacroEnumeratorIfGroup;
import com.vulwitch.ast.model.enumeration.MacroEnumeratorIfdefGroup;
import com.vulwitch.ast.model.expression.BinaryExpression;
import com.vulwitch.ast.model.expression.CallExpression;
import com.vulwitch.ast.model.expression.CastExpression;
import com.vulwitch.ast.model.expression.CompoundLiteral;
import com.vulwitch.ast.model.expression.ConditionalExpression;
import com.vulwitch.ast.model.expression.ConstantExpression;
import com.vulwitch.ast.model.expression.FieldExpression;
import com.vulwitch.ast.model.expression.IdentifierExpression;
import com.vulwitch.ast.model.expression.ParenthesizedExpression;
import com.vulwitch.ast.model.expression.SizeofExpression;
import com.vulwitch.ast.model.expression.StringLiteralExpression;
import com.vulwitch.ast.model.expression.SubscriptExpression;
import com.vulwitch.ast.model.expression.UnaryExpression;
import com.vulwitch.ast.model.initializer.ExpressionInitializer;
import com.vulwitch.ast.model.initializer.IndexDesignator;
import com.vulwitch.ast.model.initializer.InitializerList;
import com.vulwitch.ast.model.initializer.InitializerListItem;
import com.vulwitch.ast.model.initializer.MemberDesignator;
import com.vulwitch.ast.model.initializer.RangeDesignator;
import com.vulwitch.ast.model.preprocess.DefineDirective;
import com.vulwitch.ast.model.preprocess.ElifDirective;
import com.vulwitch.ast.model.preprocess.ElseDirective;
import com.vulwitch.ast.model.preprocess.EndIfDirective;
import com.vulwitch.ast.model.preprocess.ErrorDirective;
import com.vulwitch.ast.model.preprocess.FunctionDefineDirective;
import com.vulwitch.ast.model.preprocess.IfDirective;
import com.vulwitch.ast.model.preprocess.IfSectionDirective;
import com.vulwitch.ast.model.preprocess.IfdefDirective;
import com.vulwitch.ast.model.preprocess.IncludeDirective;
import com.vulwitch.ast.model.preprocess.LineDirective;
import com.vulwitch.ast.model.preprocess.ParenthesizedPreprocessExpression;
import com.vulwitch.ast.model.preprocess.PragmaDirective;
import com.vulwitch.ast.model.preprocess.PreprocessBinaryExpression;
import com.vulwitch.ast.model.preprocess.PreprocessCallExpression;
import com.vulwitch.ast.model.preprocess.PreprocessDefined;
import com.vulwitch.ast.model.preprocess.PreprocessPrimitive;
import com.vulwitch.ast.model.preprocess.PreprocessUnaryExpression;
import com.vulwitch.ast.model.preprocess.UndefineDirective;
import com.vulwitch.ast.model.specifier.AlignmentExpressionSpecifier;
import com.vulwitch.ast.model.specifier.AlignmentTypeSpecifier;
import com.vulwitch.ast.model.specifier.Attribute;
import com.vulwitch.ast.model.specifier.EnumSpecifier;
import com.vulwitch.ast.model.specifier.ExtendedDeclarationSpecifier;
import com.vulwitch.ast.model.specifier.FunctionSpecifier;
import com.vulwitch.ast.model.specifier.MacroTypeSpecifier;
import com.vulwitch.ast.model.specifier.PrimitiveTypeSpecifier;
import com.vulwitch.ast.model.specifier.StorageClassSpecifier;
import com.vulwitch.ast.model.specifier.StructOrUnionSpecifier;
import com.vulwitch.ast.model.specifier.TypeQualifier;
import com.vulwitch.ast.model.specifier.TypedefName;
import com.vulwitch.ast.model.struct.MacroConditionalStructDeclaration;
import com.vulwitch.ast.model.struct.MacroDefStructDeclaration;
import com.vulwitch.ast.model.struct.MacroDirectiveStructDeclaration;
import com.vulwitch.ast.model.struct.MacroFunctionDefStructDeclaration;
import com.vulwitch.ast.model.struct.MacroStructDeclarationElifGroup;
import com.vulwitch.ast.model.struct.MacroStructDeclarationElseGroup;
import com.vulwitch.ast.model.struct.MacroStructDeclarationIfGroup;
import com.vulwitch.ast.model.struct.MacroStructDeclarationIfdefGroup;
import com.vulwitch.ast.model.struct.StructDeclarator;
import com.vulwitch.ast.model.struct.StructField;

/**
 * One visit method per concrete AST node.
 */
public interface AstVisitor<R> {
    R visit(Identifier identifier);
    R visit(TranslationUnit translationUnit);

    R visit(DefineDirective defineDirective);
    R visit(ElifDirective elifDirective);
    R visit(ElseDirective elseDirective);
    R visit(EndIfDirective endIfDirective);
    R visit(ErrorDirective errorDirective);
    R visit(FunctionDefineDirective functionDefineDirective);
    R visit(IfDirective ifDirective);
    R visit(IfSectionDirective ifSectionDirective);
    R visit(IfdefDirective ifdefDirective);
    R visit(IncludeDirective includeDirective);
    R visit(LineDirective lineDirective);
    R visit(ParenthesizedPreprocessExpression parenthesizedPreprocessExpression);
    R visit(PragmaDirective pragmaDirective);
    R visit(PreprocessBinaryExpression preprocessBinaryExpression);
    R visit(PreprocessCallExpression preprocessCallExpression);
    R visit(PreprocessDefined preprocessDefined);
    R visit(PreprocessPrimitive preprocessPrimitive);
    R visit(PreprocessUnaryExpression preprocessUnaryExpression);
    R visit(UndefineDirective undefineDirective);

    R visit(AlignmentExpressionSpecifier alignmentExpressionSpecifier);
    R visit(AlignmentTypeSpecifier alignmentTypeSpecifier);
    R visit(Attribute attribute);
    R visit(EnumSpecifier enumSpecifier);
    R visit(ExtendedDeclarationSpecifier extendedDeclarationSpecifier);
    R visit(FunctionSpecifier functionSpecifier);
    R visit(MacroTypeSpecifier macroTypeSpecifier);
    R visit(PrimitiveTypeSpecifier primitiveTypeSpecifier);
    R visit(StorageClassSpecifier storageClassSpecifier);
    R visit(StructOrUnionSpecifier structOrUnionSpecifier);
    R visit(TypeQualifier typeQualifier);
    R visit(TypedefName typedefName);

    R visit(MacroConditionalStructDeclaration macroConditionalStructDeclaration);
    R visit(MacroDefStructDeclaration macroDefStructDeclaration);
    R visit(MacroDirectiveStructDeclaration macroDirectiveStructDeclaration);
    R visit(MacroFunctionDefStructDeclaration macroFunctionDefStructDeclaration);
    R visit(MacroStructDeclarationElifGroup macroStructDeclarationElifGroup);
    R visit(MacroStructDeclarationElseGroup macroStructDeclarationElseGroup);
    R visit(MacroStructDeclarationIfGroup macroStructDeclarationIfGroup);
    R visit(MacroStructDeclarationIfdefGroup macroStructDeclarationIfdefGroup);
    R visit(StructDeclarator structDeclarator);
    R visit(StructField structField);

    R visit(Enumerator enumerator);
    R visit(MacroConditionalEnumerator macroConditionalEnumerator);
    R visit(MacroDirectiveEnumerator macroDirectiveEnumerator);
    R visit(MacroEnumeratorElifGroup macroEnumeratorElifGroup);
    R visit(MacroEnumeratorElseGroup macroEnumeratorElseGroup);
    R visit(MacroEnumeratorIfGroup macroEnumeratorIfGroup);
    R visit(MacroEnumeratorIfdefGroup macroEnumeratorIfdefGroup);

    R visit(AbstractArrayDeclarator abstractArrayDeclarator);
    R visit(AbstractFunctionDeclarator abstractFunctionDeclarator);
    R visit(AbstractParenthesizedDeclarator abstractParenthesizedDeclarator);
    R visit(AbstractPointerDeclarator abstractPointerDeclarator);
    R visit(ArrayDeclarator arrayDeclarator);
    R visit(ArraySize arraySize);
    R visit(FunctionDeclarator functionDeclarator);
    R visit(IdentifierDeclarator identifierDeclarator);
    R visit(InitDeclarator initDeclarator);
    R visit(ParameterDeclaration parameterDeclaration);
    R visit(ParenthesizedDeclarator parenthesizedDeclarator);
    R visit(PointerDeclarator pointerDeclarator);
    R visit(TypeName typeName);

    R visit(ExpressionInitializer expressionInitializer);
    R visit(IndexDesignator indexDesignator);
    R visit(InitializerList initializerList);
    R visit(InitializerListItem initializerListItem);
    R visit(MemberDesignator memberDesignator);
    R visit(RangeDesignator rangeDesignator);

    R visit(BinaryExpression binaryExpression);
    R visit(CallExpression callExpression);
    R visit(CastExpression castExpression);
    R visit(CompoundLiteral compoundLiteral);
    R visit(ConditionalExpression conditionalExpression);
    R visit(ConstantExpression constantExpression);
    R visit(FieldExpression fieldExpression);
    R visit(IdentifierExpression identifierExpression);
    R visit(ParenthesizedExpression parenthesizedExpression);
    R visit(SizeofExpression sizeofExpression);
    R visit(StringLiteralExpression stringLiteralExpression);
    R visit(SubscriptExpression subscriptExpression);
    R visit(UnaryExpression unaryExpression);

    R visit(Declaration declaration);
    R visit(TypeDefinition typeDefinition);
}
