package com.vulwitch.ast.model;

import java.util.List;

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
 * Visits every node of a tree in source order, parents before children.
 *
 * Subclasses override {@link #enter(AstNode)}, or individual {@code visit} methods when they need
 * to stop the descent below a node.
 */
public abstract class DepthFirstAstWalker implements AstVisitor<Void> {

    public void walk(AstNode root) {
        root.accept(this);
    }

    /** Called once for every node, before its children. */
    protected abstract void enter(AstNode node);

    private void walkAll(List<? extends AstNode> nodes) {
        if (nodes != null) {
            nodes.forEach(this::walkIfPresent);
        }
    }

    private void walkIfPresent(AstNode node) {
        if (node != null) {
            node.accept(this);
        }
    }

    @Override
    public Void visit(Identifier identifier) {
        enter(identifier);
        return null;
    }

    @Override
    public Void visit(TranslationUnit translationUnit) {
        enter(translationUnit);
        walkAll(translationUnit.getNodes());
        return null;
    }

    @Override
    public Void visit(DefineDirective defineDirective) {
        enter(defineDirective);
        return null;
    }

    @Override
    public Void visit(ElifDirective elifDirective) {
        enter(elifDirective);
        walkIfPresent(elifDirective.getCondition());
        walkAll(elifDirective.getGroup());
        return null;
    }

    @Override
    public Void visit(ElseDirective elseDirective) {
        enter(elseDirective);
        walkAll(elseDirective.getGroup());
        return null;
    }

    @Override
    public Void visit(EndIfDirective endIfDirective) {
        enter(endIfDirective);
        return null;
    }

    @Override
    public Void visit(ErrorDirective errorDirective) {
        enter(errorDirective);
        return null;
    }

    @Override
    public Void visit(FunctionDefineDirective functionDefineDirective) {
        enter(functionDefineDirective);
        return null;
    }

    @Override
    public Void visit(IfDirective ifDirective) {
        enter(ifDirective);
        walkIfPresent(ifDirective.getCondition());
        walkAll(ifDirective.getGroup());
        return null;
    }

    @Override
    public Void visit(IfSectionDirective ifSectionDirective) {
        enter(ifSectionDirective);
        walkIfPresent(ifSectionDirective.getIfGroup());
        walkAll(ifSectionDirective.getElifGroups());
        walkIfPresent(ifSectionDirective.getElseGroup());
        walkIfPresent(ifSectionDirective.getEndif());
        return null;
    }

    @Override
    public Void visit(IfdefDirective ifdefDirective) {
        enter(ifdefDirective);
        walkAll(ifdefDirective.getGroup());
        return null;
    }

    @Override
    public Void visit(IncludeDirective includeDirective) {
        enter(includeDirective);
        walkIfPresent(includeDirective.getCallExpression());
        return null;
    }

    @Override
    public Void visit(LineDirective lineDirective) {
        enter(lineDirective);
        return null;
    }

    @Override
    public Void visit(ParenthesizedPreprocessExpression parenthesizedPreprocessExpression) {
        enter(parenthesizedPreprocessExpression);
        walkIfPresent(parenthesizedPreprocessExpression.getExpression());
        return null;
    }

    @Override
    public Void visit(PragmaDirective pragmaDirective) {
        enter(pragmaDirective);
        return null;
    }

    @Override
    public Void visit(PreprocessBinaryExpression preprocessBinaryExpression) {
        enter(preprocessBinaryExpression);
        walkIfPresent(preprocessBinaryExpression.getLhs());
        walkIfPresent(preprocessBinaryExpression.getRhs());
        return null;
    }

    @Override
    public Void visit(PreprocessCallExpression preprocessCallExpression) {
        enter(preprocessCallExpression);
        walkAll(preprocessCallExpression.getArguments());
        return null;
    }

    @Override
    public Void visit(PreprocessDefined preprocessDefined) {
        enter(preprocessDefined);
        return null;
    }

    @Override
    public Void visit(PreprocessPrimitive preprocessPrimitive) {
        enter(preprocessPrimitive);
        return null;
    }

    @Override
    public Void visit(PreprocessUnaryExpression preprocessUnaryExpression) {
        enter(preprocessUnaryExpression);
        walkIfPresent(preprocessUnaryExpression.getOperand());
        return null;
    }

    @Override
    public Void visit(UndefineDirective undefineDirective) {
        enter(undefineDirective);
        return null;
    }

    @Override
    public Void visit(AlignmentExpressionSpecifier alignmentExpressionSpecifier) {
        enter(alignmentExpressionSpecifier);
        walkIfPresent(alignmentExpressionSpecifier.getExpression());
        return null;
    }

    @Override
    public Void visit(AlignmentTypeSpecifier alignmentTypeSpecifier) {
        enter(alignmentTypeSpecifier);
        walkIfPresent(alignmentTypeSpecifier.getTypeName());
        return null;
    }

    @Override
    public Void visit(Attribute attribute) {
        enter(attribute);
        walkAll(attribute.getArguments());
        return null;
    }

    @Override
    public Void visit(EnumSpecifier enumSpecifier) {
        enter(enumSpecifier);
        walkIfPresent(enumSpecifier.getIdentifier());
        walkAll(enumSpecifier.getEnumerators());
        return null;
    }

    @Override
    public Void visit(ExtendedDeclarationSpecifier extendedDeclarationSpecifier) {
        enter(extendedDeclarationSpecifier);
        walkIfPresent(extendedDeclarationSpecifier.getAttribute());
        return null;
    }

    @Override
    public Void visit(FunctionSpecifier functionSpecifier) {
        enter(functionSpecifier);
        return null;
    }

    @Override
    public Void visit(MacroTypeSpecifier macroTypeSpecifier) {
        enter(macroTypeSpecifier);
        walkIfPresent(macroTypeSpecifier.getIdentifier());
        walkIfPresent(macroTypeSpecifier.getTypeName());
        return null;
    }

    @Override
    public Void visit(PrimitiveTypeSpecifier primitiveTypeSpecifier) {
        enter(primitiveTypeSpecifier);
        return null;
    }

    @Override
    public Void visit(StorageClassSpecifier storageClassSpecifier) {
        enter(storageClassSpecifier);
        return null;
    }

    @Override
    public Void visit(StructOrUnionSpecifier structOrUnionSpecifier) {
        enter(structOrUnionSpecifier);
        walkIfPresent(structOrUnionSpecifier.getIdentifier());
        walkAll(structOrUnionSpecifier.getDeclarations());
        return null;
    }

    @Override
    public Void visit(TypeQualifier typeQualifier) {
        enter(typeQualifier);
        return null;
    }

    @Override
    public Void visit(TypedefName typedefName) {
        enter(typedefName);
        return null;
    }

    @Override
    public Void visit(MacroConditionalStructDeclaration macroConditionalStructDeclaration) {
        enter(macroConditionalStructDeclaration);
        walkIfPresent(macroConditionalStructDeclaration.getIfGroup());
        walkAll(macroConditionalStructDeclaration.getElifGroups());
        walkIfPresent(macroConditionalStructDeclaration.getElseGroup());
        return null;
    }

    @Override
    public Void visit(MacroDefStructDeclaration macroDefStructDeclaration) {
        enter(macroDefStructDeclaration);
        walkIfPresent(macroDefStructDeclaration.getDefine());
        return null;
    }

    @Override
    public Void visit(MacroDirectiveStructDeclaration macroDirectiveStructDeclaration) {
        enter(macroDirectiveStructDeclaration);
        walkIfPresent(macroDirectiveStructDeclaration.getDirective());
        return null;
    }

    @Override
    public Void visit(MacroFunctionDefStructDeclaration macroFunctionDefStructDeclaration) {
        enter(macroFunctionDefStructDeclaration);
        walkIfPresent(macroFunctionDefStructDeclaration.getFunctionDefine());
        return null;
    }

    @Override
    public Void visit(MacroStructDeclarationElifGroup macroStructDeclarationElifGroup) {
        enter(macroStructDeclarationElifGroup);
        walkIfPresent(macroStructDeclarationElifGroup.getCondition());
        walkAll(macroStructDeclarationElifGroup.getDeclarations());
        return null;
    }

    @Override
    public Void visit(MacroStructDeclarationElseGroup macroStructDeclarationElseGroup) {
        enter(macroStructDeclarationElseGroup);
        walkAll(macroStructDeclarationElseGroup.getDeclarations());
        return null;
    }

    @Override
    public Void visit(MacroStructDeclarationIfGroup macroStructDeclarationIfGroup) {
        enter(macroStructDeclarationIfGroup);
        walkIfPresent(macroStructDeclarationIfGroup.getCondition());
        walkAll(macroStructDeclarationIfGroup.getDeclarations());
        return null;
    }

    @Override
    public Void visit(MacroStructDeclarationIfdefGroup macroStructDeclarationIfdefGroup) {
        enter(macroStructDeclarationIfdefGroup);
        walkIfPresent(macroStructDeclarationIfdefGroup.getIdentifier());
        walkAll(macroStructDeclarationIfdefGroup.getDeclarations());
        return null;
    }

    @Override
    public Void visit(StructDeclarator structDeclarator) {
        enter(structDeclarator);
        walkIfPresent(structDeclarator.getDeclarator());
        walkIfPresent(structDeclarator.getBitWidth());
        return null;
    }

    @Override
    public Void visit(StructField structField) {
        enter(structField);
        walkAll(structField.getSpecifierQualifiers());
        walkAll(structField.getDeclarators());
        walkIfPresent(structField.getAttribute());
        return null;
    }

    @Override
    public Void visit(Enumerator enumerator) {
        enter(enumerator);
        walkIfPresent(enumerator.getIdentifier());
        walkIfPresent(enumerator.getExpression());
        return null;
    }

    @Override
    public Void visit(MacroConditionalEnumerator macroConditionalEnumerator) {
        enter(macroConditionalEnumerator);
        walkIfPresent(macroConditionalEnumerator.getIfGroup());
        walkAll(macroConditionalEnumerator.getElifGroups());
        walkIfPresent(macroConditionalEnumerator.getElseGroup());
        return null;
    }

    @Override
    public Void visit(MacroDirectiveEnumerator macroDirectiveEnumerator) {
        enter(macroDirectiveEnumerator);
        walkIfPresent(macroDirectiveEnumerator.getDirective());
        return null;
    }

    @Override
    public Void visit(MacroEnumeratorElifGroup macroEnumeratorElifGroup) {
        enter(macroEnumeratorElifGroup);
        walkIfPresent(macroEnumeratorElifGroup.getCondition());
        walkAll(macroEnumeratorElifGroup.getEnumerators());
        return null;
    }

    @Override
    public Void visit(MacroEnumeratorElseGroup macroEnumeratorElseGroup) {
        enter(macroEnumeratorElseGroup);
        walkAll(macroEnumeratorElseGroup.getEnumerators());
        return null;
    }

    @Override
    public Void visit(MacroEnumeratorIfGroup macroEnumeratorIfGroup) {
        enter(macroEnumeratorIfGroup);
        walkIfPresent(macroEnumeratorIfGroup.getCondition());
        walkAll(macroEnumeratorIfGroup.getEnumerators());
        return null;
    }

    @Override
    public Void visit(MacroEnumeratorIfdefGroup macroEnumeratorIfdefGroup) {
        enter(macroEnumeratorIfdefGroup);
        walkIfPresent(macroEnumeratorIfdefGroup.getIdentifier());
        walkAll(macroEnumeratorIfdefGroup.getEnumerators());
        return null;
    }

    @Override
    public Void visit(AbstractArrayDeclarator abstractArrayDeclarator) {
        enter(abstractArrayDeclarator);
        walkIfPresent(abstractArrayDeclarator.getDeclarator());
        walkIfPresent(abstractArrayDeclarator.getArraySize());
        return null;
    }

    @Override
    public Void visit(AbstractFunctionDeclarator abstractFunctionDeclarator) {
        enter(abstractFunctionDeclarator);
        walkIfPresent(abstractFunctionDeclarator.getDeclarator());
        walkAll(abstractFunctionDeclarator.getParameters());
        return null;
    }

    @Override
    public Void visit(AbstractParenthesizedDeclarator abstractParenthesizedDeclarator) {
        enter(abstractParenthesizedDeclarator);
        walkIfPresent(abstractParenthesizedDeclarator.getDeclarator());
        return null;
    }

    @Override
    public Void visit(AbstractPointerDeclarator abstractPointerDeclarator) {
        enter(abstractPointerDeclarator);
        walkAll(abstractPointerDeclarator.getQualifiers());
        walkIfPresent(abstractPointerDeclarator.getDeclarator());
        return null;
    }

    @Override
    public Void visit(ArrayDeclarator arrayDeclarator) {
        enter(arrayDeclarator);
        walkIfPresent(arrayDeclarator.getDeclarator());
        walkIfPresent(arrayDeclarator.getArraySize());
        return null;
    }

    @Override
    public Void visit(ArraySize arraySize) {
        enter(arraySize);
        walkAll(arraySize.getQualifiers());
        walkIfPresent(arraySize.getExpression());
        return null;
    }

    @Override
    public Void visit(FunctionDeclarator functionDeclarator) {
        enter(functionDeclarator);
        walkIfPresent(functionDeclarator.getDeclarator());
        walkAll(functionDeclarator.getParameters());
        return null;
    }

    @Override
    public Void visit(IdentifierDeclarator identifierDeclarator) {
        enter(identifierDeclarator);
        walkIfPresent(identifierDeclarator.getIdentifier());
        return null;
    }

    @Override
    public Void visit(InitDeclarator initDeclarator) {
        enter(initDeclarator);
        walkIfPresent(initDeclarator.getDeclarator());
        walkIfPresent(initDeclarator.getInitializer());
        return null;
    }

    @Override
    public Void visit(ParameterDeclaration parameterDeclaration) {
        enter(parameterDeclaration);
        walkAll(parameterDeclaration.getSpecifiers());
        walkIfPresent(parameterDeclaration.getDeclarator());
        walkAll(parameterDeclaration.getAttributes());
        return null;
    }

    @Override
    public Void visit(ParenthesizedDeclarator parenthesizedDeclarator) {
        enter(parenthesizedDeclarator);
        walkIfPresent(parenthesizedDeclarator.getDeclarator());
        return null;
    }

    @Override
    public Void visit(PointerDeclarator pointerDeclarator) {
        enter(pointerDeclarator);
        walkAll(pointerDeclarator.getQualifiers());
        walkIfPresent(pointerDeclarator.getDeclarator());
        return null;
    }

    @Override
    public Void visit(TypeName typeName) {
        enter(typeName);
        walkAll(typeName.getSpecifierQualifiers());
        walkIfPresent(typeName.getDeclarator());
        return null;
    }

    @Override
    public Void visit(ExpressionInitializer expressionInitializer) {
        enter(expressionInitializer);
        walkIfPresent(expressionInitializer.getExpression());
        return null;
    }

    @Override
    public Void visit(IndexDesignator indexDesignator) {
        enter(indexDesignator);
        walkIfPresent(indexDesignator.getIndex());
        return null;
    }

    @Override
    public Void visit(InitializerList initializerList) {
        enter(initializerList);
        walkAll(initializerList.getItems());
        return null;
    }

    @Override
    public Void visit(InitializerListItem initializerListItem) {
        enter(initializerListItem);
        walkAll(initializerListItem.getDesignators());
        walkIfPresent(initializerListItem.getInitializer());
        return null;
    }

    @Override
    public Void visit(MemberDesignator memberDesignator) {
        enter(memberDesignator);
        walkIfPresent(memberDesignator.getMember());
        return null;
    }

    @Override
    public Void visit(RangeDesignator rangeDesignator) {
        enter(rangeDesignator);
        walkIfPresent(rangeDesignator.getFrom());
        walkIfPresent(rangeDesignator.getTo());
        return null;
    }

    @Override
    public Void visit(BinaryExpression binaryExpression) {
        enter(binaryExpression);
        walkIfPresent(binaryExpression.getLhs());
        walkIfPresent(binaryExpression.getRhs());
        return null;
    }

    @Override
    public Void visit(CallExpression callExpression) {
        enter(callExpression);
        walkIfPresent(callExpression.getFunction());
        walkAll(callExpression.getArguments());
        return null;
    }

    @Override
    public Void visit(CastExpression castExpression) {
        enter(castExpression);
        walkIfPresent(castExpression.getTypeName());
        walkIfPresent(castExpression.getOperand());
        return null;
    }

    @Override
    public Void visit(CompoundLiteral compoundLiteral) {
        enter(compoundLiteral);
        walkIfPresent(compoundLiteral.getTypeName());
        walkAll(compoundLiteral.getItems());
        return null;
    }

    @Override
    public Void visit(ConditionalExpression conditionalExpression) {
        enter(conditionalExpression);
        walkIfPresent(conditionalExpression.getCondition());
        walkIfPresent(conditionalExpression.getConsequence());
        walkIfPresent(conditionalExpression.getAlternative());
        return null;
    }

    @Override
    public Void visit(ConstantExpression constantExpression) {
        enter(constantExpression);
        return null;
    }

    @Override
    public Void visit(FieldExpression fieldExpression) {
        enter(fieldExpression);
        walkIfPresent(fieldExpression.getOperand());
        walkIfPresent(fieldExpression.getField());
        return null;
    }

    @Override
    public Void visit(IdentifierExpression identifierExpression) {
        enter(identifierExpression);
        walkIfPresent(identifierExpression.getIdentifier());
        return null;
    }

    @Override
    public Void visit(ParenthesizedExpression parenthesizedExpression) {
        enter(parenthesizedExpression);
        walkIfPresent(parenthesizedExpression.getExpression());
        return null;
    }

    @Override
    public Void visit(SizeofExpression sizeofExpression) {
        enter(sizeofExpression);
        walkIfPresent(sizeofExpression.getTypeName());
        walkIfPresent(sizeofExpression.getOperand());
        return null;
    }

    @Override
    public Void visit(StringLiteralExpression stringLiteralExpression) {
        enter(stringLiteralExpression);
        return null;
    }

    @Override
    public Void visit(SubscriptExpression subscriptExpression) {
        enter(subscriptExpression);
        walkIfPresent(subscriptExpression.getArray());
        walkIfPresent(subscriptExpression.getIndex());
        return null;
    }

    @Override
    public Void visit(UnaryExpression unaryExpression) {
        enter(unaryExpression);
        walkIfPresent(unaryExpression.getOperand());
        return null;
    }

    @Override
    public Void visit(Declaration declaration) {
        enter(declaration);
        walkAll(declaration.getSpecifiers());
        walkAll(declaration.getDeclarators());
        return null;
    }

    @Override
    public Void visit(TypeDefinition typeDefinition) {
        enter(typeDefinition);
        walkAll(typeDefinition.getSpecifiers());
        walkAll(typeDefinition.getDeclarators());
        return null;
    }
}
