package com.vulwitch.ast.model.specifier;

import java.util.List;

import com.vulwitch.ast.location.CodeRange;
import com.vulwitch.ast.model.AstVisitor;
import com.vulwitch.ast.model.Identifier;
import com.vulwitch.ast.model.enumeration.EnumeratorListItem;

import lombok.NonNull;
import lombok.Value;

@Value
public class EnumSpecifier implements TypeSpecifier {
    @NonNull
    CodeRange range;
    Identifier identifier;
    List<EnumeratorListItem> enumerators;

    @Override
    public <R> R accept(AstVisitor<R> visitor) {
        return visitor.visit(this);
    }
}
