package com.vulwitch.ast.model.preprocess;

import java.util.List;

import com.vulwitch.ast.location.CodeRange;
import com.vulwitch.ast.model.AstVisitor;

import lombok.NonNull;
import lombok.Value;

/**
 * A complete top-level conditional section, from the opening directive to {@code #endif}.
 * The {@code #elif} chain is flat, in source order.
 */
@Value
public class IfSectionDirective implements PreprocessNode {
    @NonNull
    CodeRange range;
    @NonNull
    IfGroupDirective ifGroup;
    List<ElifDirective> elifGroups;
    ElseDirective elseGroup;
    @NonNull
    EndIfDirective endif;

    @Override
    public <R> R accept(AstVisitor<R> visitor) {
        return visitor.visit(this);
    }
}
