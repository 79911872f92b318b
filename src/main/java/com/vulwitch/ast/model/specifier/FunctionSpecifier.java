package com.vulwitch.ast.model.specifier;

import com.vulwitch.ast.location.CodeRange;
import com.vulwitch.ast.model.AstVisitor;

import lombok.NonNull;
import lombok.Value;

@Value
public class FunctionSpecifier implements DeclarationSpecifier {
    @NonNull
    CodeRange range;
    @NonNull
    Kind kind;

    @Override
    public <R> R accept(AstVisitor<R> visitor) {
        return visitor.visit(this);
    }

    public enum Kind {
        INLINE,
        NORETURN;

        public static Kind fromKeyword(String keyword) {
            return switch (keyword) {
                case "inline", "__inline", "__inline__", "__forceinline" -> INLINE;
                case "_Noreturn", "noreturn" -> NORETURN;
                default -> null;
            };
        }
    }
}
