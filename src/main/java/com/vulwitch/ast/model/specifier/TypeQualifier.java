package com.vulwitch.ast.model.specifier;

import com.vulwitch.ast.location.CodeRange;
import com.vulwitch.ast.model.AstVisitor;

import lombok.NonNull;
import lombok.Value;

@Value
public class TypeQualifier implements DeclarationSpecifier, SpecifierQualifier {
    @NonNull
    CodeRange range;
    @NonNull
    Kind kind;

    @Override
    public <R> R accept(AstVisitor<R> visitor) {
        return visitor.visit(this);
    }

    public enum Kind {
        CONST,
        VOLATILE,
        RESTRICT,
        ATOMIC,
        /** Clang nullability: {@code _Nonnull}. */
        NONNULL,
        NULLABLE,
        NULL_UNSPECIFIED;

        public static Kind fromKeyword(String keyword) {
            return switch (keyword) {
                case "const" -> CONST;
                case "volatile" -> VOLATILE;
                case "restrict", "__restrict", "__restrict__" -> RESTRICT;
                case "_Atomic" -> ATOMIC;
                case "_Nonnull" -> NONNULL;
                case "_Nullable" -> NULLABLE;
                case "_Null_unspecified" -> NULL_UNSPECIFIED;
                default -> null;
            };
        }
    }
}
