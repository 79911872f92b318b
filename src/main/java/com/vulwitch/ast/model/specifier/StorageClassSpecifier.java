package com.vulwitch.ast.model.specifier;

import com.vulwitch.ast.location.CodeRange;
import com.vulwitch.ast.model.AstVisitor;

import lombok.NonNull;
import lombok.Value;

@Value
public class StorageClassSpecifier implements DeclarationSpecifier {
    @NonNull
    CodeRange range;
    @NonNull
    Kind kind;

    @Override
    public <R> R accept(AstVisitor<R> visitor) {
        return visitor.visit(this);
    }

    public enum Kind {
        EXTERN,
        STATIC,
        AUTO,
        REGISTER,
        THREAD_LOCAL;

        public static Kind fromKeyword(String keyword) {
            return switch (keyword) {
                case "extern" -> EXTERN;
                case "static" -> STATIC;
                case "auto" -> AUTO;
                case "register" -> REGISTER;
                case "thread_local", "_Thread_local", "__thread" -> THREAD_LOCAL;
                default -> null;
            };
        }
    }
}
