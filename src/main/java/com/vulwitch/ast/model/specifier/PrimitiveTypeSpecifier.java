package com.vulwitch.ast.model.specifier;

import com.vulwitch.ast.location.CodeRange;
import com.vulwitch.ast.model.AstVisitor;

import lombok.NonNull;
import lombok.Value;

/**
 * One primitive type keyword. {@code unsigned long long} is three of these.
 */
@Value
public class PrimitiveTypeSpecifier implements TypeSpecifier {
    @NonNull
    CodeRange range;
    @NonNull
    Kind kind;

    @Override
    public <R> R accept(AstVisitor<R> visitor) {
        return visitor.visit(this);
    }

    public enum Kind {
        VOID,
        CHAR,
        SHORT,
        INT,
        LONG,
        FLOAT,
        DOUBLE,
        SIGNED,
        UNSIGNED,
        BOOL,
        COMPLEX;

        /**
         * Maps a keyword to its kind, or {@code null} for names such as {@code size_t} that the
         * grammar also reports as primitive types.
         */
        public static Kind fromKeyword(String keyword) {
            return switch (keyword) {
                case "void" -> VOID;
                case "char" -> CHAR;
                case "short" -> SHORT;
                case "int" -> INT;
                case "long" -> LONG;
                case "float" -> FLOAT;
                case "double" -> DOUBLE;
                case "signed" -> SIGNED;
                case "unsigned" -> UNSIGNED;
                case "bool", "_Bool" -> BOOL;
                case "_Complex", "__complex__" -> COMPLEX;
                default -> null;
            };
        }
    }
}
