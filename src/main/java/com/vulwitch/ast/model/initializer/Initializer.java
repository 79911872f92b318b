package com.vulwitch.ast.model.initializer;

import com.vulwitch.ast.model.AstNode;

public sealed interface Initializer extends AstNode permits ExpressionInitializer, InitializerList {
}
