package com.vulwitch.ast.model.initializer;

import com.vulwitch.ast.model.AstNode;

public sealed interface Designator extends AstNode permits IndexDesignator, MemberDesignator, RangeDesignator {
}
