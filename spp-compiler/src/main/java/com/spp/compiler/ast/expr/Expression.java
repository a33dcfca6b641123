package com.spp.compiler.ast.expr;

import com.spp.compiler.ast.AstNode;
import com.spp.compiler.ast.SourceLocation;

/**
 * 表达式基类
 */
public abstract class Expression extends AstNode {

    protected Expression(SourceLocation location) {
        super(location);
    }
}
