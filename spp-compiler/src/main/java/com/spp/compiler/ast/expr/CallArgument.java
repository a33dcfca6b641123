package com.spp.compiler.ast.expr;

import com.spp.compiler.ast.AstNode;
import com.spp.compiler.ast.SourceLocation;

/**
 * 调用实参基类：位置实参或关键字实参
 */
public abstract class CallArgument extends AstNode {

    protected CallArgument(SourceLocation location) {
        super(location);
    }

    public abstract Expression getValue();
}
