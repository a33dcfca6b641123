package com.spp.compiler.ast.expr;

import com.spp.compiler.ast.AstNode;
import com.spp.compiler.ast.SourceLocation;

/**
 * 下标内容基类：{@link IndexSlice}、{@link DefaultSlice}、{@link ExtSlice}
 */
public abstract class Slice extends AstNode {

    protected Slice(SourceLocation location) {
        super(location);
    }
}
