package com.spp.compiler.ast.stmt;

import com.spp.compiler.ast.AstNode;
import com.spp.compiler.ast.SourceLocation;

/**
 * 语句基类
 */
public abstract class Statement extends AstNode {

    protected Statement(SourceLocation location) {
        super(location);
    }
}
