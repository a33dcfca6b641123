package com.spp.compiler.ast.stmt;

import com.spp.compiler.ast.AstVisitor;
import com.spp.compiler.ast.SourceLocation;

/**
 * break 语句
 */
public class BreakStmt extends Statement {

    public BreakStmt(SourceLocation location) {
        super(location);
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitBreakStmt(this, context);
    }
}
