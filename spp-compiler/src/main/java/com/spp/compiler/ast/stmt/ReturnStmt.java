package com.spp.compiler.ast.stmt;

import com.spp.compiler.ast.AstVisitor;
import com.spp.compiler.ast.SourceLocation;
import com.spp.compiler.ast.expr.Expression;

/**
 * return 语句
 */
public class ReturnStmt extends Statement {
    private final Expression value;

    public ReturnStmt(SourceLocation location, Expression value) {
        super(location);
        this.value = value;
    }

    /** 返回值，可为 null */
    public Expression getValue() {
        return value;
    }

    public boolean hasValue() {
        return value != null;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitReturnStmt(this, context);
    }
}
