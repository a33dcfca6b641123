package com.spp.compiler.ast.stmt;

import com.spp.compiler.ast.AstVisitor;
import com.spp.compiler.ast.SourceLocation;
import com.spp.compiler.ast.expr.Expression;

/**
 * raise 语句 {@code raise [exc [from cause]]}
 */
public class RaiseStmt extends Statement {
    private final Expression exception;
    private final Expression cause;

    public RaiseStmt(SourceLocation location, Expression exception, Expression cause) {
        super(location);
        this.exception = exception;
        this.cause = cause;
    }

    public Expression getException() {
        return exception;
    }

    public Expression getCause() {
        return cause;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitRaiseStmt(this, context);
    }
}
