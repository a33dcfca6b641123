package com.spp.compiler.ast.stmt;

import com.spp.compiler.ast.AstVisitor;
import com.spp.compiler.ast.SourceLocation;
import com.spp.compiler.ast.expr.Expression;

/**
 * assert 语句
 */
public class AssertStmt extends Statement {
    private final Expression test;
    private final Expression message;

    public AssertStmt(SourceLocation location, Expression test, Expression message) {
        super(location);
        this.test = test;
        this.message = message;
    }

    public Expression getTest() {
        return test;
    }

    public Expression getMessage() {
        return message;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitAssertStmt(this, context);
    }
}
