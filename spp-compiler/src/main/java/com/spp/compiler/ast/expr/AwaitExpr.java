package com.spp.compiler.ast.expr;

import com.spp.compiler.ast.AstVisitor;
import com.spp.compiler.ast.SourceLocation;

/**
 * await 表达式
 */
public class AwaitExpr extends Expression {
    private final Expression value;

    public AwaitExpr(SourceLocation location, Expression value) {
        super(location);
        this.value = value;
    }

    public Expression getValue() {
        return value;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitAwaitExpr(this, context);
    }
}
