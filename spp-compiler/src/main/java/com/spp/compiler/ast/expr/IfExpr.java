package com.spp.compiler.ast.expr;

import com.spp.compiler.ast.AstVisitor;
import com.spp.compiler.ast.SourceLocation;

/**
 * 条件表达式 {@code body if test else orElse}
 */
public class IfExpr extends Expression {
    private final Expression condition;
    private final Expression thenExpr;
    private final Expression elseExpr;

    public IfExpr(SourceLocation location, Expression condition, Expression thenExpr, Expression elseExpr) {
        super(location);
        this.condition = condition;
        this.thenExpr = thenExpr;
        this.elseExpr = elseExpr;
    }

    public Expression getCondition() {
        return condition;
    }

    public Expression getThenExpr() {
        return thenExpr;
    }

    public Expression getElseExpr() {
        return elseExpr;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitIfExpr(this, context);
    }
}
