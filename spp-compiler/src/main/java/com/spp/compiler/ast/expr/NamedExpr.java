package com.spp.compiler.ast.expr;

import com.spp.compiler.ast.AstVisitor;
import com.spp.compiler.ast.SourceLocation;

/**
 * 海象赋值表达式 {@code (target := value)}
 */
public class NamedExpr extends Expression {
    private final Expression target;
    private final Expression value;

    public NamedExpr(SourceLocation location, Expression target, Expression value) {
        super(location);
        this.target = target;
        this.value = value;
    }

    public Expression getTarget() {
        return target;
    }

    public Expression getValue() {
        return value;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitNamedExpr(this, context);
    }
}
