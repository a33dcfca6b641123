package com.spp.compiler.ast.expr;

import com.spp.compiler.ast.AstVisitor;
import com.spp.compiler.ast.SourceLocation;

/**
 * 星号展开 {@code *value}（调用参数、字面量元素或解包目标中）
 */
public class StarredExpr extends Expression {
    private final Expression value;

    public StarredExpr(SourceLocation location, Expression value) {
        super(location);
        this.value = value;
    }

    public Expression getValue() {
        return value;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitStarredExpr(this, context);
    }
}
