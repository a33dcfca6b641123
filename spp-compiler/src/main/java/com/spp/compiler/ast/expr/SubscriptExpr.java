package com.spp.compiler.ast.expr;

import com.spp.compiler.ast.AstVisitor;
import com.spp.compiler.ast.SourceLocation;

/**
 * 下标访问 {@code value[slice]}
 */
public class SubscriptExpr extends Expression {
    private final Expression value;
    private final Slice slice;

    public SubscriptExpr(SourceLocation location, Expression value, Slice slice) {
        super(location);
        this.value = value;
        this.slice = slice;
    }

    public Expression getValue() {
        return value;
    }

    public Slice getSlice() {
        return slice;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitSubscriptExpr(this, context);
    }
}
