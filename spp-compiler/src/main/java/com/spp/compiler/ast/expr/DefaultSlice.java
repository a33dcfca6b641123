package com.spp.compiler.ast.expr;

import com.spp.compiler.ast.AstVisitor;
import com.spp.compiler.ast.SourceLocation;

/**
 * 切片 {@code lower:upper:step}，三个部分均可省略（null）
 */
public class DefaultSlice extends Slice {
    private final Expression lower;
    private final Expression upper;
    private final Expression step;

    public DefaultSlice(SourceLocation location, Expression lower, Expression upper, Expression step) {
        super(location);
        this.lower = lower;
        this.upper = upper;
        this.step = step;
    }

    public Expression getLower() {
        return lower;
    }

    public Expression getUpper() {
        return upper;
    }

    public Expression getStep() {
        return step;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitDefaultSlice(this, context);
    }
}
