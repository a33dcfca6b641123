package com.spp.compiler.ast.expr;

import com.spp.compiler.ast.AstVisitor;
import com.spp.compiler.ast.SourceLocation;

/**
 * 普通下标 {@code a[i]}（多个下标时 value 为元组）
 */
public class IndexSlice extends Slice {
    private final Expression value;

    public IndexSlice(SourceLocation location, Expression value) {
        super(location);
        this.value = value;
    }

    public Expression getValue() {
        return value;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitIndexSlice(this, context);
    }
}
