package com.spp.compiler.ast.expr;

import com.spp.compiler.ast.AstVisitor;
import com.spp.compiler.ast.SourceLocation;

import java.util.List;

/**
 * 扩展切片 {@code a[1:2, ::3, i]}
 */
public class ExtSlice extends Slice {
    private final List<Slice> dims;

    public ExtSlice(SourceLocation location, List<Slice> dims) {
        super(location);
        this.dims = immutable(dims);
    }

    public List<Slice> getDims() {
        return dims;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitExtSlice(this, context);
    }
}
