package com.spp.compiler.ast.expr;

import com.spp.compiler.ast.AstVisitor;
import com.spp.compiler.ast.SourceLocation;

/**
 * 位置实参；{@code *args} 以 {@link StarredExpr} 作为值
 */
public class PositionalArg extends CallArgument {
    private final Expression value;

    public PositionalArg(SourceLocation location, Expression value) {
        super(location);
        this.value = value;
    }

    @Override
    public Expression getValue() {
        return value;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitPositionalArg(this, context);
    }
}
