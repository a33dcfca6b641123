package com.spp.compiler.ast.expr;

import com.spp.compiler.ast.AstVisitor;
import com.spp.compiler.ast.SourceLocation;

import java.util.List;

/**
 * 集合字面量
 */
public class SetExpr extends Expression {
    private final List<Expression> elements;

    public SetExpr(SourceLocation location, List<Expression> elements) {
        super(location);
        this.elements = immutable(elements);
    }

    public List<Expression> getElements() {
        return elements;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitSetExpr(this, context);
    }
}
