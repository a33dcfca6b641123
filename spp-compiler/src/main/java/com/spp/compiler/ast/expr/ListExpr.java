package com.spp.compiler.ast.expr;

import com.spp.compiler.ast.AstVisitor;
import com.spp.compiler.ast.SourceLocation;

import java.util.List;

/**
 * 列表字面量，也可作为解包赋值目标 {@code [a, b] = ...}
 */
public class ListExpr extends Expression {
    private final List<Expression> elements;

    public ListExpr(SourceLocation location, List<Expression> elements) {
        super(location);
        this.elements = immutable(elements);
    }

    public List<Expression> getElements() {
        return elements;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitListExpr(this, context);
    }
}
