package com.spp.compiler.ast.expr;

import com.spp.compiler.ast.AstVisitor;
import com.spp.compiler.ast.SourceLocation;

import java.util.List;

/**
 * 集合推导式 {@code {elt for ...}}
 */
public class SetCompExpr extends Expression {
    private final Expression element;
    private final List<Comprehension> generators;

    public SetCompExpr(SourceLocation location, Expression element, List<Comprehension> generators) {
        super(location);
        this.element = element;
        this.generators = immutable(generators);
    }

    public Expression getElement() {
        return element;
    }

    public List<Comprehension> getGenerators() {
        return generators;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitSetCompExpr(this, context);
    }
}
