package com.spp.compiler.ast.expr;

import com.spp.compiler.ast.AstVisitor;
import com.spp.compiler.ast.SourceLocation;

import java.util.List;

/**
 * 字典推导式 {@code {k: v for ...}}，元素为一个键值对
 */
public class DictCompExpr extends Expression {
    private final KeyValue element;
    private final List<Comprehension> generators;

    public DictCompExpr(SourceLocation location, KeyValue element, List<Comprehension> generators) {
        super(location);
        this.element = element;
        this.generators = immutable(generators);
    }

    public KeyValue getElement() {
        return element;
    }

    public List<Comprehension> getGenerators() {
        return generators;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitDictCompExpr(this, context);
    }
}
