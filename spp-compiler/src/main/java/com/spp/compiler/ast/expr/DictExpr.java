package com.spp.compiler.ast.expr;

import com.spp.compiler.ast.AstVisitor;
import com.spp.compiler.ast.SourceLocation;

import java.util.List;

/**
 * 字典字面量
 */
public class DictExpr extends Expression {
    private final List<KeyValue> entries;

    public DictExpr(SourceLocation location, List<KeyValue> entries) {
        super(location);
        this.entries = immutable(entries);
    }

    public List<KeyValue> getEntries() {
        return entries;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitDictExpr(this, context);
    }
}
