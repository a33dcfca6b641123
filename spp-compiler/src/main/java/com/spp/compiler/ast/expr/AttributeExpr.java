package com.spp.compiler.ast.expr;

import com.spp.compiler.ast.AstVisitor;
import com.spp.compiler.ast.SourceLocation;

/**
 * 属性访问 {@code value.attr}
 */
public class AttributeExpr extends Expression {
    private final Expression value;
    private final String attr;

    public AttributeExpr(SourceLocation location, Expression value, String attr) {
        super(location);
        this.value = value;
        this.attr = attr;
    }

    public Expression getValue() {
        return value;
    }

    public String getAttr() {
        return attr;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitAttributeExpr(this, context);
    }
}
