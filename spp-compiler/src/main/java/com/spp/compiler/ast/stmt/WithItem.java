package com.spp.compiler.ast.stmt;

import com.spp.compiler.ast.AstNode;
import com.spp.compiler.ast.AstVisitor;
import com.spp.compiler.ast.SourceLocation;
import com.spp.compiler.ast.expr.Expression;

/**
 * with 语句中的一项 {@code contextExpr [as optionalVars]}
 */
public class WithItem extends AstNode {
    private final Expression contextExpr;
    private final Expression optionalVars;

    public WithItem(SourceLocation location, Expression contextExpr, Expression optionalVars) {
        super(location);
        this.contextExpr = contextExpr;
        this.optionalVars = optionalVars;
    }

    public Expression getContextExpr() {
        return contextExpr;
    }

    public Expression getOptionalVars() {
        return optionalVars;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitWithItem(this, context);
    }
}
