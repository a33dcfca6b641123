package com.spp.compiler.ast.expr;

import com.spp.compiler.ast.AstVisitor;
import com.spp.compiler.ast.SourceLocation;

import java.util.List;

/**
 * 函数调用表达式
 */
public class CallExpr extends Expression {
    private final Expression callee;
    private final List<CallArgument> args;

    public CallExpr(SourceLocation location, Expression callee, List<CallArgument> args) {
        super(location);
        this.callee = callee;
        this.args = immutable(args);
    }

    public Expression getCallee() {
        return callee;
    }

    public List<CallArgument> getArgs() {
        return args;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitCallExpr(this, context);
    }
}
