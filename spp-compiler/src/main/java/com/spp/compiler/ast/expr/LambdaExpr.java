package com.spp.compiler.ast.expr;

import com.spp.compiler.ast.AstVisitor;
import com.spp.compiler.ast.SourceLocation;
import com.spp.compiler.ast.decl.Arguments;

/**
 * Lambda 表达式
 */
public class LambdaExpr extends Expression {
    private final Arguments args;
    private final Expression body;

    public LambdaExpr(SourceLocation location, Arguments args, Expression body) {
        super(location);
        this.args = args;
        this.body = body;
    }

    public Arguments getArgs() {
        return args;
    }

    public Expression getBody() {
        return body;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitLambdaExpr(this, context);
    }
}
