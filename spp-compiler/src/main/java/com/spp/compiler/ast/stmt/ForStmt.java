package com.spp.compiler.ast.stmt;

import com.spp.compiler.ast.AstVisitor;
import com.spp.compiler.ast.SourceLocation;
import com.spp.compiler.ast.expr.Expression;

import java.util.List;

/**
 * for 循环 {@code [async] for target in iter: body else: orelse}
 */
public class ForStmt extends Statement {
    private final Expression target;
    private final Expression iter;
    private final List<Statement> body;
    private final List<Statement> orelse;
    private final boolean async;

    public ForStmt(SourceLocation location, Expression target, Expression iter,
                   List<Statement> body, List<Statement> orelse, boolean async) {
        super(location);
        this.target = target;
        this.iter = iter;
        this.body = immutable(body);
        this.orelse = immutable(orelse);
        this.async = async;
    }

    public Expression getTarget() {
        return target;
    }

    public Expression getIter() {
        return iter;
    }

    public List<Statement> getBody() {
        return body;
    }

    public List<Statement> getOrelse() {
        return orelse;
    }

    public boolean isAsync() {
        return async;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitForStmt(this, context);
    }
}
