package com.spp.compiler.ast.expr;

import com.spp.compiler.ast.AstNode;
import com.spp.compiler.ast.AstVisitor;
import com.spp.compiler.ast.SourceLocation;

import java.util.List;

/**
 * 推导式中的一个 {@code for target in iter if cond...} 子句
 */
public class Comprehension extends AstNode {
    private final Expression target;
    private final Expression iter;
    private final List<Expression> ifs;
    private final boolean async;

    public Comprehension(SourceLocation location, Expression target, Expression iter,
                         List<Expression> ifs, boolean async) {
        super(location);
        this.target = target;
        this.iter = iter;
        this.ifs = immutable(ifs);
        this.async = async;
    }

    public Expression getTarget() {
        return target;
    }

    public Expression getIter() {
        return iter;
    }

    public List<Expression> getIfs() {
        return ifs;
    }

    public boolean isAsync() {
        return async;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitComprehension(this, context);
    }
}
