package com.spp.compiler.ast.stmt;

import com.spp.compiler.ast.AstVisitor;
import com.spp.compiler.ast.SourceLocation;
import com.spp.compiler.ast.expr.Expression;

import java.util.List;

/**
 * del 语句
 */
public class DeleteStmt extends Statement {
    private final List<Expression> targets;

    public DeleteStmt(SourceLocation location, List<Expression> targets) {
        super(location);
        this.targets = immutable(targets);
    }

    public List<Expression> getTargets() {
        return targets;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitDeleteStmt(this, context);
    }
}
