package com.spp.compiler.ast.stmt;

import com.spp.compiler.ast.AstVisitor;
import com.spp.compiler.ast.SourceLocation;
import com.spp.compiler.ast.expr.Expression;

import java.util.List;

/**
 * 赋值语句；链式赋值 {@code a = b = 1} 有多个 target
 */
public class AssignStmt extends Statement {
    private final List<Expression> targets;
    private final Expression value;

    public AssignStmt(SourceLocation location, List<Expression> targets, Expression value) {
        super(location);
        this.targets = immutable(targets);
        this.value = value;
    }

    public List<Expression> getTargets() {
        return targets;
    }

    public Expression getValue() {
        return value;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitAssignStmt(this, context);
    }
}
