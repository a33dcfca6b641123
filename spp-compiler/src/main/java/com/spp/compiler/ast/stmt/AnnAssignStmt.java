package com.spp.compiler.ast.stmt;

import com.spp.compiler.ast.AstVisitor;
import com.spp.compiler.ast.SourceLocation;
import com.spp.compiler.ast.expr.Expression;

/**
 * 带注解的赋值 {@code target: annotation [= value]}
 *
 * <p>simple 表示 target 是未加括号的单个名字。</p>
 */
public class AnnAssignStmt extends Statement {
    private final Expression target;
    private final Expression annotation;
    private final Expression value;
    private final boolean simple;

    public AnnAssignStmt(SourceLocation location, Expression target, Expression annotation,
                         Expression value, boolean simple) {
        super(location);
        this.target = target;
        this.annotation = annotation;
        this.value = value;
        this.simple = simple;
    }

    public Expression getTarget() {
        return target;
    }

    public Expression getAnnotation() {
        return annotation;
    }

    /** 初始值，可为 null */
    public Expression getValue() {
        return value;
    }

    public boolean isSimple() {
        return simple;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitAnnAssignStmt(this, context);
    }
}
