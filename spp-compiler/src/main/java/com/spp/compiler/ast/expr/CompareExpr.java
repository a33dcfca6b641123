package com.spp.compiler.ast.expr;

import com.spp.compiler.ast.AstVisitor;
import com.spp.compiler.ast.SourceLocation;

import java.util.List;

/**
 * 比较表达式，链式比较 {@code a < b <= c} 保存为一个节点：
 * ops 与 comparators 一一对应
 */
public class CompareExpr extends Expression {
    private final Expression left;
    private final List<CompareOp> operators;
    private final List<Expression> comparators;

    public CompareExpr(SourceLocation location, Expression left,
                       List<CompareOp> operators, List<Expression> comparators) {
        super(location);
        this.left = left;
        this.operators = immutable(operators);
        this.comparators = immutable(comparators);
    }

    public Expression getLeft() {
        return left;
    }

    public List<CompareOp> getOperators() {
        return operators;
    }

    public List<Expression> getComparators() {
        return comparators;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitCompareExpr(this, context);
    }

    public enum CompareOp {
        EQ("=="),
        NE("!="),
        LT("<"),
        LE("<="),
        GT(">"),
        GE(">="),
        IS("is"),
        IS_NOT("is not"),
        IN("in"),
        NOT_IN("not in");

        private final String source;

        CompareOp(String source) {
            this.source = source;
        }

        public String toSourceString() {
            return source;
        }

        public static CompareOp fromSource(String source) {
            for (CompareOp op : values()) {
                if (op.source.equals(source)) return op;
            }
            return null;
        }
    }
}
