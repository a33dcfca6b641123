package com.spp.compiler.ast.expr;

import com.spp.compiler.ast.AstVisitor;
import com.spp.compiler.ast.SourceLocation;

import java.util.List;

/**
 * 布尔运算（{@code a and b and c} 折叠为一个节点）
 */
public class BoolOpExpr extends Expression {
    private final BoolOp operator;
    private final List<Expression> values;

    public BoolOpExpr(SourceLocation location, BoolOp operator, List<Expression> values) {
        super(location);
        this.operator = operator;
        this.values = immutable(values);
    }

    public BoolOp getOperator() {
        return operator;
    }

    public List<Expression> getValues() {
        return values;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitBoolOpExpr(this, context);
    }

    public enum BoolOp {
        AND("and"),
        OR("or");

        private final String source;

        BoolOp(String source) {
            this.source = source;
        }

        public String toSourceString() {
            return source;
        }

        public static BoolOp fromSource(String source) {
            for (BoolOp op : values()) {
                if (op.source.equals(source)) return op;
            }
            return null;
        }
    }
}
