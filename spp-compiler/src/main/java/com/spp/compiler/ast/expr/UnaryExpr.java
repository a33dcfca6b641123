package com.spp.compiler.ast.expr;

import com.spp.compiler.ast.AstVisitor;
import com.spp.compiler.ast.SourceLocation;

/**
 * 一元表达式
 */
public class UnaryExpr extends Expression {
    private final UnaryOp operator;
    private final Expression operand;

    public UnaryExpr(SourceLocation location, UnaryOp operator, Expression operand) {
        super(location);
        this.operator = operator;
        this.operand = operand;
    }

    public UnaryOp getOperator() {
        return operator;
    }

    public Expression getOperand() {
        return operand;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitUnaryExpr(this, context);
    }

    public enum UnaryOp {
        NOT("not"),
        NEG("-"),
        POS("+"),
        INVERT("~");

        private final String source;

        UnaryOp(String source) {
            this.source = source;
        }

        public String toSourceString() {
            return source;
        }

        public static UnaryOp fromSource(String source) {
            for (UnaryOp op : values()) {
                if (op.source.equals(source)) return op;
            }
            return null;
        }
    }
}
