package com.spp.compiler.ast.expr;

import com.spp.compiler.ast.AstVisitor;
import com.spp.compiler.ast.SourceLocation;

/**
 * 二元表达式
 */
public class BinaryExpr extends Expression {
    private final Expression left;
    private final BinaryOp operator;
    private final Expression right;

    public BinaryExpr(SourceLocation location, Expression left, BinaryOp operator, Expression right) {
        super(location);
        this.left = left;
        this.operator = operator;
        this.right = right;
    }

    public Expression getLeft() {
        return left;
    }

    public BinaryOp getOperator() {
        return operator;
    }

    public Expression getRight() {
        return right;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitBinaryExpr(this, context);
    }

    /**
     * 二元运算符（增强赋值 {@code x += 1} 也使用此枚举）
     */
    public enum BinaryOp {
        // 算术
        ADD("+"),
        SUB("-"),
        MUL("*"),
        MAT_MUL("@"),
        DIV("/"),
        FLOOR_DIV("//"),
        MOD("%"),
        POW("**"),

        // 位运算
        LSHIFT("<<"),
        RSHIFT(">>"),
        BIT_OR("|"),
        BIT_XOR("^"),
        BIT_AND("&");

        private final String source;

        BinaryOp(String source) {
            this.source = source;
        }

        /** 返回 Python 源码中对应的运算符 */
        public String toSourceString() {
            return source;
        }

        /** 按源码符号查找运算符，未知符号返回 null */
        public static BinaryOp fromSource(String source) {
            for (BinaryOp op : values()) {
                if (op.source.equals(source)) return op;
            }
            return null;
        }
    }
}
