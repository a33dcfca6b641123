package com.spp.compiler.ast.expr;

import com.spp.compiler.ast.AstVisitor;
import com.spp.compiler.ast.SourceLocation;

import java.math.BigInteger;

/**
 * 常量表达式
 */
public class Constant extends Expression {
    private final Object value;
    private final ConstantKind kind;

    public Constant(SourceLocation location, Object value, ConstantKind kind) {
        super(location);
        this.value = value;
        this.kind = kind;
    }

    public static Constant ofInt(SourceLocation location, BigInteger value) {
        return new Constant(location, value, ConstantKind.INT);
    }

    public static Constant ofString(SourceLocation location, String value) {
        return new Constant(location, value, ConstantKind.STRING);
    }

    public static Constant none(SourceLocation location) {
        return new Constant(location, null, ConstantKind.NONE);
    }

    public Object getValue() {
        return value;
    }

    public ConstantKind getKind() {
        return kind;
    }

    public boolean isString() {
        return kind == ConstantKind.STRING;
    }

    /** 字符串常量的值；非字符串常量抛出 IllegalStateException */
    public String getStringValue() {
        if (kind != ConstantKind.STRING && kind != ConstantKind.BYTES) {
            throw new IllegalStateException("Not a string constant: " + kind);
        }
        return (String) value;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitConstant(this, context);
    }

    /**
     * 常量类型
     *
     * <p>INT 的值为 {@link BigInteger}，FLOAT 为 {@link Double}，COMPLEX 为虚部的 {@link Double}，
     * STRING/BYTES 为源码中的原始文本，BOOLEAN 为 {@link Boolean}，NONE/ELLIPSIS 为 null。</p>
     */
    public enum ConstantKind {
        INT,
        FLOAT,
        COMPLEX,
        STRING,
        BYTES,
        BOOLEAN,
        NONE,
        ELLIPSIS
    }
}
