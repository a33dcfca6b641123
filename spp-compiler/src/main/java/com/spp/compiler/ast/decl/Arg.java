package com.spp.compiler.ast.decl;

import com.spp.compiler.ast.AstNode;
import com.spp.compiler.ast.AstVisitor;
import com.spp.compiler.ast.SourceLocation;
import com.spp.compiler.ast.expr.Expression;

/**
 * 形参
 */
public class Arg extends AstNode {
    private final String name;
    private final Expression annotation;
    private final Expression defaultValue;

    public Arg(SourceLocation location, String name, Expression annotation, Expression defaultValue) {
        super(location);
        this.name = name;
        this.annotation = annotation;
        this.defaultValue = defaultValue;
    }

    public String getName() {
        return name;
    }

    /** 类型注解，可为 null */
    public Expression getAnnotation() {
        return annotation;
    }

    /** 默认值，可为 null */
    public Expression getDefaultValue() {
        return defaultValue;
    }

    public boolean hasDefaultValue() {
        return defaultValue != null;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitArg(this, context);
    }
}
