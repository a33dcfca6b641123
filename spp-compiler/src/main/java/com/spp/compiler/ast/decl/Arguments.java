package com.spp.compiler.ast.decl;

import com.spp.compiler.ast.AstNode;
import com.spp.compiler.ast.AstVisitor;
import com.spp.compiler.ast.SourceLocation;

import java.util.ArrayList;
import java.util.List;

/**
 * 函数或 lambda 的形参列表：
 * {@code def f(args..., *vararg, kwonly..., **kwarg)}
 */
public class Arguments extends AstNode {
    private final List<Arg> args;
    private final Arg vararg;
    private final List<Arg> kwonly;
    private final Arg kwarg;

    public Arguments(SourceLocation location, List<Arg> args, Arg vararg, List<Arg> kwonly, Arg kwarg) {
        super(location);
        this.args = immutable(args);
        this.vararg = vararg;
        this.kwonly = immutable(kwonly);
        this.kwarg = kwarg;
    }

    public List<Arg> getArgs() {
        return args;
    }

    /** {@code *args} 形参，可为 null */
    public Arg getVararg() {
        return vararg;
    }

    public List<Arg> getKwonly() {
        return kwonly;
    }

    /** {@code **kwargs} 形参，可为 null */
    public Arg getKwarg() {
        return kwarg;
    }

    /** 按声明顺序返回全部形参：位置参数、vararg、仅关键字参数、kwarg */
    public List<Arg> getAllArgs() {
        List<Arg> all = new ArrayList<Arg>(args.size() + kwonly.size() + 2);
        all.addAll(args);
        if (vararg != null) all.add(vararg);
        all.addAll(kwonly);
        if (kwarg != null) all.add(kwarg);
        return all;
    }

    /** 按声明顺序返回全部形参名 */
    public List<String> getAllNames() {
        List<String> names = new ArrayList<String>();
        for (Arg arg : getAllArgs()) {
            names.add(arg.getName());
        }
        return names;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitArguments(this, context);
    }
}
