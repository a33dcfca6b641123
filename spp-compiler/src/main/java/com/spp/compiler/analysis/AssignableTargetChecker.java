package com.spp.compiler.analysis;

import com.spp.compiler.FrontendConfig;
import com.spp.compiler.ast.expr.*;

import java.util.List;

/**
 * 赋值目标检查
 *
 * <p>合法目标：Name、Attribute、Subscript，或者所有元素都合法的 Tuple/List（递归解包）。
 * 用于 =、增强赋值、带注解赋值、for、del 以及推导式的目标位置。</p>
 */
public final class AssignableTargetChecker {

    private final int maxUnpackingDepth;

    public AssignableTargetChecker() {
        this(new FrontendConfig());
    }

    public AssignableTargetChecker(FrontendConfig config) {
        this.maxUnpackingDepth = config.getMaxUnpackingDepth();
    }

    public boolean isAssignable(Expression target) {
        return check(target).isValid();
    }

    public ValidationResult check(Expression target) {
        return check(target, 0);
    }

    private ValidationResult check(Expression target, int depth) {
        if (target instanceof NameExpr || target instanceof AttributeExpr || target instanceof SubscriptExpr) {
            return ValidationResult.ok();
        }
        if (target instanceof TupleExpr) {
            return checkElements(((TupleExpr) target).getElements(), target, depth);
        }
        if (target instanceof ListExpr) {
            return checkElements(((ListExpr) target).getElements(), target, depth);
        }
        return ValidationResult.failure(new ValidationError(ValidationError.Kind.NOT_ASSIGNABLE, target));
    }

    private ValidationResult checkElements(List<Expression> elements, Expression owner, int depth) {
        if (depth >= maxUnpackingDepth) {
            return ValidationResult.failure(new ValidationError(ValidationError.Kind.NESTING_TOO_DEEP, owner));
        }
        for (Expression element : elements) {
            ValidationResult result = check(element, depth + 1);
            if (!result.isValid()) {
                return result;
            }
        }
        return ValidationResult.ok();
    }
}
