package com.spp.compiler.analysis;

import java.util.function.Supplier;

/**
 * 校验结果：成功，或者唯一的一个错误
 *
 * <p>{@link #then(Supplier)} 只在当前结果成功时才计算下一步，
 * 因此一串 then 调用在第一个错误处停止，后续子树不会被访问。</p>
 */
public final class ValidationResult {
    private static final ValidationResult OK = new ValidationResult(null);

    private final ValidationError error;

    private ValidationResult(ValidationError error) {
        this.error = error;
    }

    public static ValidationResult ok() {
        return OK;
    }

    public static ValidationResult failure(ValidationError error) {
        if (error == null) {
            throw new IllegalArgumentException("error must not be null");
        }
        return new ValidationResult(error);
    }

    public boolean isValid() {
        return error == null;
    }

    /** 错误信息；成功时为 null */
    public ValidationError getError() {
        return error;
    }

    public ValidationResult then(Supplier<ValidationResult> next) {
        return isValid() ? next.get() : this;
    }

    /** 失败时抛出 {@link ValidationException} */
    public void orThrow() {
        if (error != null) {
            throw new ValidationException(error);
        }
    }

    @Override
    public String toString() {
        return isValid() ? "Ok" : "Failure(" + error + ")";
    }
}
