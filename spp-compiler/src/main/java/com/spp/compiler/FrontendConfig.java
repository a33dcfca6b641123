package com.spp.compiler;

/**
 * 前端配置：递归深度上限
 *
 * <p>解包赋值目标、f-string 替换字段、表达式和整棵语法树都是递归结构，恶意输入可以构造任意深的嵌套，
 * 超过上限时报告嵌套过深而不是耗尽调用栈。</p>
 */
public class FrontendConfig {
    public static final int DEFAULT_MAX_UNPACKING_DEPTH = 64;
    public static final int DEFAULT_MAX_FIELD_NESTING_DEPTH = 16;
    public static final int DEFAULT_MAX_EXPRESSION_DEPTH = 200;
    public static final int DEFAULT_MAX_TREE_DEPTH = 500;

    private int maxUnpackingDepth = DEFAULT_MAX_UNPACKING_DEPTH;
    private int maxFieldNestingDepth = DEFAULT_MAX_FIELD_NESTING_DEPTH;
    private int maxExpressionDepth = DEFAULT_MAX_EXPRESSION_DEPTH;
    private int maxTreeDepth = DEFAULT_MAX_TREE_DEPTH;

    public FrontendConfig() {
    }

    /** 赋值目标中元组/列表解包允许的最大嵌套层数 */
    public int getMaxUnpackingDepth() {
        return maxUnpackingDepth;
    }

    public void setMaxUnpackingDepth(int maxUnpackingDepth) {
        if (maxUnpackingDepth < 1) {
            throw new IllegalArgumentException("maxUnpackingDepth must be positive: " + maxUnpackingDepth);
        }
        this.maxUnpackingDepth = maxUnpackingDepth;
    }

    /** 格式说明中替换字段允许的最大嵌套层数（顶层字段为第 1 层） */
    public int getMaxFieldNestingDepth() {
        return maxFieldNestingDepth;
    }

    public void setMaxFieldNestingDepth(int maxFieldNestingDepth) {
        if (maxFieldNestingDepth < 1) {
            throw new IllegalArgumentException("maxFieldNestingDepth must be positive: " + maxFieldNestingDepth);
        }
        this.maxFieldNestingDepth = maxFieldNestingDepth;
    }

    /** 表达式解析时括号、一元运算、lambda 等递归结构允许的最大嵌套层数 */
    public int getMaxExpressionDepth() {
        return maxExpressionDepth;
    }

    public void setMaxExpressionDepth(int maxExpressionDepth) {
        if (maxExpressionDepth < 1) {
            throw new IllegalArgumentException("maxExpressionDepth must be positive: " + maxExpressionDepth);
        }
        this.maxExpressionDepth = maxExpressionDepth;
    }

    /** 树校验和 JSON 读入时语法树允许的最大深度（根节点为第 1 层） */
    public int getMaxTreeDepth() {
        return maxTreeDepth;
    }

    public void setMaxTreeDepth(int maxTreeDepth) {
        if (maxTreeDepth < 1) {
            throw new IllegalArgumentException("maxTreeDepth must be positive: " + maxTreeDepth);
        }
        this.maxTreeDepth = maxTreeDepth;
    }
}
