package com.spp.compiler.analysis;

import com.spp.compiler.FrontendConfig;
import com.spp.compiler.ast.*;
import com.spp.compiler.ast.decl.*;
import com.spp.compiler.ast.expr.*;
import com.spp.compiler.ast.stmt.*;

import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * 树校验：检查语法无法表达的结构合法性规则。
 *
 * <p>遍历顺序为从左到右、深度优先；遇到第一个错误立即停止，不收集多个错误。
 * 语义规则只有三条：</p>
 * <ul>
 *   <li>同一 {@link Arguments} 中形参名不能重复</li>
 *   <li>赋值目标必须可赋值（见 {@link AssignableTargetChecker}）</li>
 *   <li>关键字实参的名字必须是标识符</li>
 * </ul>
 * <p>其余节点只做结构递归。类型注解不受限制；return/yield/await 等是否出现在合法的外层结构中
 * 不在此处检查。</p>
 *
 * <p>树深度超过 {@link FrontendConfig#getMaxTreeDepth()} 时报告 NESTING_TOO_DEEP，出错节点为
 * 超限的那一层。每次校验在新的遍历实例上进行，通过公开方法使用时校验器可以在多个线程间共享。</p>
 */
public final class TreeValidator implements AstVisitor<ValidationResult, Void> {

    private final AssignableTargetChecker targetChecker;
    private final int maxTreeDepth;
    private int depth;

    public TreeValidator() {
        this(new FrontendConfig());
    }

    public TreeValidator(FrontendConfig config) {
        this(new AssignableTargetChecker(config), config.getMaxTreeDepth());
    }

    private TreeValidator(AssignableTargetChecker targetChecker, int maxTreeDepth) {
        this.targetChecker = targetChecker;
        this.maxTreeDepth = maxTreeDepth;
    }

    /**
     * 校验整棵树
     *
     * @param tree 模块节点
     * @return 成功，或者按遍历顺序遇到的第一个错误
     */
    public ValidationResult validate(ModuleDecl tree) {
        return validateNode(tree);
    }

    /** 校验整棵树，失败时抛出 {@link ValidationException} */
    public void validateOrThrow(ModuleDecl tree) {
        validate(tree).orThrow();
    }

    /** 校验任意子树 */
    public ValidationResult validateNode(AstNode node) {
        return new TreeValidator(targetChecker, maxTreeDepth).walk(node);
    }

    private ValidationResult walk(AstNode node) {
        if (depth >= maxTreeDepth) {
            return ValidationResult.failure(new ValidationError(ValidationError.Kind.NESTING_TOO_DEEP, node));
        }
        depth++;
        try {
            return node.accept(this, null);
        } finally {
            depth--;
        }
    }

    // ============ 组合辅助 ============

    private ValidationResult validateAll(List<? extends AstNode> nodes) {
        for (AstNode node : nodes) {
            ValidationResult result = walk(node);
            if (!result.isValid()) {
                return result;
            }
        }
        return ValidationResult.ok();
    }

    private ValidationResult validateOptional(AstNode node) {
        return node != null ? walk(node) : ValidationResult.ok();
    }

    /** 先检查可赋值性，再对目标本身做结构递归（下标、属性中可能嵌有其它节点） */
    private ValidationResult validateTarget(Expression target) {
        return targetChecker.check(target).then(() -> walk(target));
    }

    private ValidationResult validateTargets(List<Expression> targets) {
        for (Expression target : targets) {
            ValidationResult result = validateTarget(target);
            if (!result.isValid()) {
                return result;
            }
        }
        return ValidationResult.ok();
    }

    private ValidationResult validateArgumentNames(Arguments arguments) {
        Set<String> seen = new HashSet<String>();
        for (Arg arg : arguments.getAllArgs()) {
            if (!seen.add(arg.getName())) {
                return ValidationResult.failure(
                        new ValidationError(ValidationError.Kind.DUPLICATE_ARGUMENT, arg));
            }
        }
        return ValidationResult.ok();
    }

    private ValidationResult validateKeywordName(Expression name) {
        if (name == null || name instanceof NameExpr) {
            return ValidationResult.ok();
        }
        return ValidationResult.failure(new ValidationError(ValidationError.Kind.ARGUMENT_MUST_BE_NAME, name));
    }

    // ============ 声明 ============

    @Override
    public ValidationResult visitModuleDecl(ModuleDecl node, Void ctx) {
        return validateAll(node.getBody());
    }

    @Override
    public ValidationResult visitFunctionDecl(FunctionDecl node, Void ctx) {
        return walk(node.getArgs())
                .then(() -> validateAll(node.getBody()))
                .then(() -> validateAll(node.getDecorators()))
                .then(() -> validateOptional(node.getReturns()));
    }

    @Override
    public ValidationResult visitClassDecl(ClassDecl node, Void ctx) {
        return validateAll(node.getBases())
                .then(() -> validateAll(node.getBody()))
                .then(() -> validateAll(node.getDecorators()));
    }

    @Override
    public ValidationResult visitArguments(Arguments node, Void ctx) {
        return validateAll(node.getArgs())
                .then(() -> validateOptional(node.getVararg()))
                .then(() -> validateAll(node.getKwonly()))
                .then(() -> validateOptional(node.getKwarg()))
                .then(() -> validateArgumentNames(node));
    }

    @Override
    public ValidationResult visitArg(Arg node, Void ctx) {
        return validateOptional(node.getAnnotation())
                .then(() -> validateOptional(node.getDefaultValue()));
    }

    // ============ 语句 ============

    @Override
    public ValidationResult visitReturnStmt(ReturnStmt node, Void ctx) {
        return validateOptional(node.getValue());
    }

    @Override
    public ValidationResult visitDeleteStmt(DeleteStmt node, Void ctx) {
        return validateTargets(node.getTargets());
    }

    @Override
    public ValidationResult visitAssignStmt(AssignStmt node, Void ctx) {
        return validateTargets(node.getTargets())
                .then(() -> walk(node.getValue()));
    }

    @Override
    public ValidationResult visitAugAssignStmt(AugAssignStmt node, Void ctx) {
        return validateTarget(node.getTarget())
                .then(() -> walk(node.getValue()));
    }

    @Override
    public ValidationResult visitAnnAssignStmt(AnnAssignStmt node, Void ctx) {
        // 注解可以是任意表达式
        return validateTarget(node.getTarget())
                .then(() -> walk(node.getAnnotation()))
                .then(() -> validateOptional(node.getValue()));
    }

    @Override
    public ValidationResult visitForStmt(ForStmt node, Void ctx) {
        return validateTarget(node.getTarget())
                .then(() -> walk(node.getIter()))
                .then(() -> validateAll(node.getBody()))
                .then(() -> validateAll(node.getOrelse()));
    }

    @Override
    public ValidationResult visitWhileStmt(WhileStmt node, Void ctx) {
        return walk(node.getTest())
                .then(() -> validateAll(node.getBody()))
                .then(() -> validateAll(node.getOrelse()));
    }

    @Override
    public ValidationResult visitIfStmt(IfStmt node, Void ctx) {
        return walk(node.getTest())
                .then(() -> validateAll(node.getBody()))
                .then(() -> validateAll(node.getOrelse()));
    }

    @Override
    public ValidationResult visitWithStmt(WithStmt node, Void ctx) {
        return validateAll(node.getItems())
                .then(() -> validateAll(node.getBody()));
    }

    @Override
    public ValidationResult visitWithItem(WithItem node, Void ctx) {
        return walk(node.getContextExpr())
                .then(() -> validateOptional(node.getOptionalVars()));
    }

    @Override
    public ValidationResult visitRaiseStmt(RaiseStmt node, Void ctx) {
        return validateOptional(node.getException())
                .then(() -> validateOptional(node.getCause()));
    }

    @Override
    public ValidationResult visitTryStmt(TryStmt node, Void ctx) {
        return validateAll(node.getBody())
                .then(() -> validateAll(node.getHandlers()))
                .then(() -> validateAll(node.getOrelse()))
                .then(() -> validateAll(node.getFinalBody()));
    }

    @Override
    public ValidationResult visitExceptHandler(ExceptHandler node, Void ctx) {
        return validateOptional(node.getType())
                .then(() -> validateAll(node.getBody()));
    }

    @Override
    public ValidationResult visitAssertStmt(AssertStmt node, Void ctx) {
        return walk(node.getTest())
                .then(() -> validateOptional(node.getMessage()));
    }

    // 以下叶子语句没有子表达式

    @Override
    public ValidationResult visitImportStmt(ImportStmt node, Void ctx) {
        return ValidationResult.ok();
    }

    @Override
    public ValidationResult visitImportFromStmt(ImportFromStmt node, Void ctx) {
        return ValidationResult.ok();
    }

    @Override
    public ValidationResult visitAlias(Alias node, Void ctx) {
        return ValidationResult.ok();
    }

    @Override
    public ValidationResult visitGlobalStmt(GlobalStmt node, Void ctx) {
        return ValidationResult.ok();
    }

    @Override
    public ValidationResult visitNonlocalStmt(NonlocalStmt node, Void ctx) {
        return ValidationResult.ok();
    }

    @Override
    public ValidationResult visitPassStmt(PassStmt node, Void ctx) {
        return ValidationResult.ok();
    }

    @Override
    public ValidationResult visitBreakStmt(BreakStmt node, Void ctx) {
        return ValidationResult.ok();
    }

    @Override
    public ValidationResult visitContinueStmt(ContinueStmt node, Void ctx) {
        return ValidationResult.ok();
    }

    @Override
    public ValidationResult visitExpressionStmt(ExpressionStmt node, Void ctx) {
        return walk(node.getExpression());
    }

    // ============ 表达式 ============

    @Override
    public ValidationResult visitBoolOpExpr(BoolOpExpr node, Void ctx) {
        return validateAll(node.getValues());
    }

    @Override
    public ValidationResult visitNamedExpr(NamedExpr node, Void ctx) {
        return walk(node.getTarget())
                .then(() -> walk(node.getValue()));
    }

    @Override
    public ValidationResult visitBinaryExpr(BinaryExpr node, Void ctx) {
        return walk(node.getLeft())
                .then(() -> walk(node.getRight()));
    }

    @Override
    public ValidationResult visitUnaryExpr(UnaryExpr node, Void ctx) {
        return walk(node.getOperand());
    }

    @Override
    public ValidationResult visitLambdaExpr(LambdaExpr node, Void ctx) {
        return walk(node.getArgs())
                .then(() -> walk(node.getBody()));
    }

    @Override
    public ValidationResult visitIfExpr(IfExpr node, Void ctx) {
        return walk(node.getCondition())
                .then(() -> walk(node.getThenExpr()))
                .then(() -> walk(node.getElseExpr()));
    }

    @Override
    public ValidationResult visitDictExpr(DictExpr node, Void ctx) {
        return validateAll(node.getEntries());
    }

    @Override
    public ValidationResult visitSetExpr(SetExpr node, Void ctx) {
        return validateAll(node.getElements());
    }

    @Override
    public ValidationResult visitListCompExpr(ListCompExpr node, Void ctx) {
        return walk(node.getElement())
                .then(() -> validateAll(node.getGenerators()));
    }

    @Override
    public ValidationResult visitSetCompExpr(SetCompExpr node, Void ctx) {
        return walk(node.getElement())
                .then(() -> validateAll(node.getGenerators()));
    }

    @Override
    public ValidationResult visitDictCompExpr(DictCompExpr node, Void ctx) {
        return walk(node.getElement())
                .then(() -> validateAll(node.getGenerators()));
    }

    @Override
    public ValidationResult visitGeneratorExpr(GeneratorExpr node, Void ctx) {
        return walk(node.getElement())
                .then(() -> validateAll(node.getGenerators()));
    }

    @Override
    public ValidationResult visitAwaitExpr(AwaitExpr node, Void ctx) {
        return walk(node.getValue());
    }

    @Override
    public ValidationResult visitYieldExpr(YieldExpr node, Void ctx) {
        return validateOptional(node.getValue());
    }

    @Override
    public ValidationResult visitYieldFromExpr(YieldFromExpr node, Void ctx) {
        return walk(node.getValue());
    }

    @Override
    public ValidationResult visitCompareExpr(CompareExpr node, Void ctx) {
        return walk(node.getLeft())
                .then(() -> validateAll(node.getComparators()));
    }

    @Override
    public ValidationResult visitCallExpr(CallExpr node, Void ctx) {
        return walk(node.getCallee())
                .then(() -> validateAll(node.getArgs()));
    }

    @Override
    public ValidationResult visitFormattedValue(FormattedValue node, Void ctx) {
        return walk(node.getValue())
                .then(() -> validateOptional(node.getFormatSpec()));
    }

    @Override
    public ValidationResult visitJoinedStr(JoinedStr node, Void ctx) {
        return validateAll(node.getValues());
    }

    @Override
    public ValidationResult visitConstant(Constant node, Void ctx) {
        return ValidationResult.ok();
    }

    @Override
    public ValidationResult visitAttributeExpr(AttributeExpr node, Void ctx) {
        return walk(node.getValue());
    }

    @Override
    public ValidationResult visitSubscriptExpr(SubscriptExpr node, Void ctx) {
        return walk(node.getValue())
                .then(() -> walk(node.getSlice()));
    }

    @Override
    public ValidationResult visitStarredExpr(StarredExpr node, Void ctx) {
        return walk(node.getValue());
    }

    @Override
    public ValidationResult visitNameExpr(NameExpr node, Void ctx) {
        return ValidationResult.ok();
    }

    @Override
    public ValidationResult visitListExpr(ListExpr node, Void ctx) {
        return validateAll(node.getElements());
    }

    @Override
    public ValidationResult visitTupleExpr(TupleExpr node, Void ctx) {
        return validateAll(node.getElements());
    }

    // ============ 辅助节点 ============

    @Override
    public ValidationResult visitKeyValue(KeyValue node, Void ctx) {
        return validateOptional(node.getKey())
                .then(() -> walk(node.getValue()));
    }

    @Override
    public ValidationResult visitPositionalArg(PositionalArg node, Void ctx) {
        return walk(node.getValue());
    }

    @Override
    public ValidationResult visitKeywordArg(KeywordArg node, Void ctx) {
        return validateKeywordName(node.getName())
                .then(() -> walk(node.getValue()));
    }

    @Override
    public ValidationResult visitComprehension(Comprehension node, Void ctx) {
        return validateTarget(node.getTarget())
                .then(() -> walk(node.getIter()))
                .then(() -> validateAll(node.getIfs()));
    }

    @Override
    public ValidationResult visitIndexSlice(IndexSlice node, Void ctx) {
        return walk(node.getValue());
    }

    @Override
    public ValidationResult visitDefaultSlice(DefaultSlice node, Void ctx) {
        return validateOptional(node.getLower())
                .then(() -> validateOptional(node.getUpper()))
                .then(() -> validateOptional(node.getStep()));
    }

    @Override
    public ValidationResult visitExtSlice(ExtSlice node, Void ctx) {
        return validateAll(node.getDims());
    }
}
