package com.spp.compiler.ast;

import com.spp.compiler.ast.decl.*;
import com.spp.compiler.ast.expr.*;
import com.spp.compiler.ast.stmt.*;

/**
 * AST 访问者接口
 *
 * <p>每种节点对应一个抽象方法，没有默认实现：新增节点类型时所有访问者都必须显式处理，
 * 编译器会指出遗漏的位置。</p>
 */
public interface AstVisitor<R, C> {

    // ============ 声明 ============

    R visitModuleDecl(ModuleDecl node, C ctx);

    R visitFunctionDecl(FunctionDecl node, C ctx);

    R visitClassDecl(ClassDecl node, C ctx);

    R visitArguments(Arguments node, C ctx);

    R visitArg(Arg node, C ctx);

    // ============ 语句 ============

    R visitReturnStmt(ReturnStmt node, C ctx);

    R visitDeleteStmt(DeleteStmt node, C ctx);

    R visitAssignStmt(AssignStmt node, C ctx);

    R visitAugAssignStmt(AugAssignStmt node, C ctx);

    R visitAnnAssignStmt(AnnAssignStmt node, C ctx);

    R visitForStmt(ForStmt node, C ctx);

    R visitWhileStmt(WhileStmt node, C ctx);

    R visitIfStmt(IfStmt node, C ctx);

    R visitWithStmt(WithStmt node, C ctx);

    R visitWithItem(WithItem node, C ctx);

    R visitRaiseStmt(RaiseStmt node, C ctx);

    R visitTryStmt(TryStmt node, C ctx);

    R visitExceptHandler(ExceptHandler node, C ctx);

    R visitAssertStmt(AssertStmt node, C ctx);

    R visitImportStmt(ImportStmt node, C ctx);

    R visitImportFromStmt(ImportFromStmt node, C ctx);

    R visitAlias(Alias node, C ctx);

    R visitGlobalStmt(GlobalStmt node, C ctx);

    R visitNonlocalStmt(NonlocalStmt node, C ctx);

    R visitPassStmt(PassStmt node, C ctx);

    R visitBreakStmt(BreakStmt node, C ctx);

    R visitContinueStmt(ContinueStmt node, C ctx);

    R visitExpressionStmt(ExpressionStmt node, C ctx);

    // ============ 表达式 ============

    R visitBoolOpExpr(BoolOpExpr node, C ctx);

    R visitNamedExpr(NamedExpr node, C ctx);

    R visitBinaryExpr(BinaryExpr node, C ctx);

    R visitUnaryExpr(UnaryExpr node, C ctx);

    R visitLambdaExpr(LambdaExpr node, C ctx);

    R visitIfExpr(IfExpr node, C ctx);

    R visitDictExpr(DictExpr node, C ctx);

    R visitSetExpr(SetExpr node, C ctx);

    R visitListCompExpr(ListCompExpr node, C ctx);

    R visitSetCompExpr(SetCompExpr node, C ctx);

    R visitDictCompExpr(DictCompExpr node, C ctx);

    R visitGeneratorExpr(GeneratorExpr node, C ctx);

    R visitAwaitExpr(AwaitExpr node, C ctx);

    R visitYieldExpr(YieldExpr node, C ctx);

    R visitYieldFromExpr(YieldFromExpr node, C ctx);

    R visitCompareExpr(CompareExpr node, C ctx);

    R visitCallExpr(CallExpr node, C ctx);

    R visitFormattedValue(FormattedValue node, C ctx);

    R visitJoinedStr(JoinedStr node, C ctx);

    R visitConstant(Constant node, C ctx);

    R visitAttributeExpr(AttributeExpr node, C ctx);

    R visitSubscriptExpr(SubscriptExpr node, C ctx);

    R visitStarredExpr(StarredExpr node, C ctx);

    R visitNameExpr(NameExpr node, C ctx);

    R visitListExpr(ListExpr node, C ctx);

    R visitTupleExpr(TupleExpr node, C ctx);

    // ============ 辅助节点 ============

    R visitKeyValue(KeyValue node, C ctx);

    R visitPositionalArg(PositionalArg node, C ctx);

    R visitKeywordArg(KeywordArg node, C ctx);

    R visitComprehension(Comprehension node, C ctx);

    R visitIndexSlice(IndexSlice node, C ctx);

    R visitDefaultSlice(DefaultSlice node, C ctx);

    R visitExtSlice(ExtSlice node, C ctx);
}
