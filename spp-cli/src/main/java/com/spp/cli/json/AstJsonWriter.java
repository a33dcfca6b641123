package com.spp.cli.json;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonNull;
import com.google.gson.JsonObject;
import com.google.gson.JsonPrimitive;
import com.spp.compiler.ast.AstNode;
import com.spp.compiler.ast.AstVisitor;
import com.spp.compiler.ast.SourceLocation;
import com.spp.compiler.ast.decl.*;
import com.spp.compiler.ast.expr.*;
import com.spp.compiler.ast.stmt.*;

import java.math.BigInteger;
import java.util.List;

/**
 * 把语法树写成 JSON，格式与 {@link AstJsonReader} 读取的一致
 */
public final class AstJsonWriter implements AstVisitor<JsonObject, Void> {

    private final Gson gson = new GsonBuilder()
            .setPrettyPrinting()
            .serializeNulls()
            .serializeSpecialFloatingPointValues()
            .disableHtmlEscaping()
            .create();

    private final boolean includeLocations;

    public AstJsonWriter() {
        this(true);
    }

    /**
     * @param includeLocations 是否输出 line/column 字段
     */
    public AstJsonWriter(boolean includeLocations) {
        this.includeLocations = includeLocations;
    }

    public String toJson(AstNode node) {
        return gson.toJson(toJsonTree(node));
    }

    public JsonObject toJsonTree(AstNode node) {
        return node.accept(this, null);
    }

    // ============ 辅助 ============

    private JsonObject node(String type, AstNode node) {
        JsonObject object = new JsonObject();
        object.addProperty("type", type);
        SourceLocation loc = node.getLocation();
        if (includeLocations && loc.isKnown()) {
            object.addProperty("line", loc.getLine());
            object.addProperty("column", loc.getColumn());
        }
        return object;
    }

    private JsonElement write(AstNode node) {
        return node == null ? JsonNull.INSTANCE : node.accept(this, null);
    }

    private JsonArray writeAll(List<? extends AstNode> nodes) {
        JsonArray array = new JsonArray();
        for (AstNode node : nodes) {
            array.add(write(node));
        }
        return array;
    }

    private static JsonArray strings(List<String> values) {
        JsonArray array = new JsonArray();
        for (String value : values) {
            array.add(value);
        }
        return array;
    }

    private JsonObject comprehension(String type, AstNode node, Expression element, List<Comprehension> generators) {
        JsonObject o = node(type, node);
        o.add("elt", write(element));
        o.add("generators", writeAll(generators));
        return o;
    }

    // ============ 声明 ============

    @Override
    public JsonObject visitModuleDecl(ModuleDecl node, Void ctx) {
        JsonObject o = node("Module", node);
        o.add("body", writeAll(node.getBody()));
        return o;
    }

    @Override
    public JsonObject visitFunctionDecl(FunctionDecl node, Void ctx) {
        JsonObject o = node("FunctionDef", node);
        o.addProperty("name", node.getName());
        o.add("args", write(node.getArgs()));
        o.add("body", writeAll(node.getBody()));
        o.add("decorator_list", writeAll(node.getDecorators()));
        o.add("returns", write(node.getReturns()));
        o.addProperty("is_async", node.isAsync());
        return o;
    }

    @Override
    public JsonObject visitClassDecl(ClassDecl node, Void ctx) {
        JsonObject o = node("ClassDef", node);
        o.addProperty("name", node.getName());
        o.add("bases", writeAll(node.getBases()));
        o.add("body", writeAll(node.getBody()));
        o.add("decorator_list", writeAll(node.getDecorators()));
        return o;
    }

    @Override
    public JsonObject visitArguments(Arguments node, Void ctx) {
        JsonObject o = node("Arguments", node);
        o.add("args", writeAll(node.getArgs()));
        o.add("vararg", write(node.getVararg()));
        o.add("kwonlyargs", writeAll(node.getKwonly()));
        o.add("kwarg", write(node.getKwarg()));
        return o;
    }

    @Override
    public JsonObject visitArg(Arg node, Void ctx) {
        JsonObject o = node("Arg", node);
        o.addProperty("arg", node.getName());
        o.add("annotation", write(node.getAnnotation()));
        o.add("default", write(node.getDefaultValue()));
        return o;
    }

    // ============ 语句 ============

    @Override
    public JsonObject visitReturnStmt(ReturnStmt node, Void ctx) {
        JsonObject o = node("Return", node);
        o.add("value", write(node.getValue()));
        return o;
    }

    @Override
    public JsonObject visitDeleteStmt(DeleteStmt node, Void ctx) {
        JsonObject o = node("Delete", node);
        o.add("targets", writeAll(node.getTargets()));
        return o;
    }

    @Override
    public JsonObject visitAssignStmt(AssignStmt node, Void ctx) {
        JsonObject o = node("Assign", node);
        o.add("targets", writeAll(node.getTargets()));
        o.add("value", write(node.getValue()));
        return o;
    }

    @Override
    public JsonObject visitAugAssignStmt(AugAssignStmt node, Void ctx) {
        JsonObject o = node("AugAssign", node);
        o.add("target", write(node.getTarget()));
        o.addProperty("op", node.getOperator().toSourceString());
        o.add("value", write(node.getValue()));
        return o;
    }

    @Override
    public JsonObject visitAnnAssignStmt(AnnAssignStmt node, Void ctx) {
        JsonObject o = node("AnnAssign", node);
        o.add("target", write(node.getTarget()));
        o.add("annotation", write(node.getAnnotation()));
        o.add("value", write(node.getValue()));
        o.addProperty("simple", node.isSimple());
        return o;
    }

    @Override
    public JsonObject visitForStmt(ForStmt node, Void ctx) {
        JsonObject o = node("For", node);
        o.add("target", write(node.getTarget()));
        o.add("iter", write(node.getIter()));
        o.add("body", writeAll(node.getBody()));
        o.add("orelse", writeAll(node.getOrelse()));
        o.addProperty("is_async", node.isAsync());
        return o;
    }

    @Override
    public JsonObject visitWhileStmt(WhileStmt node, Void ctx) {
        JsonObject o = node("While", node);
        o.add("test", write(node.getTest()));
        o.add("body", writeAll(node.getBody()));
        o.add("orelse", writeAll(node.getOrelse()));
        return o;
    }

    @Override
    public JsonObject visitIfStmt(IfStmt node, Void ctx) {
        JsonObject o = node("If", node);
        o.add("test", write(node.getTest()));
        o.add("body", writeAll(node.getBody()));
        o.add("orelse", writeAll(node.getOrelse()));
        return o;
    }

    @Override
    public JsonObject visitWithStmt(WithStmt node, Void ctx) {
        JsonObject o = node("With", node);
        o.add("items", writeAll(node.getItems()));
        o.add("body", writeAll(node.getBody()));
        o.addProperty("is_async", node.isAsync());
        return o;
    }

    @Override
    public JsonObject visitWithItem(WithItem node, Void ctx) {
        JsonObject o = node("WithItem", node);
        o.add("context_expr", write(node.getContextExpr()));
        o.add("optional_vars", write(node.getOptionalVars()));
        return o;
    }

    @Override
    public JsonObject visitRaiseStmt(RaiseStmt node, Void ctx) {
        JsonObject o = node("Raise", node);
        o.add("exc", write(node.getException()));
        o.add("cause", write(node.getCause()));
        return o;
    }

    @Override
    public JsonObject visitTryStmt(TryStmt node, Void ctx) {
        JsonObject o = node("Try", node);
        o.add("body", writeAll(node.getBody()));
        o.add("handlers", writeAll(node.getHandlers()));
        o.add("orelse", writeAll(node.getOrelse()));
        o.add("finalbody", writeAll(node.getFinalBody()));
        return o;
    }

    @Override
    public JsonObject visitExceptHandler(ExceptHandler node, Void ctx) {
        JsonObject o = node("ExceptionHandler", node);
        // "type" 已用作节点类型
        o.add("exc_type", write(node.getType()));
        o.addProperty("name", node.getName());
        o.add("body", writeAll(node.getBody()));
        return o;
    }

    @Override
    public JsonObject visitAssertStmt(AssertStmt node, Void ctx) {
        JsonObject o = node("Assert", node);
        o.add("test", write(node.getTest()));
        o.add("msg", write(node.getMessage()));
        return o;
    }

    @Override
    public JsonObject visitImportStmt(ImportStmt node, Void ctx) {
        JsonObject o = node("Import", node);
        o.add("names", writeAll(node.getNames()));
        return o;
    }

    @Override
    public JsonObject visitImportFromStmt(ImportFromStmt node, Void ctx) {
        JsonObject o = node("ImportFrom", node);
        o.addProperty("module", node.getModule());
        o.add("names", writeAll(node.getNames()));
        o.addProperty("level", node.getLevel());
        return o;
    }

    @Override
    public JsonObject visitAlias(Alias node, Void ctx) {
        JsonObject o = node("Alias", node);
        o.addProperty("name", node.getName());
        o.addProperty("asname", node.getAsName());
        return o;
    }

    @Override
    public JsonObject visitGlobalStmt(GlobalStmt node, Void ctx) {
        JsonObject o = node("Global", node);
        o.add("names", strings(node.getNames()));
        return o;
    }

    @Override
    public JsonObject visitNonlocalStmt(NonlocalStmt node, Void ctx) {
        JsonObject o = node("Nonlocal", node);
        o.add("names", strings(node.getNames()));
        return o;
    }

    @Override
    public JsonObject visitPassStmt(PassStmt node, Void ctx) {
        return node("Pass", node);
    }

    @Override
    public JsonObject visitBreakStmt(BreakStmt node, Void ctx) {
        return node("Break", node);
    }

    @Override
    public JsonObject visitContinueStmt(ContinueStmt node, Void ctx) {
        return node("Continue", node);
    }

    @Override
    public JsonObject visitExpressionStmt(ExpressionStmt node, Void ctx) {
        JsonObject o = node("ExprStmt", node);
        o.add("value", write(node.getExpression()));
        return o;
    }

    // ============ 表达式 ============

    @Override
    public JsonObject visitBoolOpExpr(BoolOpExpr node, Void ctx) {
        JsonObject o = node("BoolOp", node);
        o.addProperty("op", node.getOperator().toSourceString());
        o.add("values", writeAll(node.getValues()));
        return o;
    }

    @Override
    public JsonObject visitNamedExpr(NamedExpr node, Void ctx) {
        JsonObject o = node("NamedExpr", node);
        o.add("target", write(node.getTarget()));
        o.add("value", write(node.getValue()));
        return o;
    }

    @Override
    public JsonObject visitBinaryExpr(BinaryExpr node, Void ctx) {
        JsonObject o = node("BinOp", node);
        o.add("left", write(node.getLeft()));
        o.addProperty("op", node.getOperator().toSourceString());
        o.add("right", write(node.getRight()));
        return o;
    }

    @Override
    public JsonObject visitUnaryExpr(UnaryExpr node, Void ctx) {
        JsonObject o = node("UnaryOp", node);
        o.addProperty("op", node.getOperator().toSourceString());
        o.add("operand", write(node.getOperand()));
        return o;
    }

    @Override
    public JsonObject visitLambdaExpr(LambdaExpr node, Void ctx) {
        JsonObject o = node("Lambda", node);
        o.add("args", write(node.getArgs()));
        o.add("body", write(node.getBody()));
        return o;
    }

    @Override
    public JsonObject visitIfExpr(IfExpr node, Void ctx) {
        JsonObject o = node("IfExpr", node);
        o.add("test", write(node.getCondition()));
        o.add("body", write(node.getThenExpr()));
        o.add("orelse", write(node.getElseExpr()));
        return o;
    }

    @Override
    public JsonObject visitDictExpr(DictExpr node, Void ctx) {
        JsonObject o = node("Dict", node);
        o.add("entries", writeAll(node.getEntries()));
        return o;
    }

    @Override
    public JsonObject visitSetExpr(SetExpr node, Void ctx) {
        JsonObject o = node("Set", node);
        o.add("elts", writeAll(node.getElements()));
        return o;
    }

    @Override
    public JsonObject visitListCompExpr(ListCompExpr node, Void ctx) {
        return comprehension("ListComp", node, node.getElement(), node.getGenerators());
    }

    @Override
    public JsonObject visitSetCompExpr(SetCompExpr node, Void ctx) {
        return comprehension("SetComp", node, node.getElement(), node.getGenerators());
    }

    @Override
    public JsonObject visitDictCompExpr(DictCompExpr node, Void ctx) {
        JsonObject o = node("DictComp", node);
        o.add("key", write(node.getElement().getKey()));
        o.add("value", write(node.getElement().getValue()));
        o.add("generators", writeAll(node.getGenerators()));
        return o;
    }

    @Override
    public JsonObject visitGeneratorExpr(GeneratorExpr node, Void ctx) {
        return comprehension("GeneratorExp", node, node.getElement(), node.getGenerators());
    }

    @Override
    public JsonObject visitAwaitExpr(AwaitExpr node, Void ctx) {
        JsonObject o = node("Await", node);
        o.add("value", write(node.getValue()));
        return o;
    }

    @Override
    public JsonObject visitYieldExpr(YieldExpr node, Void ctx) {
        JsonObject o = node("Yield", node);
        o.add("value", write(node.getValue()));
        return o;
    }

    @Override
    public JsonObject visitYieldFromExpr(YieldFromExpr node, Void ctx) {
        JsonObject o = node("YieldFrom", node);
        o.add("value", write(node.getValue()));
        return o;
    }

    @Override
    public JsonObject visitCompareExpr(CompareExpr node, Void ctx) {
        JsonObject o = node("Compare", node);
        o.add("left", write(node.getLeft()));
        JsonArray ops = new JsonArray();
        for (CompareExpr.CompareOp op : node.getOperators()) {
            ops.add(op.toSourceString());
        }
        o.add("ops", ops);
        o.add("comparators", writeAll(node.getComparators()));
        return o;
    }

    @Override
    public JsonObject visitCallExpr(CallExpr node, Void ctx) {
        JsonObject o = node("Call", node);
        o.add("func", write(node.getCallee()));
        o.add("args", writeAll(node.getArgs()));
        return o;
    }

    @Override
    public JsonObject visitFormattedValue(FormattedValue node, Void ctx) {
        JsonObject o = node("FormattedValue", node);
        o.add("value", write(node.getValue()));
        if (node.hasConversion()) {
            o.addProperty("conversion", String.valueOf(node.getConversion()));
        } else {
            o.add("conversion", JsonNull.INSTANCE);
        }
        o.add("format_spec", write(node.getFormatSpec()));
        return o;
    }

    @Override
    public JsonObject visitJoinedStr(JoinedStr node, Void ctx) {
        JsonObject o = node("JoinedStr", node);
        o.add("values", writeAll(node.getValues()));
        return o;
    }

    @Override
    public JsonObject visitConstant(Constant node, Void ctx) {
        JsonObject o = node("Constant", node);
        Object value = node.getValue();
        switch (node.getKind()) {
            case INT:
                o.addProperty("kind", "int");
                o.add("value", new JsonPrimitive((BigInteger) value));
                break;
            case FLOAT:
                o.addProperty("kind", "float");
                o.add("value", new JsonPrimitive((Double) value));
                break;
            case COMPLEX:
                o.addProperty("kind", "complex");
                o.add("value", new JsonPrimitive((Double) value));
                break;
            case STRING:
                o.addProperty("kind", "str");
                o.addProperty("value", (String) value);
                break;
            case BYTES:
                o.addProperty("kind", "bytes");
                o.addProperty("value", (String) value);
                break;
            case BOOLEAN:
                o.addProperty("kind", "bool");
                o.addProperty("value", (Boolean) value);
                break;
            case NONE:
                o.addProperty("kind", "None");
                break;
            case ELLIPSIS:
                o.addProperty("kind", "Ellipsis");
                break;
            default:
                throw new IllegalStateException("Unknown constant kind: " + node.getKind());
        }
        return o;
    }

    @Override
    public JsonObject visitAttributeExpr(AttributeExpr node, Void ctx) {
        JsonObject o = node("Attribute", node);
        o.add("value", write(node.getValue()));
        o.addProperty("attr", node.getAttr());
        return o;
    }

    @Override
    public JsonObject visitSubscriptExpr(SubscriptExpr node, Void ctx) {
        JsonObject o = node("Subscript", node);
        o.add("value", write(node.getValue()));
        o.add("slice", write(node.getSlice()));
        return o;
    }

    @Override
    public JsonObject visitStarredExpr(StarredExpr node, Void ctx) {
        JsonObject o = node("Starred", node);
        o.add("value", write(node.getValue()));
        return o;
    }

    @Override
    public JsonObject visitNameExpr(NameExpr node, Void ctx) {
        JsonObject o = node("Name", node);
        o.addProperty("id", node.getName());
        return o;
    }

    @Override
    public JsonObject visitListExpr(ListExpr node, Void ctx) {
        JsonObject o = node("List", node);
        o.add("elts", writeAll(node.getElements()));
        return o;
    }

    @Override
    public JsonObject visitTupleExpr(TupleExpr node, Void ctx) {
        JsonObject o = node("Tuple", node);
        o.add("elts", writeAll(node.getElements()));
        return o;
    }

    // ============ 辅助节点 ============

    @Override
    public JsonObject visitKeyValue(KeyValue node, Void ctx) {
        JsonObject o = node("KeyVal", node);
        o.add("key", write(node.getKey()));
        o.add("value", write(node.getValue()));
        return o;
    }

    @Override
    public JsonObject visitPositionalArg(PositionalArg node, Void ctx) {
        JsonObject o = node("PosArg", node);
        o.add("value", write(node.getValue()));
        return o;
    }

    @Override
    public JsonObject visitKeywordArg(KeywordArg node, Void ctx) {
        JsonObject o = node("KeywordArg", node);
        o.add("name", write(node.getName()));
        o.add("value", write(node.getValue()));
        return o;
    }

    @Override
    public JsonObject visitComprehension(Comprehension node, Void ctx) {
        JsonObject o = node("Comprehension", node);
        o.add("target", write(node.getTarget()));
        o.add("iter", write(node.getIter()));
        o.add("ifs", writeAll(node.getIfs()));
        o.addProperty("is_async", node.isAsync());
        return o;
    }

    @Override
    public JsonObject visitIndexSlice(IndexSlice node, Void ctx) {
        JsonObject o = node("Index", node);
        o.add("value", write(node.getValue()));
        return o;
    }

    @Override
    public JsonObject visitDefaultSlice(DefaultSlice node, Void ctx) {
        JsonObject o = node("DefaultSlice", node);
        o.add("lower", write(node.getLower()));
        o.add("upper", write(node.getUpper()));
        o.add("step", write(node.getStep()));
        return o;
    }

    @Override
    public JsonObject visitExtSlice(ExtSlice node, Void ctx) {
        JsonObject o = node("ExtSlice", node);
        o.add("dims", writeAll(node.getDims()));
        return o;
    }
}
