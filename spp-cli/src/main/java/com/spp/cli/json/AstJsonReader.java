package com.spp.cli.json;

import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;
import com.google.gson.JsonPrimitive;
import com.spp.compiler.FrontendConfig;
import com.spp.compiler.ast.AstNode;
import com.spp.compiler.ast.SourceLocation;
import com.spp.compiler.ast.decl.*;
import com.spp.compiler.ast.expr.*;
import com.spp.compiler.ast.stmt.*;

import java.io.Reader;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 从 JSON 读取语法树
 *
 * <p>每个节点是带 {@code "type"} 字段的对象，字段名沿用 Python ast 模块。
 * 缺省的列表字段视为空列表，缺省的可选节点视为 null；位置信息 {@code line}/{@code column} 可省略。</p>
 *
 * <p>读取过程记录当前嵌套层数，同一实例不能在多个线程间同时使用。</p>
 *
 * @see AstJsonWriter
 */
public final class AstJsonReader {

    public static final String DEFAULT_SOURCE_NAME = "<json>";

    private final String sourceName;
    private final int maxDepth;
    private int depth;

    public AstJsonReader() {
        this(DEFAULT_SOURCE_NAME);
    }

    public AstJsonReader(String sourceName) {
        this(sourceName, FrontendConfig.DEFAULT_MAX_TREE_DEPTH);
    }

    /**
     * @param sourceName 写入节点位置信息的文件名
     * @param maxDepth   节点对象允许的最大嵌套层数，超过时报错而不是继续递归
     */
    public AstJsonReader(String sourceName, int maxDepth) {
        this.sourceName = sourceName;
        this.maxDepth = maxDepth;
    }

    public ModuleDecl readModule(String json) {
        return readModule(parse(json));
    }

    public ModuleDecl readModule(Reader reader) {
        JsonElement element;
        try {
            element = JsonParser.parseReader(reader);
        } catch (JsonParseException e) {
            throw new AstJsonException("Malformed JSON: " + e.getMessage(), null, e);
        }
        return readModule(element);
    }

    public ModuleDecl readModule(JsonElement element) {
        return node(element, ModuleDecl.class, "$");
    }

    /** 读取任意节点 */
    public AstNode readNode(String json) {
        return node(parse(json), AstNode.class, "$");
    }

    public Expression readExpression(String json) {
        return node(parse(json), Expression.class, "$");
    }

    private static JsonElement parse(String json) {
        try {
            return JsonParser.parseString(json);
        } catch (JsonParseException e) {
            throw new AstJsonException("Malformed JSON: " + e.getMessage(), null, e);
        }
    }

    // ============ 节点分派 ============

    private <T extends AstNode> T node(JsonElement element, Class<T> expected, String path) {
        if (element == null || element.isJsonNull()) {
            throw new AstJsonException("Missing node", path);
        }
        if (!element.isJsonObject()) {
            throw new AstJsonException("Expected a node object", path);
        }
        JsonObject object = element.getAsJsonObject();
        String type = string(object, "type", path);
        AstNode node;
        try {
            if (++depth > maxDepth) {
                throw new AstJsonException("Maximum nesting depth exceeded", path);
            }
            node = dispatch(type, object, location(object, path), path);
        } finally {
            depth--;
        }
        if (!expected.isInstance(node)) {
            throw new AstJsonException("Expected " + expected.getSimpleName() + " but found '" + type + "'", path);
        }
        return expected.cast(node);
    }

    private AstNode dispatch(String type, JsonObject o, SourceLocation loc, String path) {
        switch (type) {
            // 声明
            case "Module":
                return new ModuleDecl(loc, list(o, "body", Statement.class, path));
            case "FunctionDef":
                return new FunctionDecl(loc, string(o, "name", path), arguments(o, path),
                        list(o, "body", Statement.class, path),
                        list(o, "decorator_list", Expression.class, path),
                        optional(o, "returns", Expression.class, path),
                        bool(o, "is_async", false, path));
            case "ClassDef":
                return new ClassDecl(loc, string(o, "name", path),
                        list(o, "bases", CallArgument.class, path),
                        list(o, "body", Statement.class, path),
                        list(o, "decorator_list", Expression.class, path));
            case "Arguments":
                return new Arguments(loc, list(o, "args", Arg.class, path),
                        optional(o, "vararg", Arg.class, path),
                        list(o, "kwonlyargs", Arg.class, path),
                        optional(o, "kwarg", Arg.class, path));
            case "Arg":
                return new Arg(loc, string(o, "arg", path),
                        optional(o, "annotation", Expression.class, path),
                        optional(o, "default", Expression.class, path));

            // 语句
            case "Return":
                return new ReturnStmt(loc, optional(o, "value", Expression.class, path));
            case "Delete":
                return new DeleteStmt(loc, list(o, "targets", Expression.class, path));
            case "Assign":
                return new AssignStmt(loc, list(o, "targets", Expression.class, path),
                        required(o, "value", Expression.class, path));
            case "AugAssign":
                return new AugAssignStmt(loc, required(o, "target", Expression.class, path),
                        binaryOp(o, path), required(o, "value", Expression.class, path));
            case "AnnAssign":
                return new AnnAssignStmt(loc, required(o, "target", Expression.class, path),
                        required(o, "annotation", Expression.class, path),
                        optional(o, "value", Expression.class, path),
                        bool(o, "simple", true, path));
            case "For":
                return new ForStmt(loc, required(o, "target", Expression.class, path),
                        required(o, "iter", Expression.class, path),
                        list(o, "body", Statement.class, path),
                        list(o, "orelse", Statement.class, path),
                        bool(o, "is_async", false, path));
            case "While":
                return new WhileStmt(loc, required(o, "test", Expression.class, path),
                        list(o, "body", Statement.class, path),
                        list(o, "orelse", Statement.class, path));
            case "If":
                return new IfStmt(loc, required(o, "test", Expression.class, path),
                        list(o, "body", Statement.class, path),
                        list(o, "orelse", Statement.class, path));
            case "With":
                return new WithStmt(loc, list(o, "items", WithItem.class, path),
                        list(o, "body", Statement.class, path),
                        bool(o, "is_async", false, path));
            case "WithItem":
                return new WithItem(loc, required(o, "context_expr", Expression.class, path),
                        optional(o, "optional_vars", Expression.class, path));
            case "Raise":
                return new RaiseStmt(loc, optional(o, "exc", Expression.class, path),
                        optional(o, "cause", Expression.class, path));
            case "Try":
                return new TryStmt(loc, list(o, "body", Statement.class, path),
                        list(o, "handlers", ExceptHandler.class, path),
                        list(o, "orelse", Statement.class, path),
                        list(o, "finalbody", Statement.class, path));
            case "ExceptionHandler":
                return new ExceptHandler(loc, optional(o, "exc_type", Expression.class, path),
                        optionalString(o, "name", path),
                        list(o, "body", Statement.class, path));
            case "Assert":
                return new AssertStmt(loc, required(o, "test", Expression.class, path),
                        optional(o, "msg", Expression.class, path));
            case "Import":
                return new ImportStmt(loc, list(o, "names", Alias.class, path));
            case "ImportFrom":
                return new ImportFromStmt(loc, optionalString(o, "module", path),
                        list(o, "names", Alias.class, path), integer(o, "level", 0, path));
            case "Alias":
                return new Alias(loc, string(o, "name", path), optionalString(o, "asname", path));
            case "Global":
                return new GlobalStmt(loc, stringList(o, "names", path));
            case "Nonlocal":
                return new NonlocalStmt(loc, stringList(o, "names", path));
            case "Pass":
                return new PassStmt(loc);
            case "Break":
                return new BreakStmt(loc);
            case "Continue":
                return new ContinueStmt(loc);
            case "ExprStmt":
                return new ExpressionStmt(loc, required(o, "value", Expression.class, path));

            // 表达式
            case "BoolOp":
                return new BoolOpExpr(loc, boolOp(o, path), list(o, "values", Expression.class, path));
            case "NamedExpr":
                return new NamedExpr(loc, required(o, "target", Expression.class, path),
                        required(o, "value", Expression.class, path));
            case "BinOp":
                return new BinaryExpr(loc, required(o, "left", Expression.class, path),
                        binaryOp(o, path), required(o, "right", Expression.class, path));
            case "UnaryOp":
                return new UnaryExpr(loc, unaryOp(o, path), required(o, "operand", Expression.class, path));
            case "Lambda":
                return new LambdaExpr(loc, arguments(o, path), required(o, "body", Expression.class, path));
            case "IfExpr":
                return new IfExpr(loc, required(o, "test", Expression.class, path),
                        required(o, "body", Expression.class, path),
                        required(o, "orelse", Expression.class, path));
            case "Dict":
                return new DictExpr(loc, list(o, "entries", KeyValue.class, path));
            case "KeyVal":
                return new KeyValue(loc, optional(o, "key", Expression.class, path),
                        required(o, "value", Expression.class, path));
            case "Set":
                return new SetExpr(loc, list(o, "elts", Expression.class, path));
            case "ListComp":
                return new ListCompExpr(loc, required(o, "elt", Expression.class, path), generators(o, path));
            case "SetComp":
                return new SetCompExpr(loc, required(o, "elt", Expression.class, path), generators(o, path));
            case "GeneratorExp":
                return new GeneratorExpr(loc, required(o, "elt", Expression.class, path), generators(o, path));
            case "DictComp":
                return new DictCompExpr(loc, new KeyValue(loc, required(o, "key", Expression.class, path),
                        required(o, "value", Expression.class, path)), generators(o, path));
            case "Comprehension":
                return new Comprehension(loc, required(o, "target", Expression.class, path),
                        required(o, "iter", Expression.class, path),
                        list(o, "ifs", Expression.class, path),
                        bool(o, "is_async", false, path));
            case "Await":
                return new AwaitExpr(loc, required(o, "value", Expression.class, path));
            case "Yield":
                return new YieldExpr(loc, optional(o, "value", Expression.class, path));
            case "YieldFrom":
                return new YieldFromExpr(loc, required(o, "value", Expression.class, path));
            case "Compare":
                return compare(o, loc, path);
            case "Call":
                return new CallExpr(loc, required(o, "func", Expression.class, path),
                        list(o, "args", CallArgument.class, path));
            case "PosArg":
                return new PositionalArg(loc, required(o, "value", Expression.class, path));
            case "KeywordArg":
                return new KeywordArg(loc, optional(o, "name", Expression.class, path),
                        required(o, "value", Expression.class, path));
            case "FormattedValue":
                return new FormattedValue(loc, required(o, "value", Expression.class, path),
                        conversion(o, path), optional(o, "format_spec", JoinedStr.class, path));
            case "JoinedStr":
                return new JoinedStr(loc, list(o, "values", Expression.class, path));
            case "Constant":
                return constant(o, loc, path);
            case "Attribute":
                return new AttributeExpr(loc, required(o, "value", Expression.class, path),
                        string(o, "attr", path));
            case "Subscript":
                return new SubscriptExpr(loc, required(o, "value", Expression.class, path),
                        required(o, "slice", Slice.class, path));
            case "Index":
                return new IndexSlice(loc, required(o, "value", Expression.class, path));
            case "DefaultSlice":
                return new DefaultSlice(loc, optional(o, "lower", Expression.class, path),
                        optional(o, "upper", Expression.class, path),
                        optional(o, "step", Expression.class, path));
            case "ExtSlice":
                return new ExtSlice(loc, list(o, "dims", Slice.class, path));
            case "Starred":
                return new StarredExpr(loc, required(o, "value", Expression.class, path));
            case "Name":
                return new NameExpr(loc, string(o, "id", path));
            case "List":
                return new ListExpr(loc, list(o, "elts", Expression.class, path));
            case "Tuple":
                return new TupleExpr(loc, list(o, "elts", Expression.class, path));
            default:
                throw new AstJsonException("Unknown node type '" + type + "'", path);
        }
    }

    // ============ 复合字段 ============

    private Arguments arguments(JsonObject o, String path) {
        Arguments args = optional(o, "args", Arguments.class, path);
        if (args != null) {
            return args;
        }
        return new Arguments(location(o, path), null, null, null, null);
    }

    private List<Comprehension> generators(JsonObject o, String path) {
        List<Comprehension> generators = list(o, "generators", Comprehension.class, path);
        if (generators.isEmpty()) {
            throw new AstJsonException("Comprehension needs at least one generator", path + ".generators");
        }
        return generators;
    }

    private CompareExpr compare(JsonObject o, SourceLocation loc, String path) {
        List<String> opNames = stringList(o, "ops", path);
        List<Expression> comparators = list(o, "comparators", Expression.class, path);
        if (opNames.isEmpty() || opNames.size() != comparators.size()) {
            throw new AstJsonException("'ops' and 'comparators' must be non-empty and of equal length", path);
        }
        List<CompareExpr.CompareOp> ops = new ArrayList<CompareExpr.CompareOp>(opNames.size());
        for (int i = 0; i < opNames.size(); i++) {
            CompareExpr.CompareOp op = CompareExpr.CompareOp.fromSource(opNames.get(i));
            if (op == null) {
                throw new AstJsonException("Unknown comparison operator '" + opNames.get(i) + "'", path + ".ops[" + i + "]");
            }
            ops.add(op);
        }
        return new CompareExpr(loc, required(o, "left", Expression.class, path), ops, comparators);
    }

    private char conversion(JsonObject o, String path) {
        String conversion = optionalString(o, "conversion", path);
        if (conversion == null) {
            return FormattedValue.NO_CONVERSION;
        }
        if (conversion.length() != 1 || "sra".indexOf(conversion.charAt(0)) < 0) {
            throw new AstJsonException("Invalid conversion '" + conversion + "'", path + ".conversion");
        }
        return conversion.charAt(0);
    }

    private Constant constant(JsonObject o, SourceLocation loc, String path) {
        String kind = string(o, "kind", path);
        String valuePath = path + ".value";
        try {
            switch (kind) {
                case "int":
                    return new Constant(loc, primitive(o, valuePath).getAsBigInteger(), Constant.ConstantKind.INT);
                case "float":
                    return new Constant(loc, primitive(o, valuePath).getAsDouble(), Constant.ConstantKind.FLOAT);
                case "complex":
                    return new Constant(loc, primitive(o, valuePath).getAsDouble(), Constant.ConstantKind.COMPLEX);
                case "str":
                    return new Constant(loc, string(o, "value", path), Constant.ConstantKind.STRING);
                case "bytes":
                    return new Constant(loc, string(o, "value", path), Constant.ConstantKind.BYTES);
                case "bool":
                    return new Constant(loc, bool(o, "value", false, path), Constant.ConstantKind.BOOLEAN);
                case "None":
                    return Constant.none(loc);
                case "Ellipsis":
                    return new Constant(loc, null, Constant.ConstantKind.ELLIPSIS);
                default:
                    throw new AstJsonException("Unknown constant kind '" + kind + "'", path + ".kind");
            }
        } catch (NumberFormatException e) {
            throw new AstJsonException("Invalid number", valuePath, e);
        }
    }

    private BinaryExpr.BinaryOp binaryOp(JsonObject o, String path) {
        String source = string(o, "op", path);
        BinaryExpr.BinaryOp op = BinaryExpr.BinaryOp.fromSource(source);
        if (op == null) {
            throw new AstJsonException("Unknown binary operator '" + source + "'", path + ".op");
        }
        return op;
    }

    private UnaryExpr.UnaryOp unaryOp(JsonObject o, String path) {
        String source = string(o, "op", path);
        UnaryExpr.UnaryOp op = UnaryExpr.UnaryOp.fromSource(source);
        if (op == null) {
            throw new AstJsonException("Unknown unary operator '" + source + "'", path + ".op");
        }
        return op;
    }

    private BoolOpExpr.BoolOp boolOp(JsonObject o, String path) {
        String source = string(o, "op", path);
        BoolOpExpr.BoolOp op = BoolOpExpr.BoolOp.fromSource(source);
        if (op == null) {
            throw new AstJsonException("Unknown boolean operator '" + source + "'", path + ".op");
        }
        return op;
    }

    // ============ 基本字段 ============

    private <T extends AstNode> T required(JsonObject o, String field, Class<T> expected, String path) {
        return node(o.get(field), expected, path + "." + field);
    }

    private <T extends AstNode> T optional(JsonObject o, String field, Class<T> expected, String path) {
        JsonElement element = o.get(field);
        if (element == null || element.isJsonNull()) {
            return null;
        }
        return node(element, expected, path + "." + field);
    }

    private <T extends AstNode> List<T> list(JsonObject o, String field, Class<T> expected, String path) {
        String fieldPath = path + "." + field;
        JsonArray array = array(o, field, fieldPath);
        if (array == null) {
            return Collections.<T>emptyList();
        }
        List<T> result = new ArrayList<T>(array.size());
        for (int i = 0; i < array.size(); i++) {
            result.add(node(array.get(i), expected, fieldPath + "[" + i + "]"));
        }
        return result;
    }

    private List<String> stringList(JsonObject o, String field, String path) {
        String fieldPath = path + "." + field;
        JsonArray array = array(o, field, fieldPath);
        if (array == null) {
            return Collections.<String>emptyList();
        }
        List<String> result = new ArrayList<String>(array.size());
        for (int i = 0; i < array.size(); i++) {
            JsonElement element = array.get(i);
            if (!isString(element)) {
                throw new AstJsonException("Expected a string", fieldPath + "[" + i + "]");
            }
            result.add(element.getAsString());
        }
        return result;
    }

    private static JsonArray array(JsonObject o, String field, String fieldPath) {
        JsonElement element = o.get(field);
        if (element == null || element.isJsonNull()) {
            return null;
        }
        if (!element.isJsonArray()) {
            throw new AstJsonException("Expected an array", fieldPath);
        }
        return element.getAsJsonArray();
    }

    private static String string(JsonObject o, String field, String path) {
        String value = optionalString(o, field, path);
        if (value == null) {
            throw new AstJsonException("Missing field '" + field + "'", path);
        }
        return value;
    }

    private static String optionalString(JsonObject o, String field, String path) {
        JsonElement element = o.get(field);
        if (element == null || element.isJsonNull()) {
            return null;
        }
        if (!isString(element)) {
            throw new AstJsonException("Expected a string", path + "." + field);
        }
        return element.getAsString();
    }

    private static boolean bool(JsonObject o, String field, boolean defaultValue, String path) {
        JsonElement element = o.get(field);
        if (element == null || element.isJsonNull()) {
            return defaultValue;
        }
        if (!element.isJsonPrimitive() || !element.getAsJsonPrimitive().isBoolean()) {
            throw new AstJsonException("Expected a boolean", path + "." + field);
        }
        return element.getAsBoolean();
    }

    private static int integer(JsonObject o, String field, int defaultValue, String path) {
        JsonElement element = o.get(field);
        if (element == null || element.isJsonNull()) {
            return defaultValue;
        }
        if (!element.isJsonPrimitive() || !element.getAsJsonPrimitive().isNumber()) {
            throw new AstJsonException("Expected a number", path + "." + field);
        }
        return element.getAsInt();
    }

    private static JsonPrimitive primitive(JsonObject o, String valuePath) {
        JsonElement element = o.get("value");
        if (element == null || !element.isJsonPrimitive()) {
            throw new AstJsonException("Expected a constant value", valuePath);
        }
        return element.getAsJsonPrimitive();
    }

    private static boolean isString(JsonElement element) {
        return element.isJsonPrimitive() && element.getAsJsonPrimitive().isString();
    }

    private SourceLocation location(JsonObject o, String path) {
        return SourceLocation.of(sourceName, integer(o, "line", 0, path), integer(o, "column", 0, path));
    }
}
