package com.spp.cli;

import com.spp.cli.json.AstJsonException;
import com.spp.cli.json.AstJsonReader;
import com.spp.cli.json.AstJsonWriter;
import com.spp.compiler.FrontendConfig;
import com.spp.compiler.analysis.TreeValidator;
import com.spp.compiler.analysis.ValidationError;
import com.spp.compiler.analysis.ValidationResult;
import com.spp.compiler.ast.decl.ModuleDecl;
import com.spp.compiler.ast.expr.Expression;
import com.spp.compiler.lexer.Lexer;
import com.spp.compiler.lexer.Token;
import com.spp.compiler.lexer.TokenType;
import com.spp.compiler.parser.ParseException;
import com.spp.compiler.parser.PythonExpressionParser;
import com.spp.compiler.parser.StringLiteral;

import java.io.IOException;
import java.io.PrintStream;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;

/**
 * 子命令的执行逻辑：结果写到 out，错误写到 err，返回进程退出码
 */
public class FrontendRunner {

    public static final int EXIT_OK = 0;
    public static final int EXIT_FAILURE = 1;

    static final String LITERAL_FILE_NAME = "<literal>";

    private final FrontendConfig config;
    private final PrintWriter out;
    private final PrintWriter err;
    private final PrintStream diagnostics;
    private final AstJsonWriter jsonWriter = new AstJsonWriter();

    public FrontendRunner(FrontendConfig config, PrintWriter out, PrintWriter err) {
        this(config, out, err, System.err);
    }

    /**
     * @param diagnostics 词法分析器的诊断输出
     */
    public FrontendRunner(FrontendConfig config, PrintWriter out, PrintWriter err, PrintStream diagnostics) {
        this.config = config;
        this.out = out;
        this.err = err;
        this.diagnostics = diagnostics;
    }

    /**
     * 读取 JSON 语法树文件并校验
     */
    public int validateFile(String filePath) {
        Path path = Paths.get(filePath);
        if (!Files.isRegularFile(path)) {
            err.println("错误: 文件不存在 - " + filePath);
            return EXIT_FAILURE;
        }

        ModuleDecl module;
        try {
            String json = new String(Files.readAllBytes(path), StandardCharsets.UTF_8);
            module = new AstJsonReader(path.getFileName().toString(), config.getMaxTreeDepth()).readModule(json);
        } catch (IOException e) {
            err.println("错误: 无法读取文件 - " + filePath + " (" + e.getMessage() + ")");
            return EXIT_FAILURE;
        } catch (AstJsonException e) {
            err.println("语法树格式错误: " + e.getMessage());
            return EXIT_FAILURE;
        }

        ValidationResult result = new TreeValidator(config).validate(module);
        if (result.isValid()) {
            out.println("OK");
            return EXIT_OK;
        }
        return reportValidationError(result.getError());
    }

    /**
     * 解析单个字符串字面量 token（含前缀和引号）并输出 JSON 语法树
     */
    public int printLiteral(String token) {
        PythonExpressionParser parser = new PythonExpressionParser(config, diagnostics);
        Expression expr;
        try {
            expr = parser.getLiteralParser().parse(splitLiteral(token));
        } catch (ParseException e) {
            err.println("解析错误: " + e.getMessage());
            return EXIT_FAILURE;
        }

        // 只拦截过深的树，其余校验错误不属于字面量解析
        ValidationResult result = new TreeValidator(config).validateNode(expr);
        if (isTooDeep(result)) {
            return reportValidationError(result.getError());
        }
        out.println(jsonWriter.toJson(expr));
        return EXIT_OK;
    }

    /**
     * 解析表达式，输出 JSON 语法树，再报告树校验结果
     *
     * <p>树过深时不输出 JSON，只报告 NESTING_TOO_DEEP。</p>
     */
    public int printExpression(String text) {
        PythonExpressionParser parser = new PythonExpressionParser(config, diagnostics);
        Expression expr;
        try {
            expr = parser.parseExpression(text);
        } catch (ParseException e) {
            err.println("解析错误: " + e.getMessage());
            return EXIT_FAILURE;
        }
        ValidationResult result = new TreeValidator(config).validateNode(expr);
        if (!isTooDeep(result)) {
            out.println(jsonWriter.toJson(expr));
        }
        if (result.isValid()) {
            return EXIT_OK;
        }
        return reportValidationError(result.getError());
    }

    /** 用词法分析器切出前缀、引号和内容；输入必须恰好是一个字符串 token */
    StringLiteral splitLiteral(String token) {
        List<Token> tokens = new Lexer(token, LITERAL_FILE_NAME, diagnostics).scanTokens();
        Token first = tokens.get(0);
        if (first.is(TokenType.ERROR)) {
            throw new ParseException(first.getErrorMessage(), first);
        }
        if (!first.is(TokenType.STRING_LITERAL) || tokens.size() != 2) {
            throw new ParseException("Expected a single string literal", first);
        }
        return first.getStringLiteral();
    }

    private static boolean isTooDeep(ValidationResult result) {
        return !result.isValid() && result.getError().getKind() == ValidationError.Kind.NESTING_TOO_DEEP;
    }

    private int reportValidationError(ValidationError error) {
        out.println("Validation error: " + error.getMessage());
        if (error.getLocation().isKnown()) {
            out.println("  at " + error.getLocation());
        }
        return EXIT_FAILURE;
    }
}
