package com.spp.cli;

import com.spp.compiler.FrontendConfig;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.ParameterException;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.Spec;

import java.util.concurrent.Callable;

/**
 * picocli expr 子命令：解析表达式，输出 JSON 语法树并校验
 */
@Command(name = "expr", description = "解析 Python 表达式，输出 JSON 语法树并校验")
public class ExprCommand implements Callable<Integer> {

    @Spec
    CommandSpec spec;

    @Parameters(index = "0", description = "表达式源码")
    String text;

    @Option(names = "--max-expression-depth",
            defaultValue = "200",
            description = "表达式的最大嵌套层数（默认 ${DEFAULT-VALUE}）")
    int maxExpressionDepth;

    @Override
    public Integer call() {
        if (maxExpressionDepth < 1) {
            throw new ParameterException(spec.commandLine(), "--max-expression-depth 必须为正整数: " + maxExpressionDepth);
        }
        FrontendConfig config = new FrontendConfig();
        config.setMaxExpressionDepth(maxExpressionDepth);
        return new FrontendRunner(config, spec.commandLine().getOut(), spec.commandLine().getErr())
                .printExpression(text);
    }
}
