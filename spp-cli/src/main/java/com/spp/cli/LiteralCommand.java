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
 * picocli literal 子命令：解析一个字符串字面量，例如 {@code f'a {x!r:>{w}}'}
 */
@Command(name = "literal", description = "解析字符串字面量并输出 JSON 语法树")
public class LiteralCommand implements Callable<Integer> {

    @Spec
    CommandSpec spec;

    @Parameters(index = "0", description = "带前缀和引号的字符串字面量")
    String token;

    @Option(names = "--max-field-depth",
            defaultValue = "16",
            description = "替换字段的最大嵌套层数（默认 ${DEFAULT-VALUE}）")
    int maxFieldDepth;

    @Option(names = "--max-expression-depth",
            defaultValue = "200",
            description = "替换字段中表达式的最大嵌套层数（默认 ${DEFAULT-VALUE}）")
    int maxExpressionDepth;

    @Override
    public Integer call() {
        if (maxFieldDepth < 1) {
            throw new ParameterException(spec.commandLine(), "--max-field-depth 必须为正整数: " + maxFieldDepth);
        }
        if (maxExpressionDepth < 1) {
            throw new ParameterException(spec.commandLine(), "--max-expression-depth 必须为正整数: " + maxExpressionDepth);
        }
        FrontendConfig config = new FrontendConfig();
        config.setMaxFieldNestingDepth(maxFieldDepth);
        config.setMaxExpressionDepth(maxExpressionDepth);
        return new FrontendRunner(config, spec.commandLine().getOut(), spec.commandLine().getErr())
                .printLiteral(token);
    }
}
