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
 * picocli validate 子命令：校验 JSON 格式的模块语法树
 */
@Command(name = "validate", description = "校验 JSON 格式的模块语法树")
public class ValidateCommand implements Callable<Integer> {

    @Spec
    CommandSpec spec;

    @Parameters(index = "0", description = "语法树 JSON 文件路径")
    String file;

    @Option(names = "--max-unpacking-depth",
            defaultValue = "64",
            description = "赋值目标解包的最大嵌套层数（默认 ${DEFAULT-VALUE}）")
    int maxUnpackingDepth;

    @Option(names = "--max-tree-depth",
            defaultValue = "500",
            description = "语法树的最大深度（默认 ${DEFAULT-VALUE}）")
    int maxTreeDepth;

    @Override
    public Integer call() {
        if (maxUnpackingDepth < 1) {
            throw new ParameterException(spec.commandLine(), "--max-unpacking-depth 必须为正整数: " + maxUnpackingDepth);
        }
        if (maxTreeDepth < 1) {
            throw new ParameterException(spec.commandLine(), "--max-tree-depth 必须为正整数: " + maxTreeDepth);
        }
        FrontendConfig config = new FrontendConfig();
        config.setMaxUnpackingDepth(maxUnpackingDepth);
        config.setMaxTreeDepth(maxTreeDepth);
        return new FrontendRunner(config, spec.commandLine().getOut(), spec.commandLine().getErr())
                .validateFile(file);
    }
}
