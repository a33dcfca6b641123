package com.spp.cli;

import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Spec;

/**
 * spp 命令行入口（picocli）
 */
@Command(name = "spp", version = "spp 0.1.0",
         mixinStandardHelpOptions = true,
         description = "Python 语法树校验与字符串字面量解析",
         subcommands = {ValidateCommand.class, LiteralCommand.class, ExprCommand.class})
public class Main implements Runnable {

    @Spec
    CommandSpec spec;

    @Override
    public void run() {
        // 没有子命令时只打印用法
        spec.commandLine().usage(spec.commandLine().getOut());
    }

    public static void main(String[] args) {
        int exitCode = new CommandLine(new Main()).execute(args);
        System.exit(exitCode);
    }
}
