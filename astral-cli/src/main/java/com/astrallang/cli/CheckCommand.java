package com.astrallang.cli;

import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;
import picocli.CommandLine.Parameters;

import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.Callable;

/**
 * picocli check 子命令：对源码文件运行所有权检查
 */
@Command(name = "check", description = "对 .astral 文件运行所有权 / 借用检查")
public class CheckCommand implements Callable<Integer> {

    @Parameters(arity = "1..*", description = "源码文件路径")
    List<Path> files;

    @Mixin
    ReportOptions report;

    @Override
    public Integer call() {
        return report.check(files);
    }
}
