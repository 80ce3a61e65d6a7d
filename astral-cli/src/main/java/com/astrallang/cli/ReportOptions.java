package com.astrallang.cli;

import picocli.CommandLine.Option;

import java.nio.file.Path;
import java.util.List;

/**
 * 诊断输出选项，check 子命令与入口命令共用（picocli mixin）
 */
public class ReportOptions {

    @Option(names = "--json", description = "以 JSON 数组输出诊断到标准输出")
    boolean json;

    @Option(names = "--no-snippet", description = "不显示源码片段")
    boolean noSnippet;

    @Option(names = "--no-notes", description = "不显示 Note / Help 行")
    boolean noNotes;

    @Option(names = {"-q", "--quiet"}, description = "通过检查的文件不输出")
    boolean quiet;

    @Option(names = {"-v", "--verbose"}, description = "输出检查过程日志")
    boolean verbose;

    ReportConfig toConfig() {
        ReportConfig config = new ReportConfig();
        config.setJson(json);
        config.setShowSnippet(!noSnippet);
        config.setShowNotes(!noNotes);
        config.setQuiet(quiet);
        return config;
    }

    /** 按当前选项检查文件，返回退出码 */
    int check(List<Path> files) {
        if (verbose) {
            Main.enableVerboseLogging();
        }
        return new CheckRunner(toConfig(), System.out, System.err).run(files);
    }
}
