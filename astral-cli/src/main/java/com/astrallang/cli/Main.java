package com.astrallang.cli;

import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;
import picocli.CommandLine.Parameters;

import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.logging.ConsoleHandler;
import java.util.logging.Handler;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Astral CLI 入口点（picocli）
 *
 * <p>{@code astral check [options] <files...>}，或直接 {@code astral [options] <files...>}。</p>
 */
@Command(name = "astral", version = "Astral v0.1.0",
         mixinStandardHelpOptions = true,
         subcommands = {CheckCommand.class})
public class Main implements Callable<Integer> {

    // 持有强引用，避免配置后的 logger 被回收
    private static final Logger ASTRAL_LOGGER = Logger.getLogger("com.astrallang");

    @Parameters(description = "源码文件（等同于 check 子命令）")
    List<Path> files;

    @Mixin
    ReportOptions report;

    @Override
    public Integer call() {
        if (files == null || files.isEmpty()) {
            new CommandLine(this).usage(System.err);
            return CommandLine.ExitCode.USAGE;
        }
        return report.check(files);
    }

    /**
     * 将 com.astrallang 日志提升到 FINE 并输出到控制台，重复调用只挂一个控制台 handler
     */
    static synchronized void enableVerboseLogging() {
        ASTRAL_LOGGER.setLevel(Level.FINE);
        for (Handler existing : ASTRAL_LOGGER.getHandlers()) {
            if (existing instanceof ConsoleHandler) {
                return;
            }
        }
        ConsoleHandler handler = new ConsoleHandler();
        handler.setLevel(Level.FINE);
        ASTRAL_LOGGER.addHandler(handler);
        ASTRAL_LOGGER.setUseParentHandlers(false);
    }

    public static void main(String[] args) {
        int exitCode = new CommandLine(new Main()).execute(args);
        System.exit(exitCode);
    }
}
