package com.astrallang.cli;

import com.astrallang.compiler.analysis.AnalysisResult;
import com.astrallang.compiler.analysis.Diagnostic;
import com.astrallang.compiler.analysis.DiagnosticReporter;
import com.astrallang.compiler.analysis.OwnershipChecker;
import com.astrallang.compiler.ast.decl.Program;
import com.astrallang.compiler.lexer.Lexer;
import com.astrallang.compiler.lexer.Token;
import com.astrallang.compiler.parser.ParseException;
import com.astrallang.compiler.parser.Parser;
import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonArray;
import com.google.gson.JsonObject;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * 检查执行器：逐个文件 读取 → 词法 → 语法 → 所有权检查，返回进程退出码
 */
public class CheckRunner {

    private static final Logger LOG = Logger.getLogger(CheckRunner.class.getName());

    /** 所有文件通过 */
    public static final int EXIT_OK = 0;
    /** 存在语法错误或所有权诊断 */
    public static final int EXIT_DIAGNOSTICS = 1;
    /** 文件无法读取 */
    public static final int EXIT_IO_ERROR = 2;

    private final ReportConfig config;
    private final PrintStream out;
    private final PrintStream err;
    private final DiagnosticReporter reporter;
    private final Gson gson = new GsonBuilder().setPrettyPrinting().create();

    public CheckRunner(ReportConfig config, PrintStream out, PrintStream err) {
        this.config = config;
        this.out = out;
        this.err = err;
        this.reporter = new DiagnosticReporter(config.isShowSnippet(), config.isShowNotes());
    }

    /**
     * 依次检查文件，退出码取所有文件中最严重的一个
     */
    public int run(List<Path> files) {
        JsonArray diagnostics = new JsonArray();
        int exitCode = EXIT_OK;
        for (Path file : files) {
            exitCode = Math.max(exitCode, checkFile(file, diagnostics));
        }
        if (config.isJson()) {
            out.println(gson.toJson(diagnostics));
        }
        LOG.fine("Checked " + files.size() + " file(s), exit code " + exitCode);
        return exitCode;
    }

    int checkFile(Path path, JsonArray diagnostics) {
        String fileName = path.toString();
        if (!Files.exists(path)) {
            err.println("错误: 文件不存在 - " + fileName);
            diagnostics.add(ioError(fileName, "file not found"));
            return EXIT_IO_ERROR;
        }

        String source;
        try {
            source = new String(Files.readAllBytes(path), StandardCharsets.UTF_8);
        } catch (IOException e) {
            LOG.log(Level.FINE, "读取失败: " + fileName, e);
            err.println("错误: 无法读取文件 - " + fileName + " (" + e.getMessage() + ")");
            diagnostics.add(ioError(fileName, String.valueOf(e.getMessage())));
            return EXIT_IO_ERROR;
        }
        return checkSource(source, fileName, diagnostics);
    }

    int checkSource(String source, String fileName, JsonArray diagnostics) {
        Program program;
        try {
            Parser parser = new Parser(new Lexer(source, fileName, err), fileName);
            program = parser.parse();
        } catch (ParseException e) {
            reportSyntaxError(e, source, fileName, diagnostics);
            return EXIT_DIAGNOSTICS;
        }

        AnalysisResult result = new OwnershipChecker(fileName).analyze(program);
        if (result.isSuccess()) {
            if (!config.isQuiet() && !config.isJson()) {
                out.println("ok: " + fileName);
            }
            return EXIT_OK;
        }

        Diagnostic diagnostic = result.getDiagnostic();
        if (config.isJson()) {
            diagnostics.add(toJson(diagnostic));
        } else {
            err.println(reporter.render(diagnostic, source));
        }
        return EXIT_DIAGNOSTICS;
    }

    private void reportSyntaxError(ParseException e, String source, String fileName, JsonArray diagnostics) {
        Token token = e.getToken();
        if (config.isJson()) {
            JsonObject diag = new JsonObject();
            diag.addProperty("file", fileName);
            diag.addProperty("line", token != null ? token.getLine() : 0);
            diag.addProperty("column", token != null ? token.getColumn() : 0);
            diag.addProperty("kind", "SYNTAX_ERROR");
            diag.addProperty("message", e.getRawMessage());
            diagnostics.add(diag);
            return;
        }
        err.println("语法错误: " + e.getMessage());
        if (token != null) {
            err.println("  --> " + fileName + ":" + token.getLine() + ":" + token.getColumn());
            String snippet = DiagnosticReporter.snippet(source, token.getLine(), token.getColumn(),
                    token.getLexeme().length());
            if (config.isShowSnippet() && !snippet.isEmpty()) {
                err.println(snippet.substring(1));  // 去掉开头的换行
            }
        }
    }

    static JsonObject toJson(Diagnostic diagnostic) {
        JsonObject diag = new JsonObject();
        diag.addProperty("file", diagnostic.getFile());
        diag.addProperty("line", diagnostic.getLine());
        diag.addProperty("column", diagnostic.getColumn());
        diag.addProperty("kind", diagnostic.getKind().name());
        diag.addProperty("message", diagnostic.getMessage());
        if (diagnostic.hasNote()) {
            diag.addProperty("note", diagnostic.getNote());
        }
        if (diagnostic.hasHelp()) {
            diag.addProperty("help", diagnostic.getHelp());
        }
        return diag;
    }

    private static JsonObject ioError(String fileName, String message) {
        JsonObject diag = new JsonObject();
        diag.addProperty("file", fileName);
        diag.addProperty("kind", "IO_ERROR");
        diag.addProperty("message", message);
        return diag;
    }
}
