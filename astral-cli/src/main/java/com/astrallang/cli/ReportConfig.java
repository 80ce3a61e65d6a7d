package com.astrallang.cli;

/**
 * 诊断输出配置
 */
public class ReportConfig {
    private boolean showSnippet = true;
    private boolean showNotes = true;
    private boolean json = false;
    private boolean quiet = false;

    public ReportConfig() {
    }

    public boolean isShowSnippet() {
        return showSnippet;
    }

    public void setShowSnippet(boolean showSnippet) {
        this.showSnippet = showSnippet;
    }

    public boolean isShowNotes() {
        return showNotes;
    }

    public void setShowNotes(boolean showNotes) {
        this.showNotes = showNotes;
    }

    public boolean isJson() {
        return json;
    }

    public void setJson(boolean json) {
        this.json = json;
    }

    /** 静默模式：通过检查的文件不输出 ok 行 */
    public boolean isQuiet() {
        return quiet;
    }

    public void setQuiet(boolean quiet) {
        this.quiet = quiet;
    }
}
