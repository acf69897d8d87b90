package com.irixsearch.config;

import java.nio.file.Path;

/**
 * 查询阶段运行时配置
 * 
 * 由 CLI 参数注入，覆盖 Constants 默认值
 */
public class EngineConfig {
    private Path indexFile;
    private int resultLimit = Constants.DEFAULT_RESULT_LIMIT;
    private int slowQueryTop = Constants.DEFAULT_SLOW_QUERY_TOP;
    private boolean onlyDocId;
    private boolean noResults;
    private Path reportFile;
    private int reportTopResults = Constants.DEFAULT_REPORT_TOP_RESULTS;
    
    public Path getIndexFile() {
        return indexFile;
    }
    
    public void setIndexFile(Path indexFile) {
        this.indexFile = indexFile;
    }
    
    public int getResultLimit() {
        return resultLimit;
    }
    
    public void setResultLimit(int resultLimit) {
        this.resultLimit = resultLimit;
    }
    
    public int getSlowQueryTop() {
        return slowQueryTop;
    }
    
    public void setSlowQueryTop(int slowQueryTop) {
        this.slowQueryTop = slowQueryTop;
    }
    
    public boolean isOnlyDocId() {
        return onlyDocId;
    }
    
    public void setOnlyDocId(boolean onlyDocId) {
        this.onlyDocId = onlyDocId;
    }
    
    public boolean isNoResults() {
        return noResults;
    }
    
    public void setNoResults(boolean noResults) {
        this.noResults = noResults;
    }
    
    public Path getReportFile() {
        return reportFile;
    }
    
    public void setReportFile(Path reportFile) {
        this.reportFile = reportFile;
    }
    
    public int getReportTopResults() {
        return reportTopResults;
    }
    
    public void setReportTopResults(int reportTopResults) {
        this.reportTopResults = reportTopResults;
    }
    
    /**
     * 使用默认配置创建实例
     */
    public static EngineConfig defaults() {
        return new EngineConfig();
    }
}
