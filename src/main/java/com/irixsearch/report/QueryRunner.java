package com.irixsearch.report;

import com.irixsearch.config.EngineConfig;
import com.irixsearch.query.QueryEngine;
import com.irixsearch.query.SearchResult;
import com.irixsearch.storage.DocInfo;
import com.irixsearch.storage.InvertedIndex;
import com.irixsearch.text.TermNormalizer;
import com.irixsearch.text.Utf8LineReader;

import java.io.IOException;
import java.io.PrintStream;
import java.util.Optional;

/**
 * 查询批处理：逐行读取查询，执行、输出结果、写报告并记录耗时。
 *
 * 单条查询的错误只输出 WARN 诊断行并计为 0 命中，不中断后续查询。
 */
public final class QueryRunner {
    static final String INVALID_UTF8 = "Invalid UTF-8 in query";

    private final QueryEngine engine;
    private final EngineConfig config;
    private final PrintStream out;
    private final PrintStream err;
    private final QueryReportWriter reportWriter;
    private final SlowQueryTracker slowQueryTracker = new SlowQueryTracker();

    /**
     * @param engine 查询引擎
     * @param config 输出相关配置
     * @param out 结果输出流
     * @param err 诊断输出流
     * @param reportWriter 明细报告，可为 null
     */
    public QueryRunner(QueryEngine engine, EngineConfig config, PrintStream out, PrintStream err, QueryReportWriter reportWriter) {
        this.engine = engine;
        this.config = config;
        this.out = out;
        this.err = err;
        this.reportWriter = reportWriter;
    }

    /**
     * 处理输入中的全部查询，结束后输出慢查询表。非法 UTF-8 的查询行按失败查询处理。
     *
     * @param input 每行一条查询
     * @return 执行统计
     * @throws IOException 读取输入或写报告失败时抛出
     */
    public RunSummary run(Utf8LineReader input) throws IOException {
        int executed = 0;
        int failed = 0;
        Utf8LineReader.Line inputLine;
        while ((inputLine = input.readLine()) != null) {
            long lineNumber = inputLine.number();
            String line = inputLine.text();
            if (isBlank(line)) {
                continue;
            }
            SearchResult result = inputLine.validUtf8()
                ? engine.search(line)
                : SearchResult.failure(line, INVALID_UTF8, 0L);
            executed++;
            slowQueryTracker.record(new SlowQuery(result.elapsedMillis(), lineNumber, result.totalMatches(), line));

            if (!result.isSuccess()) {
                failed++;
                err.println("WARN: line " + lineNumber + ": parse/eval error: " + result.error() + " | query: " + line);
            }
            if (reportWriter != null) {
                reportWriter.write(result);
            }
            if (result.isSuccess() && !config.isNoResults()) {
                printResults(result);
            }
        }
        out.flush();
        slowQueryTracker.report(config.getSlowQueryTop(), err);
        return new RunSummary(executed, failed);
    }

    public SlowQueryTracker getSlowQueryTracker() {
        return slowQueryTracker;
    }

    /**
     * 每个命中文档输出一行：docId，或 docId\t标题\tURL；resultLimit 为 0 时不限制行数。
     */
    private void printResults(SearchResult result) {
        InvertedIndex index = engine.getIndex();
        int limit = config.getResultLimit();
        int printed = 0;
        for (int docId : result.docIds()) {
            if (limit > 0 && printed >= limit) {
                break;
            }
            Optional<DocInfo> document = index.document(docId);
            if (document.isEmpty()) {
                continue;
            }
            if (config.isOnlyDocId()) {
                out.println(docId);
            } else {
                out.println(docId + "\t" + document.get().title() + "\t" + document.get().url());
            }
            printed++;
        }
    }

    private static boolean isBlank(String line) {
        for (int index = 0; index < line.length(); index++) {
            if (!TermNormalizer.isSpace(line.charAt(index))) {
                return false;
            }
        }
        return true;
    }

    /**
     * 批处理统计。
     *
     * @param executed 执行的查询数（不含空行）
     * @param failed 解析或求值失败的查询数
     */
    public record RunSummary(int executed, int failed) {
    }
}
