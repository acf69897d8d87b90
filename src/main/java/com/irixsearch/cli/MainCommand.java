package com.irixsearch.cli;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.irixsearch.config.Constants;
import com.irixsearch.config.EngineConfig;
import com.irixsearch.index.BuildSummary;
import com.irixsearch.index.IndexBuildService;
import com.irixsearch.query.QueryEngine;
import com.irixsearch.report.QueryReportWriter;
import com.irixsearch.report.QueryRunner;
import com.irixsearch.storage.IndexLoader;
import com.irixsearch.storage.IndexMetadata;
import com.irixsearch.storage.IndexStatus;
import com.irixsearch.storage.InvertedIndex;
import com.irixsearch.text.Utf8LineReader;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;
import java.util.concurrent.Callable;

@Command(
    name = "irix",
    description = "布尔倒排索引构建与检索工具",
    mixinStandardHelpOptions = true,
    version = "1.0.0",
    subcommands = {
        MainCommand.IndexSubcommand.class,
        MainCommand.SearchSubcommand.class,
        MainCommand.StatusSubcommand.class
    }
)
public class MainCommand implements Callable<Integer> {

    public static void main(String[] args) {
        int exitCode = new CommandLine(new MainCommand()).execute(args);
        System.exit(exitCode);
    }

    @Override
    public Integer call() {
        System.out.println("布尔倒排索引构建与检索工具");
        System.out.println("使用 --help 查看帮助信息");
        return 0;
    }

    /**
     * 致命错误统一输出一行诊断并返回非零退出码。
     */
    static int fail(Exception exception) {
        System.err.println("ERROR: " + exception.getMessage());
        return 1;
    }

    static int sanitizeCount(String name, int rawValue) {
        if (rawValue < 0) {
            System.err.printf("WARN: %s=%d 非法，已使用 0%n", name, rawValue);
            return 0;
        }
        return rawValue;
    }

    @Command(name = "index", description = "由 token 流构建二进制索引")
    static class IndexSubcommand implements Callable<Integer> {

        @Parameters(index = "0", description = "token 流文件，每行 <docId> <token>")
        private Path tokensFile;

        @Parameters(index = "1", description = "输出索引文件")
        private Path outputFile;

        @Parameters(index = "2", arity = "0..1", description = "可选文档元数据（含 url_norm 字段的 JSON）")
        private Path metadataFile;

        @Override
        public Integer call() {
            try {
                BuildSummary summary = new IndexBuildService().build(tokensFile, outputFile, metadataFile);
                printSummary(summary);
                return 0;
            } catch (IOException exception) {
                return fail(exception);
            }
        }

        private void printSummary(BuildSummary summary) {
            IndexMetadata metadata = summary.metadata();
            System.out.println("OK: wrote " + summary.outputFile());
            System.out.println("Docs: " + metadata.documentCount());
            System.out.println("Total tokens: " + metadata.totalTokens());
            System.out.println("Unique terms: " + metadata.uniqueTerms());
            System.out.printf(Locale.ROOT, "Avg token(term) length (bytes): %.4f%n", metadata.averageTermLength());
            System.out.printf(Locale.ROOT, "Indexing time (ms): %.3f%n", metadata.buildMillis());
            System.out.printf(Locale.ROOT, "Tokens per ms: %.3f (~%.0f tokens/s)%n",
                summary.tokensPerMillisecond(), summary.tokensPerMillisecond() * 1000.0);
            System.out.printf(Locale.ROOT, "Time per document (ms/doc): %.6f%n", summary.millisecondsPerDocument());
        }
    }

    @Command(name = "search", description = "从 stdin 逐行读取布尔查询并检索")
    static class SearchSubcommand implements Callable<Integer> {

        @Parameters(index = "0", description = "索引文件")
        private Path indexFile;

        @Option(names = {"--k"}, description = "每条查询输出的结果上限，0 表示不限制", defaultValue = "0")
        private int resultLimit;

        @Option(names = {"--top"}, description = "慢查询报告条数", defaultValue = "10")
        private int slowQueryTop;

        @Option(names = {"--only-docid"}, description = "只输出 docId")
        private boolean onlyDocId;

        @Option(names = {"--no-results"}, description = "不输出结果")
        private boolean noResults;

        @Option(names = {"--report"}, description = "明细报告文件")
        private Path reportFile;

        @Option(names = {"--topres"}, description = "报告中每条查询最多列出的标题数", defaultValue = "50")
        private int reportTopResults;

        @Override
        public Integer call() {
            EngineConfig config = toConfig();
            InvertedIndex index;
            try {
                index = IndexLoader.load(config.getIndexFile());
            } catch (IOException exception) {
                return fail(exception);
            }

            QueryReportWriter reportWriter = null;
            try {
                if (config.getReportFile() != null) {
                    reportWriter = openReport(config, index);
                }
                Utf8LineReader input = new Utf8LineReader(System.in);
                new QueryRunner(new QueryEngine(index), config, System.out, System.err, reportWriter).run(input);
                return 0;
            } catch (IOException exception) {
                return fail(exception);
            } finally {
                closeQuietly(reportWriter);
            }
        }

        EngineConfig toConfig() {
            EngineConfig config = EngineConfig.defaults();
            config.setIndexFile(indexFile);
            config.setResultLimit(sanitizeCount("k", resultLimit));
            config.setSlowQueryTop(sanitizeCount("top", slowQueryTop));
            config.setOnlyDocId(onlyDocId);
            config.setNoResults(noResults);
            config.setReportFile(reportFile);
            config.setReportTopResults(sanitizeCount("topres", reportTopResults));
            return config;
        }

        private QueryReportWriter openReport(EngineConfig config, InvertedIndex index) throws IOException {
            try {
                return new QueryReportWriter(
                    Files.newBufferedWriter(config.getReportFile(), StandardCharsets.UTF_8),
                    index,
                    config.getReportTopResults());
            } catch (IOException exception) {
                throw new IOException("无法打开报告文件 (cannot open report file): " + config.getReportFile(), exception);
            }
        }

        private void closeQuietly(QueryReportWriter reportWriter) {
            if (reportWriter == null) {
                return;
            }
            try {
                reportWriter.close();
            } catch (IOException exception) {
                System.err.println("WARN: 关闭报告文件失败: " + exception.getMessage());
            }
        }
    }

    @Command(name = "status", description = "查看索引统计信息")
    static class StatusSubcommand implements Callable<Integer> {

        @Parameters(index = "0", description = "索引文件")
        private Path indexFile;

        @Option(names = {"-f", "--format"}, description = "输出格式 (text|json)", defaultValue = "text")
        private String format;

        @Override
        public Integer call() {
            try {
                InvertedIndex index = IndexLoader.load(indexFile);
                IndexStatus status = IndexStatus.of(indexFile.toString(), Constants.FORMAT_VERSION, index);
                if ("json".equalsIgnoreCase(format)) {
                    printJsonStatus(status);
                } else {
                    printTextStatus(status, Files.size(indexFile));
                }
                return 0;
            } catch (IOException exception) {
                return fail(exception);
            }
        }

        private void printTextStatus(IndexStatus status, long fileBytes) {
            System.out.println("索引状态");
            System.out.println("═══════════");
            System.out.println("索引文件: " + status.file());
            System.out.println("格式版本: " + status.version());
            System.out.println("文档总数: " + status.documentCount());
            System.out.println("token 总数: " + status.totalTokens());
            System.out.println("词条总数: " + status.dictionaryEntries());
            System.out.println("倒排长度: " + status.postingsCount());
            System.out.printf(Locale.ROOT, "平均词长: %.4f%n", status.averageTermLength());
            System.out.printf(Locale.ROOT, "构建耗时: %.3f ms%n", status.buildMillis());
            System.out.println("索引大小: " + formatBytes(fileBytes));
        }

        private void printJsonStatus(IndexStatus status) throws IOException {
            ObjectMapper mapper = new ObjectMapper();
            System.out.println(mapper.writerWithDefaultPrettyPrinter().writeValueAsString(status));
        }

        private String formatBytes(long bytes) {
            if (bytes < 1024) {
                return bytes + " B";
            }
            if (bytes < 1024 * 1024L) {
                return String.format(Locale.ROOT, "%.2f KB", bytes / 1024.0);
            }
            if (bytes < 1024 * 1024L * 1024L) {
                return String.format(Locale.ROOT, "%.2f MB", bytes / (1024.0 * 1024.0));
            }
            return String.format(Locale.ROOT, "%.2f GB", bytes / (1024.0 * 1024.0 * 1024.0));
        }
    }
}
