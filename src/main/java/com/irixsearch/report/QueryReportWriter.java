package com.irixsearch.report;

import com.irixsearch.query.SearchResult;
import com.irixsearch.storage.DocInfo;
import com.irixsearch.storage.InvertedIndex;

import java.io.BufferedWriter;
import java.io.IOException;
import java.io.Writer;
import java.util.Optional;

/**
 * 逐条查询的明细报告。
 *
 * 每条查询一个块：QUERY 行、HITS 行，成功时最多 topResults 行 "标题\tURL"，失败时一行 ERROR，块末空行。
 */
public final class QueryReportWriter implements AutoCloseable {
    private final BufferedWriter writer;
    private final InvertedIndex index;
    private final int topResults;

    public QueryReportWriter(Writer writer, InvertedIndex index, int topResults) {
        if (writer == null || index == null) {
            throw new IllegalArgumentException("报告输出与索引不能为空");
        }
        this.writer = writer instanceof BufferedWriter bufferedWriter ? bufferedWriter : new BufferedWriter(writer);
        this.index = index;
        this.topResults = Math.max(topResults, 0);
    }

    /**
     * 写出一条查询的报告块。
     *
     * @param result 查询结果
     * @throws IOException 写入失败时抛出
     */
    public void write(SearchResult result) throws IOException {
        writer.write("QUERY\t" + result.query());
        writer.write('\n');
        writer.write("HITS\t" + result.totalMatches());
        writer.write('\n');
        if (!result.isSuccess()) {
            writer.write("ERROR\t" + result.error());
            writer.write('\n');
        } else {
            int written = 0;
            for (int docId : result.docIds()) {
                if (written >= topResults) {
                    break;
                }
                Optional<DocInfo> document = index.document(docId);
                if (document.isEmpty()) {
                    continue;
                }
                writer.write(document.get().title() + "\t" + document.get().url());
                writer.write('\n');
                written++;
            }
        }
        writer.write('\n');
    }

    @Override
    public void close() throws IOException {
        writer.close();
    }
}
