package com.irixsearch.index;

import com.irixsearch.config.Constants;
import com.irixsearch.storage.DocInfo;
import com.irixsearch.storage.IndexData;
import com.irixsearch.storage.IndexMetadata;
import com.irixsearch.storage.TermEntry;
import com.irixsearch.text.TermNormalizer;
import com.irixsearch.text.Utf8LineReader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * 布尔索引构建器。
 *
 * 收集 (term, docId) 对，按 (词项字节序, docId) 排序后逐词项分组，组内去除重复 docId，
 * 得到词典、拼接的倒排数组与正排表。词频在布尔索引中被丢弃。
 */
public final class IndexBuilder {
    private static final Logger logger = LoggerFactory.getLogger(IndexBuilder.class);
    private static final int INITIAL_PAIR_CAPACITY = 1 << 16;

    private final long startNanos = System.nanoTime();
    private final Map<String, Integer> termIds = new HashMap<>();
    private final List<String> terms = new ArrayList<>();
    private int[] pairTermIds = new int[INITIAL_PAIR_CAPACITY];
    private int[] pairDocIds = new int[INITIAL_PAIR_CAPACITY];
    private int pairCount;
    private long sumTokenBytes;
    private int maxDocId = -1;

    /**
     * 逐行读取 token 流，格式错误或非法 UTF-8 的行静默跳过。
     *
     * @param reader token 流
     * @return 接受的行数
     * @throws IOException 读取失败或 docId 超出范围时抛出
     */
    public long readTokens(Utf8LineReader reader) throws IOException {
        long accepted = 0;
        long invalidUtf8Lines = 0;
        Utf8LineReader.Line line;
        while ((line = reader.readLine()) != null) {
            if (!line.validUtf8()) {
                invalidUtf8Lines++;
                continue;
            }
            Optional<TokenRecord> parsed = TokenStreamParser.parseLine(line.text());
            if (parsed.isEmpty()) {
                continue;
            }
            TokenRecord tokenRecord = parsed.get();
            if (tokenRecord.docId() >= Integer.MAX_VALUE) {
                throw new IndexBuildException("docId 超出支持范围: " + tokenRecord.docId());
            }
            add((int) tokenRecord.docId(), tokenRecord.token());
            accepted++;
        }
        if (invalidUtf8Lines > 0) {
            logger.debug("跳过非法 UTF-8 行: count={}", invalidUtf8Lines);
        }
        return accepted;
    }

    /**
     * 添加一个 token 出现。
     *
     * @param docId 文档ID
     * @param token 原始 token，按 ASCII 小写归一化
     */
    public void add(int docId, String token) {
        if (docId < 0 || docId == Integer.MAX_VALUE) {
            throw new IllegalArgumentException("docId 非法: " + docId);
        }
        if (token == null || token.isEmpty()) {
            throw new IllegalArgumentException("token 不能为空");
        }
        String term = TermNormalizer.toLowerAscii(token);
        Integer termId = termIds.get(term);
        if (termId == null) {
            termId = terms.size();
            termIds.put(term, termId);
            terms.add(term);
        }
        ensurePairCapacity();
        pairTermIds[pairCount] = termId;
        pairDocIds[pairCount] = docId;
        pairCount++;
        sumTokenBytes += term.getBytes(StandardCharsets.UTF_8).length;
        maxDocId = Math.max(maxDocId, docId);
    }

    public long getTokenCount() {
        return pairCount;
    }

    /**
     * 生成索引内容，未提供 URL 的文档使用空 URL 与占位标题。
     *
     * @param urls 按 docId 排列的 URL，可为空列表
     * @return 可写出的索引内容
     * @throws IndexBuildException 没有任何 token 或存在超长词项时抛出
     */
    public IndexData build(List<String> urls) throws IndexBuildException {
        if (pairCount == 0) {
            throw new IndexBuildException("未解析到任何 token (no tokens parsed)");
        }
        int documentCount = maxDocId + 1;
        List<DocInfo> documents = buildForwardTable(documentCount, urls == null ? List.of() : urls);

        int[] termRanks = rankTerms();
        long[] sortedPairs = new long[pairCount];
        for (int index = 0; index < pairCount; index++) {
            sortedPairs[index] = ((long) termRanks[pairTermIds[index]] << 32) | pairDocIds[index];
        }
        Arrays.sort(sortedPairs);

        String[] termsByRank = new String[terms.size()];
        for (int termId = 0; termId < terms.size(); termId++) {
            termsByRank[termRanks[termId]] = terms.get(termId);
        }

        List<TermEntry> dictionary = new ArrayList<>(terms.size());
        int[] postings = new int[pairCount];
        int postingsCount = 0;
        int index = 0;
        while (index < pairCount) {
            int rank = (int) (sortedPairs[index] >>> 32);
            long postingsOffset = (long) postingsCount * Integer.BYTES;
            int lastDocId = -1;
            int docFreq = 0;
            while (index < pairCount && (int) (sortedPairs[index] >>> 32) == rank) {
                int docId = (int) sortedPairs[index];
                if (docId != lastDocId) {
                    postings[postingsCount++] = docId;
                    lastDocId = docId;
                    docFreq++;
                }
                index++;
            }
            dictionary.add(new TermEntry(termsByRank[rank], docFreq, postingsOffset));
        }

        double averageTermLength = (double) sumTokenBytes / pairCount;
        double buildMillis = (System.nanoTime() - startNanos) / 1_000_000.0;
        IndexMetadata metadata = new IndexMetadata(documentCount, pairCount, dictionary.size(), averageTermLength, buildMillis);
        logger.debug("索引构建完成: docs={}, tokens={}, terms={}, postings={}, elapsedMs={}",
            documentCount, pairCount, dictionary.size(), postingsCount, buildMillis);
        return new IndexData(metadata, dictionary, Arrays.copyOf(postings, postingsCount), documents);
    }

    /**
     * 计算每个词项在字节序中的名次，同时检查词项长度。
     */
    private int[] rankTerms() throws IndexBuildException {
        Integer[] order = new Integer[terms.size()];
        byte[][] termBytes = new byte[terms.size()][];
        for (int termId = 0; termId < terms.size(); termId++) {
            order[termId] = termId;
            termBytes[termId] = TermNormalizer.utf8(terms.get(termId));
            if (termBytes[termId].length > Constants.MAX_TERM_BYTES) {
                throw new IndexBuildException("词项过长 (term too long, >" + Constants.MAX_TERM_BYTES + " bytes): "
                    + terms.get(termId).substring(0, 64) + "...");
            }
        }
        Arrays.sort(order, Comparator.comparing((Integer termId) -> termBytes[termId], TermNormalizer::compareBytes));
        int[] ranks = new int[terms.size()];
        for (int rank = 0; rank < order.length; rank++) {
            ranks[order[rank]] = rank;
        }
        return ranks;
    }

    private List<DocInfo> buildForwardTable(int documentCount, List<String> urls) {
        List<DocInfo> documents = new ArrayList<>(documentCount);
        for (int docId = 0; docId < documentCount; docId++) {
            if (docId < urls.size()) {
                String url = urls.get(docId);
                documents.add(new DocInfo(url, UrlTitles.titleFor(docId, url)));
            } else {
                documents.add(new DocInfo("", UrlTitles.placeholder(docId)));
            }
        }
        return documents;
    }

    private void ensurePairCapacity() {
        if (pairCount < pairTermIds.length) {
            return;
        }
        int newCapacity = pairTermIds.length * 2;
        pairTermIds = Arrays.copyOf(pairTermIds, newCapacity);
        pairDocIds = Arrays.copyOf(pairDocIds, newCapacity);
    }
}
