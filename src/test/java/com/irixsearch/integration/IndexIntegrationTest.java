package com.irixsearch.integration;

import com.irixsearch.index.BuildSummary;
import com.irixsearch.index.IndexBuildService;
import com.irixsearch.query.QueryEngine;
import com.irixsearch.query.SearchResult;
import com.irixsearch.storage.IndexLoader;
import com.irixsearch.storage.InvertedIndex;
import com.irixsearch.storage.TermEntry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.function.Predicate;
import java.util.stream.IntStream;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * 索引集成测试
 *
 * 覆盖完整流程：token 流 + 元数据 → 构建 → 写出 → 加载 → 布尔查询，结果与逐文档暴力匹配对照。
 */
class IndexIntegrationTest {
    private static final String[] VOCABULARY = {"alpha", "beta", "gamma", "delta", "Epsilon", "zeta", "eta", "theta"};
    private static final int DOCUMENTS = 200;

    @TempDir
    Path tempDir;

    private final Map<Integer, Set<String>> documentTerms = new TreeMap<>();
    private InvertedIndex index;
    private QueryEngine engine;
    private BuildSummary summary;

    @BeforeEach
    void setUp() throws IOException {
        Random random = new Random(42L);
        StringBuilder tokens = new StringBuilder();
        List<String> urlEntries = new ArrayList<>();
        for (int docId = 0; docId < DOCUMENTS; docId++) {
            Set<String> terms = new TreeSet<>();
            int count = random.nextInt(5);
            for (int index = 0; index < count; index++) {
                String token = VOCABULARY[random.nextInt(VOCABULARY.length)];
                tokens.append(docId).append('\t').append(token).append('\n');
                terms.add(token.toLowerCase());
            }
            documentTerms.put(docId, terms);
            urlEntries.add("{\"id\":" + docId + ",\"url_norm\":\"https:\\/\\/example.org\\/wiki\\/Page_" + docId + "\"}");
        }
        tokens.append("199 alpha\n");
        documentTerms.get(199).add("alpha");

        Path tokensFile = tempDir.resolve("tokens.txt");
        Files.writeString(tokensFile, tokens.toString(), StandardCharsets.UTF_8);
        Path metadataFile = tempDir.resolve("docs.json");
        Files.writeString(metadataFile, "[" + String.join(",", urlEntries) + "]", StandardCharsets.UTF_8);
        Path indexFile = tempDir.resolve("corpus.idx");

        summary = new IndexBuildService().build(tokensFile, indexFile, metadataFile);
        index = IndexLoader.load(indexFile);
        engine = new QueryEngine(index);
    }

    @Test
    void testMetadataAndForwardTable() {
        assertEquals(DOCUMENTS, index.documentCount());
        assertEquals(summary.metadata(), index.metadata());
        assertEquals("Page 17", index.document(17).orElseThrow().title());
        assertEquals("https://example.org/wiki/Page_17", index.document(17).orElseThrow().url());
        assertTrue(index.document(DOCUMENTS).isEmpty());
    }

    @Test
    void testPostingsMatchDocuments() {
        for (TermEntry entry : index.terms()) {
            int[] expected = matching(terms -> terms.contains(entry.term()));
            assertArrayEquals(expected, index.postings(entry.term()), entry.term());
            assertEquals(expected.length, entry.docFreq());
        }
        assertTrue(index.lookup("epsilon").isPresent());
    }

    @Test
    void testBooleanQueriesMatchBruteForce() {
        assertQuery("alpha beta", terms -> terms.contains("alpha") && terms.contains("beta"));
        assertQuery("alpha | beta & gamma",
            terms -> terms.contains("alpha") || (terms.contains("beta") && terms.contains("gamma")));
        assertQuery("(alpha | beta) & !gamma",
            terms -> (terms.contains("alpha") || terms.contains("beta")) && !terms.contains("gamma"));
        assertQuery("!(delta || EPSILON)", terms -> !terms.contains("delta") && !terms.contains("epsilon"));
        assertQuery("!!theta", terms -> terms.contains("theta"));
        assertQuery("zeta missing", terms -> false);
        assertQuery("!missing", terms -> true);
    }

    @Test
    void testFailedQueryHasNoHits() {
        SearchResult result = engine.search("alpha & (beta");
        assertEquals("Unmatched '('", result.error());
        assertEquals(0, result.totalMatches());
    }

    private void assertQuery(String query, Predicate<Set<String>> predicate) {
        SearchResult result = engine.search(query);
        assertTrue(result.isSuccess(), query);
        assertArrayEquals(matching(predicate), result.docIds(), query);
    }

    private int[] matching(Predicate<Set<String>> predicate) {
        return IntStream.range(0, DOCUMENTS)
            .filter(docId -> predicate.test(documentTerms.get(docId)))
            .toArray();
    }
}
