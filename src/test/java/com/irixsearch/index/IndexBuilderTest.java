package com.irixsearch.index;

import com.irixsearch.storage.DocInfo;
import com.irixsearch.storage.IndexData;
import com.irixsearch.storage.TermEntry;
import com.irixsearch.text.Utf8LineReader;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class IndexBuilderTest {

    @Test
    @DisplayName("示例 token 流生成词典、倒排与正排")
    void testExampleScenario() throws IOException {
        IndexBuilder builder = new IndexBuilder();
        long accepted = builder.readTokens(reader("0 cat\n0 dog\n1 dog\n2 bird\n"));
        assertEquals(4, accepted);

        IndexData data = builder.build(List.of());
        assertEquals(List.of(
            new TermEntry("bird", 1, 0),
            new TermEntry("cat", 1, 4),
            new TermEntry("dog", 2, 8)
        ), data.dictionary());
        assertArrayEquals(new int[] {2, 0, 0, 1}, data.postings());
        assertEquals(3, data.metadata().documentCount());
        assertEquals(4, data.metadata().totalTokens());
        assertEquals(3, data.metadata().uniqueTerms());
        assertEquals(13.0 / 4.0, data.metadata().averageTermLength(), 1e-9);
        assertEquals(new DocInfo("", "Document 1"), data.documents().get(1));
    }

    @Test
    void testDuplicatePairsCollapsed() throws IOException {
        IndexBuilder builder = new IndexBuilder();
        builder.readTokens(reader("5 Cat\n5 cat\n5 CAT\n1 cat\n"));

        IndexData data = builder.build(List.of());
        assertEquals(List.of(new TermEntry("cat", 2, 0)), data.dictionary());
        assertArrayEquals(new int[] {1, 5}, data.postings());
        assertEquals(6, data.metadata().documentCount());
        assertEquals(4, data.metadata().totalTokens());
    }

    @Test
    void testMalformedLinesSkipped() throws IOException {
        IndexBuilder builder = new IndexBuilder();
        long accepted = builder.readTokens(reader("garbage\n\n  3   zebra trailing\nfoo bar\n0 apple\n"));
        assertEquals(2, accepted);
        assertEquals(2, builder.getTokenCount());
    }

    @Test
    @DisplayName("非法 UTF-8 行被跳过，不与其他词项合并")
    void testInvalidUtf8LinesSkipped() throws IOException {
        byte[] input = {'0', ' ', (byte) 0xC0, 'a', '\n', '1', ' ', (byte) 0xFF, 'a', '\n', '2', ' ', 'b', '\n'};
        IndexBuilder builder = new IndexBuilder();
        assertEquals(1, builder.readTokens(reader(input)));

        IndexData data = builder.build(List.of());
        assertEquals(List.of(new TermEntry("b", 1, 0)), data.dictionary());
        assertEquals(3, data.metadata().documentCount());
    }

    @Test
    void testLoneCarriageReturnDoesNotSplitLine() throws IOException {
        IndexBuilder builder = new IndexBuilder();
        assertEquals(2, builder.readTokens(reader("0 cat\rdog\r\n1 bird\r\n")));
        List<TermEntry> dictionary = builder.build(List.of()).dictionary();
        assertEquals(List.of("bird", "cat"), dictionary.stream().map(TermEntry::term).toList());
    }

    @Test
    void testDictionarySortedByUnsignedBytes() throws IOException {
        IndexBuilder builder = new IndexBuilder();
        builder.add(0, "é");
        builder.add(0, "z");
        builder.add(0, "Zeta");
        builder.add(1, "a");

        List<TermEntry> dictionary = builder.build(List.of()).dictionary();
        assertEquals(List.of("a", "z", "zeta", "é"), dictionary.stream().map(TermEntry::term).toList());
    }

    @Test
    void testUrlsAssignedPositionally() throws IOException {
        IndexBuilder builder = new IndexBuilder();
        builder.add(0, "a");
        builder.add(2, "b");

        IndexData data = builder.build(List.of("https://x.org/wiki/First", ""));
        assertEquals(new DocInfo("https://x.org/wiki/First", "First"), data.documents().get(0));
        assertEquals(new DocInfo("", "Document 1"), data.documents().get(1));
        assertEquals(new DocInfo("", "Document 2"), data.documents().get(2));
    }

    @Test
    void testNoTokensIsFatal() {
        IndexBuilder builder = new IndexBuilder();
        IndexBuildException exception = assertThrows(IndexBuildException.class, () -> builder.build(List.of()));
        assertTrue(exception.getMessage().contains("no tokens parsed"));
    }

    @Test
    void testTermTooLongIsFatal() {
        IndexBuilder builder = new IndexBuilder();
        builder.add(0, "x".repeat(65536));
        IndexBuildException exception = assertThrows(IndexBuildException.class, () -> builder.build(List.of()));
        assertTrue(exception.getMessage().contains("term too long"));
    }

    @Test
    void testDocIdBeyondSupportedRangeIsFatal() {
        IndexBuilder builder = new IndexBuilder();
        assertThrows(IndexBuildException.class, () -> builder.readTokens(reader("3000000000 big\n")));
    }

    @Test
    void testPostingsGrowBeyondInitialCapacity() throws IOException {
        IndexBuilder builder = new IndexBuilder();
        int documents = 70_000;
        for (int docId = documents - 1; docId >= 0; docId--) {
            builder.add(docId, "common");
        }

        IndexData data = builder.build(List.of());
        assertEquals(documents, data.dictionary().get(0).docFreq());
        int[] postings = data.postings();
        for (int index = 0; index < postings.length; index++) {
            assertEquals(index, postings[index]);
        }
    }

    private static Utf8LineReader reader(String text) {
        return reader(text.getBytes(StandardCharsets.UTF_8));
    }

    private static Utf8LineReader reader(byte[] bytes) {
        return new Utf8LineReader(new ByteArrayInputStream(bytes));
    }
}
