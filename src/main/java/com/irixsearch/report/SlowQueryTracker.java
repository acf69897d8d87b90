package com.irixsearch.report;

import java.io.PrintStream;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;

/**
 * 收集每条查询的耗时，全部查询结束后输出最慢的 N 条。
 */
public final class SlowQueryTracker {
    private static final String FOOTER = "--------------------------------";

    private final List<SlowQuery> records = new ArrayList<>(256);

    public void record(SlowQuery slowQuery) {
        records.add(slowQuery);
    }

    public int size() {
        return records.size();
    }

    /**
     * 按耗时降序返回前 topN 条，耗时相同时保持记录顺序。
     */
    public List<SlowQuery> slowest(int topN) {
        return records.stream()
            .sorted(Comparator.comparingDouble(SlowQuery::millis).reversed())
            .limit(Math.max(topN, 0))
            .toList();
    }

    /**
     * 输出慢查询表，没有执行过任何查询时不输出。
     *
     * @param topN 输出条数
     * @param out 诊断输出流
     */
    public void report(int topN, PrintStream out) {
        if (records.isEmpty()) {
            return;
        }
        List<SlowQuery> slowest = slowest(topN);
        out.println("---- TOP " + slowest.size() + " slowest queries ----");
        out.println("rank\tms\tline\thits\tquery");
        int rank = 1;
        for (SlowQuery slowQuery : slowest) {
            out.printf(Locale.ROOT, "%d\t%.3f\t%d\t%d\t%s%n",
                rank++, slowQuery.millis(), slowQuery.lineNumber(), slowQuery.hits(), slowQuery.query());
        }
        out.println(FOOTER);
    }
}
