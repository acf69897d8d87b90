package com.irixsearch.query;

import com.irixsearch.storage.InvertedIndex;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * 布尔查询引擎。
 *
 * 只读借用已加载索引，全集在构造时生成一次；每条查询的 token 与结果数组相互独立，可被多个线程并发调用。
 */
public class QueryEngine {
    private static final Logger logger = LoggerFactory.getLogger(QueryEngine.class);

    private final InvertedIndex index;
    private final RpnEvaluator evaluator;

    public QueryEngine(InvertedIndex index) {
        if (index == null) {
            throw new IllegalArgumentException("索引不能为空");
        }
        this.index = index;
        this.evaluator = new RpnEvaluator(index, PostingSets.universe(index.documentCount()));
    }

    /**
     * 执行一条查询并计时，语法或求值错误以失败结果返回而不抛出。
     *
     * @param queryString 查询行
     * @return 查询结果
     */
    public SearchResult search(String queryString) {
        long startNanos = System.nanoTime();
        try {
            int[] docIds = evaluate(queryString);
            return SearchResult.success(queryString, docIds, System.nanoTime() - startNanos);
        } catch (QueryParseException exception) {
            logger.debug("查询失败: query={}, position={}, error={}",
                queryString, exception.getPosition(), exception.getMessage());
            return SearchResult.failure(queryString, exception.getMessage(), System.nanoTime() - startNanos);
        }
    }

    /**
     * 解析并求值一条查询。不含任何词项的查询直接返回空集，不进入解析。
     *
     * @param queryString 查询行
     * @return 升序命中 docId
     * @throws QueryParseException 括号不匹配或运算符缺少操作数时抛出
     */
    public int[] evaluate(String queryString) {
        QueryParser parser = new QueryParser();
        List<LexToken> tokens = parser.insertImplicitAnd(new QueryLexer().tokenize(queryString));
        if (!QueryLexer.containsTerm(tokens)) {
            return new int[0];
        }
        List<LexToken> rpn = parser.toRpn(tokens);
        return evaluator.evaluate(rpn);
    }

    public InvertedIndex getIndex() {
        return index;
    }
}
