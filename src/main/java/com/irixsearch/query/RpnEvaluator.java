package com.irixsearch.query;

import com.irixsearch.storage.InvertedIndex;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;

/**
 * 逆波兰式栈式求值器。
 *
 * 词项压入其倒排列表（不存在则为空集），NOT 对全集取补，AND/OR 先弹右操作数再弹左操作数。
 */
final class RpnEvaluator {
    private final InvertedIndex index;
    private final int[] universe;

    RpnEvaluator(InvertedIndex index, int[] universe) {
        this.index = index;
        this.universe = universe;
    }

    int[] evaluate(List<LexToken> rpn) {
        Deque<int[]> stack = new ArrayDeque<>();
        for (LexToken token : rpn) {
            switch (token.type()) {
                case TERM -> stack.push(index.postings(token.value()));
                case NOT -> {
                    if (stack.isEmpty()) {
                        throw new QueryParseException("NOT without operand", token.position());
                    }
                    stack.push(PostingSets.complement(universe, stack.pop()));
                }
                case AND, OR -> {
                    if (stack.size() < 2) {
                        throw new QueryParseException("Binary operator without 2 operands", token.position());
                    }
                    int[] right = stack.pop();
                    int[] left = stack.pop();
                    stack.push(token.type() == TokenType.AND
                        ? PostingSets.intersect(left, right)
                        : PostingSets.union(left, right));
                }
                default -> throw new QueryParseException("Unexpected token in RPN: " + token.value(),
                    token.position());
            }
        }
        if (stack.size() != 1) {
            throw new QueryParseException("Bad expression", -1);
        }
        return stack.pop();
    }
}
