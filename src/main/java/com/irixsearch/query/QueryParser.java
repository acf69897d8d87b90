package com.irixsearch.query;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 * 布尔查询解析器：词法切分、插入隐式 AND、调度场算法转换为逆波兰式。
 *
 * 优先级 NOT(3) &gt; AND(2) &gt; OR(1)；NOT 右结合，AND/OR 左结合。
 */
public class QueryParser {

    /**
     * 前一个 token 为词项或右括号、当前 token 为词项、左括号或 NOT 时插入 AND，使 "a b" 等价于 "a &amp;&amp; b"。
     */
    public List<LexToken> insertImplicitAnd(List<LexToken> tokens) {
        List<LexToken> result = new ArrayList<>(tokens.size() * 2);
        for (LexToken current : tokens) {
            if (!result.isEmpty() && result.get(result.size() - 1).isOperandLike() && isImplicitAndStart(current.type())) {
                result.add(new LexToken(TokenType.AND, "&", current.position()));
            }
            result.add(current);
        }
        return result;
    }

    /**
     * 调度场算法，括号不匹配时抛出 {@link QueryParseException}。
     */
    public List<LexToken> toRpn(List<LexToken> tokens) {
        List<LexToken> output = new ArrayList<>(tokens.size());
        Deque<LexToken> operators = new ArrayDeque<>();
        int depth = 0;

        for (LexToken token : tokens) {
            switch (token.type()) {
                case TERM:
                    output.add(token);
                    break;
                case LPAREN:
                    operators.push(token);
                    depth++;
                    break;
                case RPAREN:
                    depth--;
                    if (depth < 0) {
                        throw new QueryParseException("Unmatched ')'", token.position());
                    }
                    while (!operators.isEmpty() && operators.peek().type() != TokenType.LPAREN) {
                        output.add(operators.pop());
                    }
                    if (operators.isEmpty()) {
                        throw new QueryParseException("Unmatched ')'", token.position());
                    }
                    operators.pop();
                    break;
                case NOT:
                case AND:
                case OR:
                    pushOperator(token, operators, output);
                    break;
                default:
                    throw new QueryParseException("Unknown token: " + token.value(), token.position());
            }
        }

        if (depth != 0) {
            throw new QueryParseException("Unmatched '('", unmatchedOpenPosition(operators));
        }
        while (!operators.isEmpty()) {
            LexToken operator = operators.pop();
            if (operator.type() == TokenType.LPAREN) {
                throw new QueryParseException("Unmatched '('", operator.position());
            }
            output.add(operator);
        }
        return output;
    }

    /**
     * 弹出优先级更高（或同级且当前运算符左结合）的栈顶运算符后压栈。
     */
    private void pushOperator(LexToken token, Deque<LexToken> operators, List<LexToken> output) {
        int precedence = precedence(token.type());
        while (!operators.isEmpty()) {
            TokenType topType = operators.peek().type();
            if (topType == TokenType.LPAREN) {
                break;
            }
            int topPrecedence = precedence(topType);
            if (topPrecedence > precedence || (topPrecedence == precedence && !isRightAssociative(token.type()))) {
                output.add(operators.pop());
            } else {
                break;
            }
        }
        operators.push(token);
    }

    static int precedence(TokenType type) {
        return switch (type) {
            case NOT -> 3;
            case AND -> 2;
            case OR -> 1;
            default -> 0;
        };
    }

    static boolean isRightAssociative(TokenType type) {
        return type == TokenType.NOT;
    }

    /**
     * 判断当前 token 是否可触发隐式 AND。
     */
    private boolean isImplicitAndStart(TokenType type) {
        return type == TokenType.TERM
                || type == TokenType.LPAREN
                || type == TokenType.NOT;
    }

    private int unmatchedOpenPosition(Deque<LexToken> operators) {
        for (LexToken operator : operators) {
            if (operator.type() == TokenType.LPAREN) {
                return operator.position();
            }
        }
        return -1;
    }
}
