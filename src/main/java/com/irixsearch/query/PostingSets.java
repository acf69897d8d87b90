package com.irixsearch.query;

import java.util.Arrays;

/**
 * 有序去重 docId 数组上的集合运算，均为线性双指针归并，输入不被修改。
 */
public final class PostingSets {
    private PostingSets() {
    }

    /**
     * 全集 {0, 1, ..., documentCount-1}。
     */
    public static int[] universe(int documentCount) {
        int[] universe = new int[documentCount];
        for (int docId = 0; docId < documentCount; docId++) {
            universe[docId] = docId;
        }
        return universe;
    }

    public static int[] intersect(int[] left, int[] right) {
        int[] result = new int[Math.min(left.length, right.length)];
        int size = 0;
        int leftIndex = 0;
        int rightIndex = 0;
        while (leftIndex < left.length && rightIndex < right.length) {
            int leftDoc = left[leftIndex];
            int rightDoc = right[rightIndex];
            if (leftDoc == rightDoc) {
                result[size++] = leftDoc;
                leftIndex++;
                rightIndex++;
            } else if (leftDoc < rightDoc) {
                leftIndex++;
            } else {
                rightIndex++;
            }
        }
        return Arrays.copyOf(result, size);
    }

    public static int[] union(int[] left, int[] right) {
        int[] result = new int[left.length + right.length];
        int size = 0;
        int leftIndex = 0;
        int rightIndex = 0;
        while (leftIndex < left.length && rightIndex < right.length) {
            int leftDoc = left[leftIndex];
            int rightDoc = right[rightIndex];
            if (leftDoc == rightDoc) {
                result[size++] = leftDoc;
                leftIndex++;
                rightIndex++;
            } else if (leftDoc < rightDoc) {
                result[size++] = leftDoc;
                leftIndex++;
            } else {
                result[size++] = rightDoc;
                rightIndex++;
            }
        }
        while (leftIndex < left.length) {
            result[size++] = left[leftIndex++];
        }
        while (rightIndex < right.length) {
            result[size++] = right[rightIndex++];
        }
        return Arrays.copyOf(result, size);
    }

    /**
     * 全集中不属于 operand 的元素，operand 中超出全集的 docId 被忽略。
     */
    public static int[] complement(int[] universe, int[] operand) {
        int[] result = new int[universe.length];
        int size = 0;
        int universeIndex = 0;
        int operandIndex = 0;
        while (universeIndex < universe.length && operandIndex < operand.length) {
            int universeDoc = universe[universeIndex];
            int operandDoc = operand[operandIndex];
            if (universeDoc == operandDoc) {
                universeIndex++;
                operandIndex++;
            } else if (universeDoc < operandDoc) {
                result[size++] = universeDoc;
                universeIndex++;
            } else {
                operandIndex++;
            }
        }
        while (universeIndex < universe.length) {
            result[size++] = universe[universeIndex++];
        }
        return Arrays.copyOf(result, size);
    }
}
