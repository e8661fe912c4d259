package com.calai.glycemic.matcher;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.PriorityQueue;

/**
 * 只挑前 k 大（大小 k 的 min-heap），不對整個分數陣列排序；
 * 再只排序被挑出來的那 k 個。
 * 同分時 index 小的排前面，所以 k=5 的結果一定是 k=10 結果的前綴（分頁不重複不漏）。
 */
final class TopKSelector {
    private TopKSelector() {}

    static List<Integer> topIndices(double[] scores, int k) {
        int n = scores.length;
        int size = Math.min(k, n);
        if (size <= 0) return List.of();

        Comparator<Integer> betterFirst = (a, b) -> {
            int c = Double.compare(scores[b], scores[a]);
            return c != 0 ? c : Integer.compare(a, b);
        };

        // heap 頂端 = 目前入選者中最差的一個
        PriorityQueue<Integer> heap = new PriorityQueue<>(size, betterFirst.reversed());
        for (int i = 0; i < n; i++) {
            if (heap.size() < size) {
                heap.add(i);
            } else if (betterFirst.compare(i, heap.peek()) < 0) {
                heap.poll();
                heap.add(i);
            }
        }

        List<Integer> out = new ArrayList<>(heap);
        out.sort(betterFirst);
        return out;
    }
}
