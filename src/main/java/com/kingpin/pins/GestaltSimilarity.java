package com.kingpin.pins;

import java.util.ArrayDeque;
import java.util.Deque;

/**
 * Ratcliff/Obershelp ("gestalt pattern matching") similarity: {@code 2 * M / (|a| + |b|)}, where M is the total
 * size of the matching blocks found by repeatedly taking the longest common substring and recursing on the
 * unmatched parts to its left and right.
 */
public class GestaltSimilarity implements StringSimilarity {

    @Override
    public double similarity(String a, String b) {
        int total = a.length() + b.length();
        if (total == 0) return 1.0;
        return 2.0 * matchingCharacters(a, b) / total;
    }

    static int matchingCharacters(String a, String b) {
        int matched = 0;
        Deque<int[]> pending = new ArrayDeque<>();
        pending.push(new int[]{0, a.length(), 0, b.length()});
        while (!pending.isEmpty()) {
            int[] range = pending.pop();
            int alo = range[0], ahi = range[1], blo = range[2], bhi = range[3];
            int[] match = longestMatch(a, alo, ahi, b, blo, bhi);
            int i = match[0], j = match[1], size = match[2];
            if (size == 0) continue;
            matched += size;
            if (alo < i && blo < j) pending.push(new int[]{alo, i, blo, j});
            if (i + size < ahi && j + size < bhi) pending.push(new int[]{i + size, ahi, j + size, bhi});
        }
        return matched;
    }

    // Earliest longest common substring of a[alo, ahi) and b[blo, bhi) as {i, j, size}
    private static int[] longestMatch(String a, int alo, int ahi, String b, int blo, int bhi) {
        int bestI = alo, bestJ = blo, bestSize = 0;
        int[] prev = new int[bhi - blo + 1];
        int[] cur = new int[bhi - blo + 1];
        for (int i = alo; i < ahi; i++) {
            for (int j = blo; j < bhi; j++) {
                int k = a.charAt(i) == b.charAt(j) ? prev[j - blo] + 1 : 0;
                cur[j - blo + 1] = k;
                if (k > bestSize) {
                    bestI = i - k + 1;
                    bestJ = j - k + 1;
                    bestSize = k;
                }
            }
            int[] swap = prev;
            prev = cur;
            cur = swap;
        }
        return new int[]{bestI, bestJ, bestSize};
    }
}
