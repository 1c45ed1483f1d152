package com.entity.integration.similarity;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Ratcliff/Obershelp "gestalt" similarity, computed the way classic diff tools do.
 *
 * <p>The matcher repeatedly finds the longest common block, then recurses into the
 * unmatched pieces on either side of it. The score is {@code 2*M / T}, where M is the
 * number of matched characters and T the combined length of both strings.</p>
 *
 * <p>For second strings of 200 or more characters, characters occurring in more than
 * 1% of positions are treated as "popular" and cannot start a match (the autojunk
 * heuristic); they can still extend one.</p>
 *
 * <p>The raw algorithm is not symmetric when several longest blocks tie, so the two
 * inputs are put in a canonical order before matching.</p>
 */
public class SequenceMatcherSimilarity implements SimilarityAlgorithm {

    private static final int AUTOJUNK_MIN_LENGTH = 200;

    @Override
    public double compute(String s1, String s2) {
        if (s1 == null || s2 == null) {
            return 0.0;
        }
        if (s1.equals(s2)) {
            return 1.0;
        }
        String first = s1.compareTo(s2) <= 0 ? s1 : s2;
        String second = first == s1 ? s2 : s1;

        int[] a = first.codePoints().toArray();
        int[] b = second.codePoints().toArray();
        int total = a.length + b.length;
        if (total == 0) {
            return 1.0;
        }
        return 2.0 * matchedLength(a, b) / total;
    }

    @Override
    public String getName() {
        return "SequenceMatcher";
    }

    /**
     * Sum of the sizes of all matching blocks between the two sequences.
     */
    int matchedLength(int[] a, int[] b) {
        Map<Integer, List<Integer>> b2j = indexPositions(b);
        int matched = 0;

        Deque<int[]> queue = new ArrayDeque<>();
        queue.push(new int[]{0, a.length, 0, b.length});
        while (!queue.isEmpty()) {
            int[] range = queue.pop();
            int alo = range[0];
            int ahi = range[1];
            int blo = range[2];
            int bhi = range[3];

            int[] match = findLongestMatch(a, b, b2j, alo, ahi, blo, bhi);
            int i = match[0];
            int j = match[1];
            int k = match[2];
            if (k > 0) {
                matched += k;
                if (alo < i && blo < j) {
                    queue.push(new int[]{alo, i, blo, j});
                }
                if (i + k < ahi && j + k < bhi) {
                    queue.push(new int[]{i + k, ahi, j + k, bhi});
                }
            }
        }
        return matched;
    }

    private Map<Integer, List<Integer>> indexPositions(int[] b) {
        Map<Integer, List<Integer>> b2j = new HashMap<>();
        for (int j = 0; j < b.length; j++) {
            b2j.computeIfAbsent(b[j], key -> new ArrayList<>()).add(j);
        }
        if (b.length >= AUTOJUNK_MIN_LENGTH) {
            int popularThreshold = b.length / 100 + 1;
            b2j.values().removeIf(positions -> positions.size() > popularThreshold);
        }
        return b2j;
    }

    /**
     * Finds the longest matching block in a[alo:ahi] and b[blo:bhi].
     * Ties go to the block starting earliest in a, then earliest in b.
     *
     * @return {i, j, size}
     */
    private int[] findLongestMatch(int[] a, int[] b, Map<Integer, List<Integer>> b2j,
                                   int alo, int ahi, int blo, int bhi) {
        int besti = alo;
        int bestj = blo;
        int bestSize = 0;

        Map<Integer, Integer> j2len = new HashMap<>();
        for (int i = alo; i < ahi; i++) {
            Map<Integer, Integer> newJ2len = new HashMap<>();
            List<Integer> positions = b2j.get(a[i]);
            if (positions != null) {
                for (int j : positions) {
                    if (j < blo) {
                        continue;
                    }
                    if (j >= bhi) {
                        break;
                    }
                    int k = j2len.getOrDefault(j - 1, 0) + 1;
                    newJ2len.put(j, k);
                    if (k > bestSize) {
                        besti = i - k + 1;
                        bestj = j - k + 1;
                        bestSize = k;
                    }
                }
            }
            j2len = newJ2len;
        }

        // popular characters cannot seed a block but may extend one
        while (besti > alo && bestj > blo && a[besti - 1] == b[bestj - 1]) {
            besti--;
            bestj--;
            bestSize++;
        }
        while (besti + bestSize < ahi && bestj + bestSize < bhi
                && a[besti + bestSize] == b[bestj + bestSize]) {
            bestSize++;
        }
        return new int[]{besti, bestj, bestSize};
    }
}
